package com.minitsdb.parser.statements;

import com.minitsdb.CommonConstant;
import com.minitsdb.parser.WhereCondition;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * TimeRange - 查询的时间范围
 *
 * 由QueryAnalyzer从WHERE条件中提取:
 * - startTime/endTime: 开始和结束时间
 * - startTimeSet/endTimeSet: 是否由用户显式指定(否则是默认值)
 * - residualCondition: 去掉时间条件之后剩下的WHERE条件
 *
 * 不可变对象。
 */
public final class TimeRange {

    private static final TimeRange UNRESOLVED =
            new TimeRange(CommonConstant.ZERO_TIME, false, CommonConstant.ZERO_TIME, false, null);

    private final Instant startTime;

    private final boolean startTimeSet;

    private final Instant endTime;

    private final boolean endTimeSet;

    /** 剩余的WHERE条件(没有剩余条件时为null) */
    private final WhereCondition residualCondition;

    public TimeRange(Instant startTime, boolean startTimeSet,
                     Instant endTime, boolean endTimeSet,
                     WhereCondition residualCondition) {
        this.startTime = Objects.requireNonNull(startTime, "startTime cannot be null");
        this.startTimeSet = startTimeSet;
        this.endTime = Objects.requireNonNull(endTime, "endTime cannot be null");
        this.endTimeSet = endTimeSet;
        this.residualCondition = residualCondition;
    }

    /**
     * 分析之前的状态: 两个时间都是零时间,都没有显式指定
     */
    public static TimeRange unresolved() {
        return UNRESOLVED;
    }

    public Instant getStartTime() {
        return startTime;
    }

    public boolean isStartTimeSet() {
        return startTimeSet;
    }

    public Instant getEndTime() {
        return endTime;
    }

    public boolean isEndTimeSet() {
        return endTimeSet;
    }

    public Optional<WhereCondition> getResidualCondition() {
        return Optional.ofNullable(residualCondition);
    }

    @Override
    public String toString() {
        return "TimeRange{" +
                "startTime=" + startTime + (startTimeSet ? "" : "(default)") +
                ", endTime=" + endTime + (endTimeSet ? "" : "(default)") +
                ", residualCondition=" + residualCondition +
                '}';
    }
}
