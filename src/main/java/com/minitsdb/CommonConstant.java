package com.minitsdb;

import java.time.Instant;

/**
 * CommonConstant - 全局常量
 *
 * 查询分析层共享的常量,初始化后不再修改,可以被多个线程同时读取。
 */
public final class CommonConstant {

    /** 时间序列的合成时间列 */
    public static final String TIME_COLUMN = "time";

    /** 时间序列的合成序列号列 */
    public static final String SEQUENCE_NUMBER_COLUMN = "sequence_number";

    /** 唯一允许出现在时间表达式中的函数 */
    public static final String NOW_FUNCTION = "now";

    /** 通配符列名 */
    public static final String WILDCARD = "*";

    /**
     * "零时间"哨兵值
     *
     * 表示没有提取到时间边界,不是一个真实的查询时间。
     */
    public static final Instant ZERO_TIME = Instant.EPOCH;

    private CommonConstant() {
    }
}
