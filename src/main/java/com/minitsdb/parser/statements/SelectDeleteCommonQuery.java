package com.minitsdb.parser.statements;

import com.minitsdb.CommonConstant;
import com.minitsdb.parser.Statement;
import com.minitsdb.parser.Value;
import com.minitsdb.parser.WhereCondition;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * SelectDeleteCommonQuery - SELECT和DELETE的公共部分
 *
 * 两种语句都有:
 * - FROM子句
 * - 可选的WHERE条件
 * - 原始查询文本(用于生成带时间条件的查询文本)
 * - 时间范围(分析之前是TimeRange.unresolved())
 *
 * 设计原则:
 * - 不可变对象: 解析出时间范围后通过withTimeRange()得到新对象
 * - WHERE条件始终是原始的条件树,去掉时间条件后的剩余部分在TimeRange里
 */
public abstract class SelectDeleteCommonQuery implements Statement {

    private static final Pattern INTO_PATTERN = Pattern.compile("(?i)\\s+into\\s+");

    /** 原始查询文本 */
    private final String queryString;

    /** FROM子句 */
    private final FromClause fromClause;

    /** WHERE条件(如果没有WHERE子句则为null) */
    private final WhereCondition whereCondition;

    /** 时间范围 */
    private final TimeRange timeRange;

    protected SelectDeleteCommonQuery(String queryString, FromClause fromClause,
                                      WhereCondition whereCondition, TimeRange timeRange) {
        this.queryString = queryString != null ? queryString : "";
        this.fromClause = Objects.requireNonNull(fromClause, "fromClause cannot be null");
        this.whereCondition = whereCondition;
        this.timeRange = timeRange != null ? timeRange : TimeRange.unresolved();
    }

    /**
     * 返回带有新时间范围的副本
     *
     * @param timeRange 解析出的时间范围
     * @return 新的查询对象
     */
    public abstract SelectDeleteCommonQuery withTimeRange(TimeRange timeRange);

    public String getQueryString() {
        return queryString;
    }

    public FromClause getFromClause() {
        return fromClause;
    }

    public Optional<WhereCondition> getWhereCondition() {
        return Optional.ofNullable(whereCondition);
    }

    public TimeRange getTimeRange() {
        return timeRange;
    }

    public Instant getStartTime() {
        return timeRange.getStartTime();
    }

    public Instant getEndTime() {
        return timeRange.getEndTime();
    }

    /**
     * 判断查询结果是否只有一个序列
     *
     * 只有FROM子句是单个非正则表时才成立。
     */
    public boolean willReturnSingleSeries() {
        if (fromClause.getType() != FromClause.FromClauseType.ARRAY) {
            return false;
        }
        List<TableReference> tables = fromClause.getTables();
        if (tables.size() > 1) {
            return false;
        }
        return !tables.get(0).isRegex();
    }

    /**
     * 获取表在查询中使用的所有名称
     *
     * 每个同名的表贡献它的别名,没有别名则贡献表名本身。
     * 单个正则表的情况下,传入的名称就是它的名称。
     *
     * @param name 真实表名
     * @return 名称列表(表不在FROM子句中时为空)
     */
    public List<String> getTableAliases(String name) {
        List<TableReference> tables = fromClause.getTables();
        if (tables.size() == 1 && tables.get(0).getName().getType() == Value.ValueType.REGEX) {
            return List.of(name);
        }

        List<String> aliases = new ArrayList<>();
        for (TableReference table : tables) {
            if (!table.getName().getName().equals(name)) {
                continue;
            }
            aliases.add(table.getAlias().orElse(name));
        }
        return aliases;
    }

    /**
     * 生成带结束时间条件的查询文本
     *
     * 用户没有显式指定结束时间时,把默认的结束时间追加到查询文本上,
     * 这样在不同时间重放同一条查询会得到相同的结果。
     *
     * @return 查询文本
     */
    public String getQueryStringWithTimeCondition() {
        if (timeRange.isEndTimeSet()) {
            return queryString;
        }

        String condition = "time < " + toMicros(getEndTime()) + "u";
        if (whereCondition == null) {
            return queryString + " where " + condition;
        }
        return queryString + " and " + condition;
    }

    /**
     * 生成连续查询在某个时间窗口上执行的查询文本
     *
     * 去掉末尾的";"和INTO子句,再追加时间窗口条件。
     * 开始时间是零时间时只追加结束时间条件。
     *
     * @param start 窗口开始时间
     * @param end 窗口结束时间
     * @return 查询文本
     */
    public String getQueryStringForContinuousQuery(Instant start, Instant end) {
        String query = queryString;
        if (query.endsWith(";")) {
            query = query.substring(0, query.length() - 1);
        }
        query = INTO_PATTERN.split(query, 2)[0];

        query = query + (whereCondition == null ? " where " : " and ");

        String endCondition = "time < " + toMicros(end) + "u";
        if (CommonConstant.ZERO_TIME.equals(start)) {
            return query + endCondition;
        }
        return query + "time > " + (toMicros(start) - 1) + "u and " + endCondition;
    }

    private static long toMicros(Instant instant) {
        return ChronoUnit.MICROS.between(CommonConstant.ZERO_TIME, instant);
    }
}
