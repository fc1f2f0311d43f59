package com.minitsdb.analyzer;

import com.minitsdb.CommonConstant;
import com.minitsdb.parser.QueryAnalysisException;
import com.minitsdb.parser.QueryAnalysisException.ErrorKind;
import com.minitsdb.parser.Value;
import com.minitsdb.parser.WhereCondition;
import com.minitsdb.parser.statements.DeleteQuery;
import com.minitsdb.parser.statements.SelectDeleteCommonQuery;
import com.minitsdb.parser.statements.SelectQuery;
import com.minitsdb.parser.statements.TimeRange;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * QueryAnalyzer - 查询分析入口
 *
 * 把解析好的查询交给两个分析组件:
 * - TimeBoundExtractor: 求出开始/结束时间和剩余的WHERE条件
 * - ColumnReferenceResolver: 求出每个表需要读取的列
 *
 * 两个结果交给存储层的扫描计划使用。
 *
 * 时间范围规则:
 * - 开始时间和结束时间都在原始WHERE条件上提取
 * - 剩余条件 = 原始条件去掉开始时间条件,再去掉结束时间条件
 * - 没有开始时间: ZERO_TIME; 没有结束时间: 当前时间
 * - 两个时间都显式指定时,开始时间不能晚于结束时间
 *
 * 使用示例:
 * <pre>
 * QueryAnalyzer analyzer = new QueryAnalyzer();
 * SelectQuery analyzed = analyzer.analyze(query);
 * Instant start = analyzed.getStartTime();
 * Map&lt;Value, List&lt;String&gt;&gt; columns = analyzer.getReferencedColumns(analyzed);
 * </pre>
 *
 * 线程安全: 没有可变状态,一个实例可以被多个线程同时使用。
 */
public class QueryAnalyzer {

    private static final Logger logger = LoggerFactory.getLogger(QueryAnalyzer.class);

    private final Clock clock;

    private final TimeBoundExtractor timeBoundExtractor;

    private final ColumnReferenceResolver columnReferenceResolver;

    public QueryAnalyzer() {
        this(Clock.systemUTC());
    }

    public QueryAnalyzer(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock cannot be null");
        this.timeBoundExtractor = new TimeBoundExtractor(new TimeExpressionEvaluator(clock));
        this.columnReferenceResolver = new ColumnReferenceResolver();
    }

    /**
     * 分析SELECT查询的时间范围
     *
     * @param query 查询
     * @return 带有时间范围的新查询对象
     */
    public SelectQuery analyze(SelectQuery query) {
        return query.withTimeRange(resolveTimeRange(query));
    }

    /**
     * 分析DELETE查询的时间范围
     *
     * @param query 查询
     * @return 带有时间范围的新查询对象
     */
    public DeleteQuery analyze(DeleteQuery query) {
        return query.withTimeRange(resolveTimeRange(query));
    }

    /**
     * 求出查询的时间范围
     *
     * @param query SELECT或DELETE查询
     * @return 时间范围
     * @throws QueryAnalysisException 时间条件不合法
     */
    public TimeRange resolveTimeRange(SelectDeleteCommonQuery query) {
        WhereCondition condition = query.getWhereCondition().orElse(null);

        TimeBoundExtractor.Extraction start = timeBoundExtractor.extract(condition, true);
        TimeBoundExtractor.Extraction end = timeBoundExtractor.extract(condition, false);
        WhereCondition residual = timeBoundExtractor
                .extract(start.getCondition().orElse(null), false)
                .getCondition()
                .orElse(null);

        boolean startTimeSet = start.hasTime();
        boolean endTimeSet = end.hasTime();
        Instant startTime = startTimeSet ? start.getTime() : CommonConstant.ZERO_TIME;
        Instant endTime = endTimeSet ? end.getTime() : clock.instant();

        if (startTimeSet && endTimeSet && startTime.isAfter(endTime)) {
            throw new QueryAnalysisException(ErrorKind.INVALID_TIME_RANGE,
                    "Start time " + startTime + " is after end time " + endTime);
        }

        TimeRange timeRange = new TimeRange(startTime, startTimeSet, endTime, endTimeSet, residual);
        logger.debug("Resolved {} for query '{}'", timeRange, query.getQueryString());
        return timeRange;
    }

    /**
     * 计算每个表需要读取的列
     *
     * 使用原始WHERE条件: 时间条件的另一侧都是字面量,不会引入额外的列。
     *
     * @param query SELECT查询
     * @return 表 → 列名列表
     */
    public Map<Value, List<String>> getReferencedColumns(SelectQuery query) {
        return columnReferenceResolver.getReferencedColumns(query);
    }
}
