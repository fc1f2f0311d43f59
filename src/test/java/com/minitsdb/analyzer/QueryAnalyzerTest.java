package com.minitsdb.analyzer;

import com.minitsdb.CommonConstant;
import com.minitsdb.parser.QueryAnalysisException;
import com.minitsdb.parser.Value;
import com.minitsdb.parser.WhereCondition;
import com.minitsdb.parser.statements.DeleteQuery;
import com.minitsdb.parser.statements.FromClause;
import com.minitsdb.parser.statements.SelectQuery;
import com.minitsdb.parser.statements.TableReference;
import com.minitsdb.parser.statements.TimeRange;
import com.minitsdb.parser.values.BinaryValue;
import com.minitsdb.parser.values.FunctionCallValue;
import com.minitsdb.parser.values.LiteralValue;
import com.minitsdb.parser.values.Operator;
import com.minitsdb.parser.values.SimpleNameValue;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * QueryAnalyzerTest - 查询分析入口测试
 *
 * 时钟固定在2014-01-01T00:00:00Z,默认结束时间可以精确断言。
 */
@DisplayName("查询分析测试")
class QueryAnalyzerTest {

    private static final Instant NOW = Instant.parse("2014-01-01T00:00:00Z");

    private QueryAnalyzer analyzer;

    private TableReference cpu;

    @BeforeEach
    void setUp() {
        analyzer = new QueryAnalyzer(Clock.fixed(NOW, ZoneOffset.UTC));
        cpu = new TableReference(new SimpleNameValue("cpu"));
    }

    private static WhereCondition compare(String column, Operator op, Value value) {
        return WhereCondition.of(new BinaryValue(new SimpleNameValue(column), op, value));
    }

    private static Value nowMinus(String duration) {
        return new BinaryValue(new FunctionCallValue("now"), Operator.SUBTRACT, LiteralValue.duration(duration));
    }

    private SelectQuery select(String queryString, WhereCondition where) {
        return new SelectQuery(queryString, List.of(new SimpleNameValue("value")), FromClause.array(cpu),
                where, List.of());
    }

    @Test
    @DisplayName("测试没有WHERE条件时使用默认时间")
    void testNoWhereCondition() {
        SelectQuery analyzed = analyzer.analyze(select("select value from cpu", null));
        TimeRange range = analyzed.getTimeRange();

        assertEquals(CommonConstant.ZERO_TIME, analyzed.getStartTime());
        assertFalse(range.isStartTimeSet());
        assertEquals(NOW, analyzed.getEndTime());
        assertFalse(range.isEndTimeSet());
        assertTrue(range.getResidualCondition().isEmpty());
    }

    @Test
    @DisplayName("测试开始时间、结束时间和剩余条件")
    void testStartEndAndResidual() {
        WhereCondition host = compare("host", Operator.EQUAL, LiteralValue.string("srv1"));
        WhereCondition where = WhereCondition.and(
                WhereCondition.and(
                        compare("time", Operator.GREATER_THAN, nowMinus("1h")),
                        compare("time", Operator.LESS_THAN, new FunctionCallValue("now"))),
                host);

        SelectQuery query = select("select value from cpu", where);
        SelectQuery analyzed = analyzer.analyze(query);
        TimeRange range = analyzed.getTimeRange();

        assertEquals(Instant.parse("2013-12-31T23:00:00Z"), range.getStartTime());
        assertTrue(range.isStartTimeSet());
        assertEquals(NOW, range.getEndTime());
        assertTrue(range.isEndTimeSet());
        assertSame(host, range.getResidualCondition().orElseThrow());

        // 原始条件树保持不变
        assertSame(where, analyzed.getWhereCondition().orElseThrow());
        assertSame(TimeRange.unresolved(), query.getTimeRange());
    }

    @Test
    @DisplayName("测试time =同时确定开始和结束时间")
    void testTimeEquality() {
        WhereCondition where = compare("time", Operator.EQUAL, LiteralValue.string("2009-11-10 23:00:00"));

        TimeRange range = analyzer.analyze(select("", where)).getTimeRange();

        Instant expected = Instant.parse("2009-11-10T23:00:00Z");
        assertEquals(expected, range.getStartTime());
        assertEquals(expected, range.getEndTime());
        assertTrue(range.isStartTimeSet());
        assertTrue(range.isEndTimeSet());
        assertTrue(range.getResidualCondition().isEmpty());
    }

    @Test
    @DisplayName("测试开始时间晚于结束时间")
    void testInvalidTimeRange() {
        WhereCondition where = WhereCondition.and(
                compare("time", Operator.GREATER_THAN, LiteralValue.string("2009-11-11")),
                compare("time", Operator.LESS_THAN, LiteralValue.string("2009-11-10")));

        QueryAnalysisException e = assertThrows(QueryAnalysisException.class,
                () -> analyzer.analyze(select("", where)));
        assertEquals(QueryAnalysisException.ErrorKind.INVALID_TIME_RANGE, e.getKind());
    }

    @Test
    @DisplayName("测试只指定开始时间时不检查时间范围")
    void testStartAfterDefaultEnd() {
        WhereCondition where = compare("time", Operator.GREATER_THAN, LiteralValue.string("2020-01-01"));

        TimeRange range = analyzer.analyze(select("", where)).getTimeRange();

        assertEquals(Instant.parse("2020-01-01T00:00:00Z"), range.getStartTime());
        assertEquals(NOW, range.getEndTime());
        assertFalse(range.isEndTimeSet());
    }

    @Test
    @DisplayName("测试分析错误向上传播")
    void testErrorPropagation() {
        WhereCondition where = compare("time", Operator.GREATER_THAN,
                new FunctionCallValue("mean", new SimpleNameValue("value")));

        QueryAnalysisException e = assertThrows(QueryAnalysisException.class,
                () -> analyzer.analyze(select("", where)));
        assertEquals(QueryAnalysisException.ErrorKind.INVALID_FUNCTION_IN_TIME_CONTEXT, e.getKind());
    }

    @Test
    @DisplayName("测试DELETE查询的时间范围")
    void testDeleteQuery() {
        WhereCondition where = compare("time", Operator.LESS_THAN, nowMinus("30d"));
        DeleteQuery query = new DeleteQuery("delete from cpu where time < now() - 30d", FromClause.array(cpu), where);

        DeleteQuery analyzed = analyzer.analyze(query);

        assertEquals(CommonConstant.ZERO_TIME, analyzed.getStartTime());
        assertEquals(Instant.parse("2013-12-02T00:00:00Z"), analyzed.getEndTime());
        assertTrue(analyzed.getTimeRange().isEndTimeSet());
        assertEquals(query.getQueryString(), analyzed.getQueryString());
    }

    @Test
    @DisplayName("测试分析后生成带时间条件的查询文本")
    void testQueryStringWithTimeCondition() {
        WhereCondition where = compare("host", Operator.EQUAL, LiteralValue.string("srv1"));
        SelectQuery analyzed = analyzer.analyze(select("select value from cpu where host = 'srv1'", where));

        assertEquals("select value from cpu where host = 'srv1' and time < 1388534400000000u",
                analyzed.getQueryStringWithTimeCondition());

        WhereCondition explicitEnd = compare("time", Operator.LESS_THAN, new FunctionCallValue("now"));
        SelectQuery withEnd = analyzer.analyze(select("select value from cpu where time < now()", explicitEnd));
        assertEquals("select value from cpu where time < now()", withEnd.getQueryStringWithTimeCondition());
    }

    @Test
    @DisplayName("测试列引用解析")
    void testGetReferencedColumns() {
        WhereCondition where = compare("host", Operator.EQUAL, LiteralValue.string("srv1"));
        SelectQuery analyzed = analyzer.analyze(select("", where));

        Map<Value, List<String>> columns = analyzer.getReferencedColumns(analyzed);

        assertEquals(Map.of(cpu.getName(), List.of("host", "value")), columns);
    }
}
