package com.minitsdb.analyzer;

import com.minitsdb.CommonConstant;
import com.minitsdb.parser.QueryAnalysisException;
import com.minitsdb.parser.QueryAnalysisException.ErrorKind;
import com.minitsdb.parser.Value;
import com.minitsdb.parser.WhereCondition;
import com.minitsdb.parser.values.BinaryValue;
import com.minitsdb.parser.values.FunctionCallValue;
import com.minitsdb.parser.values.LiteralValue;
import com.minitsdb.parser.values.Operator;
import com.minitsdb.parser.values.SimpleNameValue;
import com.minitsdb.parser.values.WildcardValue;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

/**
 * TimeBoundExtractorTest - 时间边界提取器测试
 *
 * 测试:
 * - 单个时间条件在开始/结束模式下是否被消耗
 * - time在左边/右边时的方向规则
 * - AND/OR组合时间的规则
 * - 各种非法条件
 * - 两次提取共享同一棵树时不修改原树
 */
@DisplayName("时间边界提取器测试")
class TimeBoundExtractorTest {

    private static final Instant NOW = Instant.parse("2014-01-01T00:00:00Z");

    private static final Instant NOV_10 = Instant.parse("2009-11-10T00:00:00Z");

    private static final Instant NOV_12 = Instant.parse("2009-11-12T00:00:00Z");

    private TimeBoundExtractor extractor;

    @BeforeEach
    void setUp() {
        extractor = new TimeBoundExtractor(new TimeExpressionEvaluator(Clock.fixed(NOW, ZoneOffset.UTC)));
    }

    private static Value time() {
        return new SimpleNameValue("time");
    }

    private static WhereCondition compare(Value left, Operator op, Value right) {
        return WhereCondition.of(new BinaryValue(left, op, right));
    }

    private static WhereCondition hostIs(String host) {
        return compare(new SimpleNameValue("host"), Operator.EQUAL, LiteralValue.string(host));
    }

    @Test
    @DisplayName("测试没有WHERE条件")
    void testNoCondition() {
        TimeBoundExtractor.Extraction result = extractor.extract(null, true);

        assertTrue(result.getCondition().isEmpty());
        assertEquals(CommonConstant.ZERO_TIME, result.getTime());
        assertFalse(result.hasTime());
    }

    @Test
    @DisplayName("测试 time > T 只作为开始时间")
    void testGreaterThanIsStartTime() {
        WhereCondition where = compare(time(), Operator.GREATER_THAN, LiteralValue.string("2009-11-10"));

        TimeBoundExtractor.Extraction start = extractor.extract(where, true);
        assertTrue(start.getCondition().isEmpty());
        assertEquals(NOV_10, start.getTime());

        TimeBoundExtractor.Extraction end = extractor.extract(where, false);
        assertSame(where, end.getCondition().orElseThrow());
        assertEquals(CommonConstant.ZERO_TIME, end.getTime());
    }

    @Test
    @DisplayName("测试 time < now() 只作为结束时间")
    void testLessThanIsEndTime() {
        WhereCondition where = compare(time(), Operator.LESS_THAN, new FunctionCallValue("now"));

        TimeBoundExtractor.Extraction end = extractor.extract(where, false);
        assertTrue(end.getCondition().isEmpty());
        assertEquals(NOW, end.getTime());

        TimeBoundExtractor.Extraction start = extractor.extract(where, true);
        assertSame(where, start.getCondition().orElseThrow());
        assertFalse(start.hasTime());
    }

    @Test
    @DisplayName("测试time在右边时方向相反")
    void testTimeOnRight() {
        Value oneHourAgo = new BinaryValue(new FunctionCallValue("now"), Operator.SUBTRACT, LiteralValue.duration("1h"));
        WhereCondition lessThanTime = compare(oneHourAgo, Operator.LESS_THAN, time());
        WhereCondition greaterThanTime = compare(oneHourAgo, Operator.GREATER_THAN, time());

        assertEquals(NOW.minus(Duration.ofHours(1)), extractor.extract(lessThanTime, true).getTime());
        assertFalse(extractor.extract(lessThanTime, false).hasTime());

        assertEquals(NOW.minus(Duration.ofHours(1)), extractor.extract(greaterThanTime, false).getTime());
        assertFalse(extractor.extract(greaterThanTime, true).hasTime());
    }

    @Test
    @DisplayName("测试两边都是简单值时右边是字面量则time在左边")
    void testTieBreakBetweenPlainOperands() {
        // 5s < time: 右边不是字面量,time在右边
        WhereCondition where = compare(LiteralValue.duration("5s"), Operator.LESS_THAN, time());

        TimeBoundExtractor.Extraction start = extractor.extract(where, true);
        assertTrue(start.getCondition().isEmpty());
        assertEquals(Instant.ofEpochSecond(5), start.getTime());
    }

    @Test
    @DisplayName("测试 time = T 在两种模式下都被消耗")
    void testEqualityConsumedForBothBounds() {
        WhereCondition where = compare(time(), Operator.EQUAL, LiteralValue.string("2009-11-10 00:00:01"));
        Instant expected = NOV_10.plusSeconds(1);

        TimeBoundExtractor.Extraction start = extractor.extract(where, true);
        TimeBoundExtractor.Extraction end = extractor.extract(where, false);

        assertTrue(start.getCondition().isEmpty());
        assertTrue(end.getCondition().isEmpty());
        assertEquals(expected, start.getTime());
        assertEquals(expected, end.getTime());
    }

    @Test
    @DisplayName("测试非时间条件保持不变")
    void testNonTimeConditionUntouched() {
        WhereCondition host = hostIs("srv1");
        WhereCondition reversed = compare(LiteralValue.string("srv1"), Operator.EQUAL, new SimpleNameValue("host"));
        WhereCondition value = compare(new SimpleNameValue("value"), Operator.GREATER_EQUAL, LiteralValue.integer(5));
        WhereCondition bareName = WhereCondition.of(new SimpleNameValue("active"));

        for (WhereCondition where : new WhereCondition[]{host, reversed, value, bareName}) {
            TimeBoundExtractor.Extraction result = extractor.extract(where, true);
            assertSame(where, result.getCondition().orElseThrow());
            assertFalse(result.hasTime());
        }
    }

    @Test
    @DisplayName("测试裸函数调用原样保留")
    void testBareFunctionCallUntouched() {
        WhereCondition where = WhereCondition.of(new FunctionCallValue("exists", new SimpleNameValue("value")));

        TimeBoundExtractor.Extraction result = extractor.extract(where, false);

        assertSame(where, result.getCondition().orElseThrow());
        assertFalse(result.hasTime());
    }

    @Test
    @DisplayName("测试AND组合: 开始时间取较早的,结束时间取较晚的")
    void testAndCombination() {
        WhereCondition starts = WhereCondition.and(
                compare(time(), Operator.GREATER_THAN, LiteralValue.string("2009-11-12")),
                compare(time(), Operator.GREATER_THAN, LiteralValue.string("2009-11-10")));
        WhereCondition ends = WhereCondition.and(
                compare(time(), Operator.LESS_THAN, LiteralValue.string("2009-11-10")),
                compare(time(), Operator.LESS_THAN, LiteralValue.string("2009-11-12")));

        TimeBoundExtractor.Extraction start = extractor.extract(starts, true);
        assertEquals(NOV_10, start.getTime());
        assertTrue(start.getCondition().isEmpty());

        TimeBoundExtractor.Extraction end = extractor.extract(ends, false);
        assertEquals(NOV_12, end.getTime());
        assertTrue(end.getCondition().isEmpty());
    }

    @Test
    @DisplayName("测试AND组合时剩下非时间条件")
    void testAndKeepsResidual() {
        WhereCondition host = hostIs("srv1");
        WhereCondition timeCondition = compare(time(), Operator.GREATER_THAN, LiteralValue.string("2009-11-10"));
        WhereCondition where = WhereCondition.and(timeCondition, host);

        TimeBoundExtractor.Extraction start = extractor.extract(where, true);
        assertSame(host, start.getCondition().orElseThrow());
        assertEquals(NOV_10, start.getTime());

        TimeBoundExtractor.Extraction end = extractor.extract(where, false);
        assertSame(where, end.getCondition().orElseThrow());
        assertFalse(end.hasTime());
    }

    @Test
    @DisplayName("测试嵌套条件只重建变化的路径")
    void testNestedRewriteSharesUntouchedSubtrees() {
        WhereCondition host = hostIs("srv1");
        WhereCondition region = compare(new SimpleNameValue("region"), Operator.EQUAL, LiteralValue.string("us"));
        WhereCondition hostOrRegion = WhereCondition.or(host, region);
        WhereCondition inner = WhereCondition.and(
                compare(time(), Operator.GREATER_THAN, LiteralValue.string("2009-11-10")), hostOrRegion);
        WhereCondition value = compare(new SimpleNameValue("value"), Operator.GREATER_THAN, LiteralValue.integer(1));
        WhereCondition where = WhereCondition.and(inner, value);

        TimeBoundExtractor.Extraction start = extractor.extract(where, true);

        WhereCondition rewritten = start.getCondition().orElseThrow();
        assertNotSame(where, rewritten);
        assertSame(hostOrRegion, rewritten.getLeft().orElseThrow());
        assertSame(value, rewritten.getRight().orElseThrow());
        assertEquals(NOV_10, start.getTime());
    }

    @Test
    @DisplayName("测试OR两边都有时间时报错")
    void testOrWithTwoTimes() {
        WhereCondition where = WhereCondition.or(
                compare(time(), Operator.GREATER_THAN, LiteralValue.string("2009-11-10")),
                compare(time(), Operator.GREATER_THAN, LiteralValue.string("2009-11-12")));

        QueryAnalysisException e = assertThrows(QueryAnalysisException.class, () -> extractor.extract(where, true));

        assertEquals(ErrorKind.CONFLICTING_OR_TIME_BOUNDS, e.getKind());
    }

    @Test
    @DisplayName("测试OR只有一边有时间")
    void testOrWithOneTime() {
        WhereCondition host = hostIs("srv1");
        WhereCondition where = WhereCondition.or(
                compare(time(), Operator.GREATER_THAN, LiteralValue.string("2009-11-10")), host);

        TimeBoundExtractor.Extraction start = extractor.extract(where, true);

        assertSame(host, start.getCondition().orElseThrow());
        assertEquals(NOV_10, start.getTime());
    }

    @Test
    @DisplayName("测试OR的两边分别是开始和结束时间")
    void testOrWithStartAndEnd() {
        WhereCondition where = WhereCondition.or(
                compare(time(), Operator.GREATER_THAN, LiteralValue.string("2009-11-10")),
                compare(time(), Operator.LESS_THAN, LiteralValue.string("2009-11-12")));

        assertEquals(NOV_10, extractor.extract(where, true).getTime());
        assertEquals(NOV_12, extractor.extract(where, false).getTime());
    }

    @Test
    @DisplayName("测试裸字面量作为WHERE条件")
    void testBareLiteral() {
        for (Value literal : new Value[]{LiteralValue.integer(5), LiteralValue.string("x"),
                LiteralValue.duration("1h"), LiteralValue.floating("1.5"), new WildcardValue()}) {
            QueryAnalysisException e = assertThrows(QueryAnalysisException.class,
                    () -> extractor.extract(WhereCondition.of(literal), true));
            assertEquals(ErrorKind.INVALID_WHERE_EXPRESSION, e.getKind());
        }
    }

    @Test
    @DisplayName("测试time使用不支持的比较运算符")
    void testInvalidTimeOperator() {
        WhereCondition where = compare(time(), Operator.GREATER_EQUAL, LiteralValue.string("2009-11-10"));

        QueryAnalysisException e = assertThrows(QueryAnalysisException.class, () -> extractor.extract(where, false));

        assertEquals(ErrorKind.INVALID_TIME_OPERATOR, e.getKind());
    }

    @Test
    @DisplayName("测试比较两边都是time")
    void testTimeOnBothSides() {
        WhereCondition where = compare(time(), Operator.GREATER_THAN, time());

        QueryAnalysisException e = assertThrows(QueryAnalysisException.class, () -> extractor.extract(where, true));

        assertEquals(ErrorKind.INVALID_TIME_CONDITION, e.getKind());
    }

    @Test
    @DisplayName("测试超出范围的时间值")
    void testTimeValuesOutOfRange() {
        WhereCondition farEnd = compare(time(), Operator.LESS_THAN, LiteralValue.string("2300-01-01"));
        WhereCondition farStart = compare(time(), Operator.GREATER_THAN, new BinaryValue(
                new FunctionCallValue("now"), Operator.ADD, LiteralValue.duration("290y")));

        assertEquals(ErrorKind.INVALID_TIME_STRING,
                assertThrows(QueryAnalysisException.class, () -> extractor.extract(farEnd, false)).getKind());
        assertEquals(ErrorKind.INVALID_TIME_DURATION,
                assertThrows(QueryAnalysisException.class, () -> extractor.extract(farStart, true)).getKind());
    }

    @Test
    @DisplayName("测试时间值中的非法函数和日期")
    void testInvalidTimeValues() {
        WhereCondition badFunction = compare(time(), Operator.GREATER_THAN, new FunctionCallValue("mean"));
        WhereCondition badString = compare(time(), Operator.GREATER_THAN, LiteralValue.string("not-a-date"));

        assertEquals(ErrorKind.INVALID_FUNCTION_IN_TIME_CONTEXT,
                assertThrows(QueryAnalysisException.class, () -> extractor.extract(badFunction, true)).getKind());
        assertEquals(ErrorKind.INVALID_TIME_STRING,
                assertThrows(QueryAnalysisException.class, () -> extractor.extract(badString, true)).getKind());
    }

    @Test
    @DisplayName("测试两次提取不修改共享的条件树")
    void testSharedTreeNotMutated() {
        WhereCondition host = hostIs("srv1");
        WhereCondition startCondition = compare(time(), Operator.GREATER_THAN, LiteralValue.string("2009-11-10"));
        WhereCondition endCondition = compare(time(), Operator.LESS_THAN, LiteralValue.string("2009-11-12"));
        WhereCondition timeRange = WhereCondition.and(startCondition, endCondition);
        WhereCondition where = WhereCondition.and(timeRange, host);
        String before = where.toString();

        TimeBoundExtractor.Extraction start = extractor.extract(where, true);
        TimeBoundExtractor.Extraction end = extractor.extract(where, false);

        assertEquals(before, where.toString());
        assertSame(timeRange, where.getLeft().orElseThrow());
        assertSame(startCondition, timeRange.getLeft().orElseThrow());
        assertSame(endCondition, timeRange.getRight().orElseThrow());

        assertEquals("(time < '2009-11-12') AND (host = 'srv1')", start.getCondition().orElseThrow().toString());
        assertEquals("(time > '2009-11-10') AND (host = 'srv1')", end.getCondition().orElseThrow().toString());
        assertEquals(NOV_10, start.getTime());
        assertEquals(NOV_12, end.getTime());
    }
}
