package com.minitsdb.analyzer;

import com.minitsdb.CommonConstant;
import com.minitsdb.parser.QueryAnalysisException;
import com.minitsdb.parser.QueryAnalysisException.ErrorKind;
import com.minitsdb.parser.Value;
import com.minitsdb.parser.WhereCondition;
import com.minitsdb.parser.values.BinaryValue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * TimeBoundExtractor - 时间边界提取器
 *
 * 递归遍历WHERE条件树,找出形如 time OP 值 的条件,
 * 从树中去掉这些条件,同时求出开始时间或结束时间。
 *
 * 规则:
 * - time > X / X < time: 开始时间
 * - time < X / X > time: 结束时间
 * - time = X: 既是开始时间也是结束时间,两种模式下都会被去掉
 * - AND: 两边都有时间时,开始时间取较早的,结束时间取较晚的
 * - OR: 两边不能同时带有时间
 *
 * 设计原则:
 * - 不修改输入: 开始时间和结束时间是对同一棵树分别提取的,
 *   改写时只创建新节点,没变的子树直接共享
 * - 错误直接抛给调用方,不记录日志
 *
 * 使用示例:
 * <pre>
 * TimeBoundExtractor extractor = new TimeBoundExtractor(new TimeExpressionEvaluator());
 * Extraction start = extractor.extract(where, true);
 * start.getCondition();  // 去掉开始时间条件后的树
 * start.getTime();       // 开始时间,没有则是ZERO_TIME
 * </pre>
 */
public class TimeBoundExtractor {

    private static final Logger logger = LoggerFactory.getLogger(TimeBoundExtractor.class);

    private final TimeExpressionEvaluator evaluator;

    public TimeBoundExtractor(TimeExpressionEvaluator evaluator) {
        this.evaluator = Objects.requireNonNull(evaluator, "evaluator cannot be null");
    }

    /**
     * 提取时间边界
     *
     * @param condition WHERE条件(可以为null)
     * @param wantStart true提取开始时间,false提取结束时间
     * @return 去掉时间条件后的树和提取出的时间
     * @throws QueryAnalysisException 时间条件不合法
     */
    public Extraction extract(WhereCondition condition, boolean wantStart) {
        if (condition == null) {
            return Extraction.EMPTY;
        }

        Optional<Value> boolExpression = condition.getBoolExpression();
        if (boolExpression.isPresent()) {
            return extractFromLeaf(condition, boolExpression.get(), wantStart);
        }
        return extractFromCombination(condition, wantStart);
    }

    private Extraction extractFromLeaf(WhereCondition leaf, Value expr, boolean wantStart) {
        switch (expr.getType()) {
            case DURATION:
            case FLOAT:
            case INT:
            case STRING:
            case WILDCARD:
                throw new QueryAnalysisException(ErrorKind.INVALID_WHERE_EXPRESSION,
                        "Invalid where expression: " + expr);
            case EXPRESSION:
                break;
            default:
                // 裸函数调用、裸名称、正则都不是时间条件
                return Extraction.untouched(leaf);
        }

        BinaryValue comparison = (BinaryValue) expr;
        Value left = comparison.getLeft();
        Value right = comparison.getRight();
        boolean timeOnLeft = !left.getType().isComposite();
        boolean timeOnRight = !right.getType().isComposite();

        // 两边都可能是time时(如 time > 5, 'a' = host),
        // 右边是数字/字符串/时长则time在左边,否则在右边
        if (timeOnLeft && timeOnRight) {
            if (isTimeColumn(left) && isTimeColumn(right)) {
                throw new QueryAnalysisException(ErrorKind.INVALID_TIME_CONDITION,
                        "Invalid time condition " + expr);
            }
            if (isNumericValue(right)) {
                timeOnRight = false;
            } else {
                timeOnLeft = false;
            }
        }

        if (!timeOnLeft && !timeOnRight) {
            return Extraction.untouched(leaf);
        }

        Value timeSide = timeOnLeft ? left : right;
        Value timeExpression = timeOnLeft ? right : left;
        if (!isTimeColumn(timeSide)) {
            return Extraction.untouched(leaf);
        }

        switch (comparison.getOperator()) {
            case GREATER_THAN:
                if (wantStart != timeOnLeft) {
                    return Extraction.untouched(leaf);
                }
                break;
            case LESS_THAN:
                if (wantStart != timeOnRight) {
                    return Extraction.untouched(leaf);
                }
                break;
            case EQUAL:
                break;
            default:
                throw new QueryAnalysisException(ErrorKind.INVALID_TIME_OPERATOR,
                        "Cannot use time with '" + comparison.getOperator() + "'");
        }

        Instant time = TimeExpressionEvaluator.fromEpochNanos(evaluator.evaluate(timeExpression));
        logger.trace("Consumed time condition {} as {} time {}", expr, wantStart ? "start" : "end", time);
        return new Extraction(null, time);
    }

    private Extraction extractFromCombination(WhereCondition condition, boolean wantStart) {
        WhereCondition left = condition.getLeft().orElseThrow();
        WhereCondition right = condition.getRight().orElseThrow();
        WhereCondition.Operation operation = condition.getOperation().orElseThrow();

        Extraction leftResult = extract(left, wantStart);
        Extraction rightResult = extract(right, wantStart);

        if (operation == WhereCondition.Operation.OR && leftResult.hasTime() && rightResult.hasTime()) {
            throw new QueryAnalysisException(ErrorKind.CONFLICTING_OR_TIME_BOUNDS,
                    "Invalid where clause, time must appear twice to specify start and end time: " + condition);
        }

        WhereCondition newCondition;
        if (leftResult.condition == null) {
            newCondition = rightResult.condition;
        } else if (rightResult.condition == null) {
            newCondition = leftResult.condition;
        } else {
            newCondition = condition.withChildren(leftResult.condition, rightResult.condition);
        }

        if (!leftResult.hasTime()) {
            return new Extraction(newCondition, rightResult.time);
        }
        if (!rightResult.hasTime()) {
            return new Extraction(newCondition, leftResult.time);
        }
        if (wantStart) {
            return new Extraction(newCondition,
                    leftResult.time.isBefore(rightResult.time) ? leftResult.time : rightResult.time);
        }
        return new Extraction(newCondition,
                leftResult.time.isAfter(rightResult.time) ? leftResult.time : rightResult.time);
    }

    private static boolean isTimeColumn(Value value) {
        return value.getType().isName() && CommonConstant.TIME_COLUMN.equals(value.getName());
    }

    private static boolean isNumericValue(Value value) {
        switch (value.getType()) {
            case DURATION:
            case FLOAT:
            case INT:
            case STRING:
                return true;
            default:
                return false;
        }
    }

    /**
     * 提取结果
     *
     * condition为null表示整棵树都被消耗掉了,time为ZERO_TIME表示没有提取到时间。
     */
    public static final class Extraction {

        private static final Extraction EMPTY = new Extraction(null, CommonConstant.ZERO_TIME);

        private final WhereCondition condition;

        private final Instant time;

        private Extraction(WhereCondition condition, Instant time) {
            this.condition = condition;
            this.time = time;
        }

        private static Extraction untouched(WhereCondition condition) {
            return new Extraction(condition, CommonConstant.ZERO_TIME);
        }

        public Optional<WhereCondition> getCondition() {
            return Optional.ofNullable(condition);
        }

        public Instant getTime() {
            return time;
        }

        public boolean hasTime() {
            return !CommonConstant.ZERO_TIME.equals(time);
        }

        @Override
        public String toString() {
            return "Extraction{condition=" + condition + ", time=" + time + '}';
        }
    }
}
