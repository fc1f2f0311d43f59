package com.minitsdb.analyzer;

import com.minitsdb.CommonConstant;
import com.minitsdb.parser.QueryAnalysisException;
import com.minitsdb.parser.QueryAnalysisException.ErrorKind;
import com.minitsdb.parser.Value;
import com.minitsdb.parser.values.BinaryValue;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * TimeExpressionEvaluator - 时间表达式求值器
 *
 * 把WHERE条件中和time比较的那一侧求值成纳秒时间戳,支持:
 * - now() → 当前时间
 * - 日期字符串: '2009-11-10 23:00:00' → 对应的UTC时间
 * - 时长/数字: 1h, 1400000000s → 纳秒数
 * - 加减运算: now() - 1d, '2009-11-10' + 12h
 *
 * 设计原则:
 * - 递归求值,按节点类型分发
 * - 时钟通过构造函数注入,测试中可以固定now()
 * - 无状态: 除了不可变的Clock没有任何字段,可以被多个线程共享
 *
 * 使用示例:
 * <pre>
 * TimeExpressionEvaluator evaluator = new TimeExpressionEvaluator();
 * long nanos = evaluator.evaluate(new BinaryValue(
 *     new FunctionCallValue("now"),
 *     Operator.SUBTRACT,
 *     LiteralValue.duration("1d")
 * ));
 * </pre>
 */
public class TimeExpressionEvaluator {

    /**
     * 日期格式: YYYY-MM-DD[ HH[:MM[:SS[.fraction]]]]
     *
     * 年份可以是2位或4位,其余部分1到2位,小数秒最多9位。
     */
    private static final Pattern TIME_STRING_PATTERN = Pattern.compile(
            "^(?<year>[0-9]{4}|[0-9]{2})-(?<month>[0-9]{1,2})-(?<day>[0-9]{1,2})"
                    + "( (?<hour>[0-9]{1,2})"
                    + "(:(?<minute>[0-9]{1,2})"
                    + "(:(?<second>[0-9]{1,2})(\\.(?<fraction>[0-9]{1,9}))?)?)?)?$");

    private static final long NANOS_PER_SECOND = 1_000_000_000L;

    private final Clock clock;

    public TimeExpressionEvaluator() {
        this(Clock.systemUTC());
    }

    public TimeExpressionEvaluator(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock cannot be null");
    }

    /**
     * 求值时间表达式
     *
     * @param value 表达式
     * @return 纳秒数(绝对时间戳或时长,取决于表达式)
     * @throws QueryAnalysisException 表达式不能作为时间使用
     */
    public long evaluate(Value value) {
        Objects.requireNonNull(value, "value cannot be null");

        switch (value.getType()) {
            case EXPRESSION:
                return evalArithmetic((BinaryValue) value);

            case FUNCTION_CALL:
                return evalFunction(value);

            case STRING:
                return evalTimeString(value.getName());

            default:
                return DurationParser.parse(value.getName());
        }
    }

    private long evalTimeString(String text) {
        Instant time = parseTimeString(text);
        try {
            return toEpochNanos(time);
        } catch (ArithmeticException e) {
            throw new QueryAnalysisException(ErrorKind.INVALID_TIME_STRING,
                    text + " is outside the supported time range", e);
        }
    }

    private long evalFunction(Value function) {
        if (CommonConstant.NOW_FUNCTION.equals(function.getName())) {
            Instant now = clock.instant();
            try {
                return toEpochNanos(now);
            } catch (ArithmeticException e) {
                throw new QueryAnalysisException(ErrorKind.INVALID_TIME_DURATION,
                        "Current time " + now + " is outside the supported time range", e);
            }
        }
        throw new QueryAnalysisException(ErrorKind.INVALID_FUNCTION_IN_TIME_CONTEXT,
                "Invalid use of function " + function.getName());
    }

    private long evalArithmetic(BinaryValue expr) {
        long left = evaluate(expr.getLeft());
        long right = evaluate(expr.getRight());

        try {
            switch (expr.getOperator()) {
                case ADD:
                    return Math.addExact(left, right);
                case SUBTRACT:
                    return Math.subtractExact(left, right);
                default:
                    throw new QueryAnalysisException(ErrorKind.INVALID_TIME_OPERATOR,
                            "Cannot use '" + expr.getOperator() + "' in a time expression");
            }
        } catch (ArithmeticException e) {
            throw new QueryAnalysisException(ErrorKind.INVALID_TIME_DURATION,
                    "Time expression " + expr + " is outside the supported time range", e);
        }
    }

    /**
     * 解析日期字符串
     *
     * 省略的时、分、秒按0处理,所以"2009-11-10"和"2009-11-10 00"是同一个时间。
     * 2位年份: 69-99 → 19xx, 00-68 → 20xx。
     *
     * @param text 日期字符串
     * @return UTC时间
     * @throws QueryAnalysisException 格式不对或日期不存在(如13月)
     */
    public static Instant parseTimeString(String text) {
        Matcher matcher = TIME_STRING_PATTERN.matcher(text);
        if (!matcher.matches()) {
            throw new QueryAnalysisException(ErrorKind.INVALID_TIME_STRING,
                    text + " isn't a valid time string");
        }

        String yearText = matcher.group("year");
        int year = Integer.parseInt(yearText);
        if (yearText.length() == 2) {
            year += year >= 69 ? 1900 : 2000;
        }

        try {
            LocalDateTime dateTime = LocalDateTime.of(
                    year,
                    Integer.parseInt(matcher.group("month")),
                    Integer.parseInt(matcher.group("day")),
                    intGroup(matcher, "hour"),
                    intGroup(matcher, "minute"),
                    intGroup(matcher, "second"),
                    fractionToNanos(matcher.group("fraction")));
            return dateTime.toInstant(ZoneOffset.UTC);
        } catch (DateTimeException e) {
            throw new QueryAnalysisException(ErrorKind.INVALID_TIME_STRING,
                    text + " isn't a valid time string", e);
        }
    }

    private static int intGroup(Matcher matcher, String group) {
        String text = matcher.group(group);
        return text == null ? 0 : Integer.parseInt(text);
    }

    private static int fractionToNanos(String fraction) {
        if (fraction == null) {
            return 0;
        }
        StringBuilder padded = new StringBuilder(fraction);
        while (padded.length() < 9) {
            padded.append('0');
        }
        return Integer.parseInt(padded.toString());
    }

    static long toEpochNanos(Instant instant) {
        return Math.addExact(Math.multiplyExact(instant.getEpochSecond(), NANOS_PER_SECOND), instant.getNano());
    }

    static Instant fromEpochNanos(long nanos) {
        return Instant.ofEpochSecond(Math.floorDiv(nanos, NANOS_PER_SECOND), Math.floorMod(nanos, NANOS_PER_SECOND));
    }
}
