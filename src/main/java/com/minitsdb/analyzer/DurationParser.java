package com.minitsdb.analyzer;

import com.minitsdb.parser.QueryAnalysisException;
import com.minitsdb.parser.QueryAnalysisException.ErrorKind;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.concurrent.TimeUnit;

/**
 * DurationParser - 时长解析
 *
 * 支持的后缀:
 * - u: 微秒
 * - s: 秒
 * - m: 分钟
 * - h: 小时
 * - d: 天
 * - w: 周(7天)
 * - y: 年(8736小时)
 * - 无后缀: 纳秒
 *
 * 数字部分可以是小数(1.5h)或负数,结果向零截断到纳秒。
 */
public final class DurationParser {

    private static final long NANOS_PER_YEAR = TimeUnit.HOURS.toNanos(8736);

    private DurationParser() {
    }

    /**
     * 解析时长
     *
     * @param text 时长文本,如"5m"
     * @return 纳秒数
     * @throws QueryAnalysisException 文本不是合法的时长
     */
    public static long parse(String text) {
        if (text == null || text.isEmpty()) {
            throw new QueryAnalysisException(ErrorKind.INVALID_TIME_DURATION, "Empty duration");
        }

        char suffix = text.charAt(text.length() - 1);
        long unit = nanosPerUnit(suffix);
        String number = unit == 1 ? text : text.substring(0, text.length() - 1);

        try {
            return new BigDecimal(number)
                    .multiply(BigDecimal.valueOf(unit))
                    .setScale(0, RoundingMode.DOWN)
                    .longValueExact();
        } catch (NumberFormatException e) {
            throw new QueryAnalysisException(ErrorKind.INVALID_TIME_DURATION,
                    "Invalid duration: " + text, e);
        } catch (ArithmeticException e) {
            throw new QueryAnalysisException(ErrorKind.INVALID_TIME_DURATION,
                    "Duration out of range: " + text, e);
        }
    }

    /**
     * 后缀对应的纳秒数,没有后缀(数字结尾)返回1
     */
    private static long nanosPerUnit(char suffix) {
        switch (suffix) {
            case 'u':
                return TimeUnit.MICROSECONDS.toNanos(1);
            case 's':
                return TimeUnit.SECONDS.toNanos(1);
            case 'm':
                return TimeUnit.MINUTES.toNanos(1);
            case 'h':
                return TimeUnit.HOURS.toNanos(1);
            case 'd':
                return TimeUnit.DAYS.toNanos(1);
            case 'w':
                return TimeUnit.DAYS.toNanos(7);
            case 'y':
                return NANOS_PER_YEAR;
            default:
                return 1;
        }
    }
}
