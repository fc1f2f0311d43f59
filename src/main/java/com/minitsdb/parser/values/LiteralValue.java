package com.minitsdb.parser.values;

import com.minitsdb.parser.Value;

import java.util.Objects;

/**
 * LiteralValue - 字面量
 *
 * 表示查询中的字面量,保留原始文本,由使用方按需要解析:
 * - 整数: 42, -100, 1400000000000000000
 * - 浮点数: 3.14
 * - 字符串: 'srv1', '2009-11-10 23:00:00'
 * - 时长: 5m, 1d, 1.5h
 *
 * 设计原则:
 * - 不可变对象
 * - 只保存文本,不提前转换成数字(时长和日期的解析规则由时间表达式求值器决定)
 */
public class LiteralValue implements Value {

    /** 字面量类型(STRING/INT/FLOAT/DURATION) */
    private final ValueType type;

    /** 原始文本(字符串不含引号) */
    private final String text;

    public LiteralValue(ValueType type, String text) {
        Objects.requireNonNull(type, "type cannot be null");
        if (!type.isLiteral()) {
            throw new IllegalArgumentException("Not a literal type: " + type);
        }
        this.type = type;
        this.text = Objects.requireNonNull(text, "text cannot be null");
    }

    public static LiteralValue string(String text) {
        return new LiteralValue(ValueType.STRING, text);
    }

    public static LiteralValue integer(long value) {
        return new LiteralValue(ValueType.INT, Long.toString(value));
    }

    public static LiteralValue floating(String text) {
        return new LiteralValue(ValueType.FLOAT, text);
    }

    public static LiteralValue duration(String text) {
        return new LiteralValue(ValueType.DURATION, text);
    }

    @Override
    public String getName() {
        return text;
    }

    @Override
    public ValueType getType() {
        return type;
    }

    @Override
    public String toString() {
        if (type == ValueType.STRING) {
            return "'" + text.replace("'", "\\'") + "'";
        }
        return text;
    }
}
