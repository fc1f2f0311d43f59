package com.minitsdb.parser.values;

import com.minitsdb.parser.Value;

import java.util.Objects;

/**
 * SimpleNameValue - 简单名称
 *
 * 表示不带引号的标识符,可以是列名、表名或带表名前缀的列名:
 * - 列名: value, host
 * - 带前缀: cpu.host, x.value
 *
 * 前缀不在这里拆分,由列引用解析器按最后一个"."决定。
 */
public class SimpleNameValue implements Value {

    private final String name;

    public SimpleNameValue(String name) {
        this.name = Objects.requireNonNull(name, "name cannot be null");
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public ValueType getType() {
        return ValueType.SIMPLE_NAME;
    }

    @Override
    public String toString() {
        return name;
    }
}
