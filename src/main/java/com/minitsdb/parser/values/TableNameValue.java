package com.minitsdb.parser.values;

import com.minitsdb.parser.Value;

import java.util.Objects;

/**
 * TableNameValue - 带引号的名称
 *
 * 表示用双引号括起来的标识符,名称里可以包含空格、"."等特殊字符:
 * - "cpu.load"
 * - "response time"
 */
public class TableNameValue implements Value {

    private final String name;

    public TableNameValue(String name) {
        this.name = Objects.requireNonNull(name, "name cannot be null");
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public ValueType getType() {
        return ValueType.TABLE_NAME;
    }

    @Override
    public String toString() {
        return "\"" + name + "\"";
    }
}
