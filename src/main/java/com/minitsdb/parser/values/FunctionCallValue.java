package com.minitsdb.parser.values;

import com.minitsdb.parser.Value;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * FunctionCallValue - 函数调用
 *
 * 表示聚合函数或标量函数调用:
 * - now()
 * - count(value), mean(value)
 * - percentile(value, 95)
 *
 * 设计原则:
 * - 不可变对象
 * - 参数列表可以为空
 */
public class FunctionCallValue implements Value {

    /** 函数名 */
    private final String functionName;

    /** 参数列表 */
    private final List<Value> arguments;

    public FunctionCallValue(String functionName, List<Value> arguments) {
        this.functionName = Objects.requireNonNull(functionName, "functionName cannot be null");
        this.arguments = arguments != null ? List.copyOf(arguments) : List.of();
    }

    public FunctionCallValue(String functionName, Value... arguments) {
        this(functionName, List.of(arguments));
    }

    @Override
    public String getName() {
        return functionName;
    }

    @Override
    public List<Value> getElems() {
        return arguments;
    }

    @Override
    public ValueType getType() {
        return ValueType.FUNCTION_CALL;
    }

    @Override
    public String toString() {
        return functionName + arguments.stream()
                .map(Value::toString)
                .collect(Collectors.joining(", ", "(", ")"));
    }
}
