package com.minitsdb.parser.values;

import com.minitsdb.parser.Value;

import java.util.List;
import java.util.Objects;

/**
 * BinaryValue - 二元运算表达式
 *
 * 表示需要两个操作数的运算,包括:
 * - 比较运算: time > now() - 1h, host = 'srv1'
 * - 正则匹配: host =~ /srv.*&#47;
 * - 算术运算: now() - 1d, value * 2
 *
 * 设计原则:
 * - 不可变对象
 * - 左操作数、运算符、右操作数,getElems()固定返回两个元素
 * - 支持嵌套: (now() - 1d) + 1h
 */
public class BinaryValue implements Value {

    /** 左操作数 */
    private final Value left;

    /** 运算符 */
    private final Operator operator;

    /** 右操作数 */
    private final Value right;

    public BinaryValue(Value left, Operator operator, Value right) {
        this.left = Objects.requireNonNull(left, "left operand cannot be null");
        this.operator = Objects.requireNonNull(operator, "operator cannot be null");
        this.right = Objects.requireNonNull(right, "right operand cannot be null");
    }

    public Value getLeft() {
        return left;
    }

    public Operator getOperator() {
        return operator;
    }

    public Value getRight() {
        return right;
    }

    /**
     * 返回运算符符号
     */
    @Override
    public String getName() {
        return operator.getSymbol();
    }

    @Override
    public List<Value> getElems() {
        return List.of(left, right);
    }

    @Override
    public ValueType getType() {
        return ValueType.EXPRESSION;
    }

    @Override
    public String toString() {
        return "(" + left + " " + operator + " " + right + ")";
    }
}
