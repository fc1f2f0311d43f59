package com.minitsdb.parser;

import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Value - 查询表达式节点接口
 *
 * 表示查询AST中的各种标量或标识符表达式,包括:
 * - 名称: cpu, host, "table name"
 * - 字面量: 42, 1.5, 'hello', 5m
 * - 二元运算: time > now() - 1h, value + 1
 * - 函数调用: now(), count(value)
 * - 通配符和正则: *, /.*cpu.*&#47;
 *
 * 设计原则:
 * - "Good taste": 所有节点都是Value,按类型分发而不是到处判断字段
 * - 不可变对象: 解析器构建一次,分析器只会创建新节点,从不修改已有节点
 * - 身份相等: 不重写equals/hashCode,同名的两个表在结果映射中仍然可以区分
 *
 * 使用示例:
 * <pre>
 * Value expr = new BinaryValue(
 *     new SimpleNameValue("time"),
 *     Operator.GREATER_THAN,
 *     LiteralValue.duration("1h")
 * );
 * </pre>
 */
public interface Value {

    /**
     * 获取节点类型
     *
     * @return 节点类型枚举
     */
    ValueType getType();

    /**
     * 获取文本内容
     *
     * 标识符返回名称,运算表达式返回运算符,函数调用返回函数名,字面量返回原始文本。
     *
     * @return 文本内容
     */
    String getName();

    /**
     * 获取子节点
     *
     * @return 运算数或函数参数,叶子节点返回空列表
     */
    default List<Value> getElems() {
        return List.of();
    }

    /**
     * 获取编译后的正则表达式
     *
     * @return 只有正则节点才有值
     */
    default Optional<Pattern> getCompiledRegex() {
        return Optional.empty();
    }

    /**
     * 判断是否为函数调用
     */
    default boolean isFunctionCall() {
        return getType() == ValueType.FUNCTION_CALL;
    }

    /**
     * 节点类型枚举
     */
    enum ValueType {
        /** 简单名称: host */
        SIMPLE_NAME,
        /** 表名(带引号的标识符): "cpu.load" */
        TABLE_NAME,
        /** 通配符: * */
        WILDCARD,
        /** 二元运算: a > b */
        EXPRESSION,
        /** 函数调用: now() */
        FUNCTION_CALL,
        /** 正则: /cpu.*&#47; */
        REGEX,
        /** 字符串字面量 */
        STRING,
        /** 整数字面量 */
        INT,
        /** 浮点数字面量 */
        FLOAT,
        /** 时长字面量: 5m, 1d */
        DURATION;

        /**
         * 判断是否为字面量类型
         */
        public boolean isLiteral() {
            return this == STRING || this == INT || this == FLOAT || this == DURATION;
        }

        /**
         * 判断是否为复合节点(有子节点)
         */
        public boolean isComposite() {
            return this == EXPRESSION || this == FUNCTION_CALL;
        }

        /**
         * 判断是否为标识符
         */
        public boolean isName() {
            return this == SIMPLE_NAME || this == TABLE_NAME;
        }
    }
}
