package com.minitsdb.parser.values;

/**
 * Operator - 二元运算符
 *
 * 定义查询表达式中支持的二元运算符。
 */
public enum Operator {

    /** 等于 */
    EQUAL("="),
    /** 不等于 */
    NOT_EQUAL("!="),
    /** 大于 */
    GREATER_THAN(">"),
    /** 小于 */
    LESS_THAN("<"),
    /** 大于等于 */
    GREATER_EQUAL(">="),
    /** 小于等于 */
    LESS_EQUAL("<="),
    /** 正则匹配 */
    REGEX_MATCH("=~"),
    /** 正则不匹配 */
    REGEX_NOT_MATCH("!~"),
    /** 加法 */
    ADD("+"),
    /** 减法 */
    SUBTRACT("-"),
    /** 乘法 */
    MULTIPLY("*"),
    /** 除法 */
    DIVIDE("/"),
    /** 取模 */
    MODULO("%");

    /** 运算符字符串表示 */
    private final String symbol;

    Operator(String symbol) {
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }

    /**
     * 根据符号获取运算符
     *
     * @param symbol 运算符符号
     * @return 运算符枚举,如果未知返回null
     */
    public static Operator fromSymbol(String symbol) {
        for (Operator op : values()) {
            if (op.symbol.equals(symbol)) {
                return op;
            }
        }
        return null;
    }

    @Override
    public String toString() {
        return symbol;
    }
}
