package com.minitsdb.parser;

/**
 * QueryAnalysisException - 查询分析异常
 *
 * 时间边界提取或时间表达式求值失败时抛出。
 * 所有错误都只影响当前这一次查询,由调用方决定如何返回给客户端。
 */
public class QueryAnalysisException extends RuntimeException {

    /** 错误类型 */
    private final ErrorKind kind;

    public QueryAnalysisException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public QueryAnalysisException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }

    /**
     * 错误类型枚举
     */
    public enum ErrorKind {
        /** WHERE条件是裸字面量而不是比较表达式 */
        INVALID_WHERE_EXPRESSION,
        /** 时间表达式中出现了now()以外的函数 */
        INVALID_FUNCTION_IN_TIME_CONTEXT,
        /** 字符串不符合日期格式 */
        INVALID_TIME_STRING,
        /** 时间表达式或时间条件中使用了不支持的运算符 */
        INVALID_TIME_OPERATOR,
        /** OR的两个分支都带有同一种时间边界 */
        CONFLICTING_OR_TIME_BOUNDS,
        /** 比较的两边都是time */
        INVALID_TIME_CONDITION,
        /** 时长或数字无法解析 */
        INVALID_TIME_DURATION,
        /** 开始时间晚于结束时间 */
        INVALID_TIME_RANGE
    }
}
