package com.minitsdb.parser;

/**
 * Statement - 查询语句接口
 *
 * 所有查询语句的基类,代表一个已经解析完成的查询命令。
 *
 * 设计原则:
 * - "Good taste": 分析器只依赖Statement,不需要关心具体语句类型
 * - 类型安全: 每种语句有专门的子类,编译期检查
 *
 * 使用示例:
 * <pre>
 * if (stmt.getType() == StatementType.SELECT) {
 *     SelectQuery select = (SelectQuery) stmt;
 *     Map&lt;Value, List&lt;String&gt;&gt; columns = analyzer.getReferencedColumns(select);
 *     ...
 * }
 * </pre>
 */
public interface Statement {

    /**
     * 获取语句类型
     *
     * @return 语句类型枚举
     */
    StatementType getType();

    /**
     * 查询语句类型枚举
     */
    enum StatementType {
        /** SELECT - 查询 */
        SELECT,
        /** DELETE - 删除 */
        DELETE
    }
}
