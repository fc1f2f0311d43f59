package com.minitsdb.parser.statements;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * FromClause - FROM子句
 *
 * 两种形式:
 * - ARRAY: 逗号分隔的表列表,FROM cpu, mem
 * - INNER_JOIN: 内连接,FROM cpu AS c INNER JOIN mem AS m
 *
 * 设计原则:
 * - 不可变对象
 * - 表列表不能为空
 * - 别名只在INNER_JOIN中参与列归属(见ColumnReferenceResolver)
 */
public class FromClause {

    /** FROM子句类型 */
    private final FromClauseType type;

    /** 表列表,保持书写顺序 */
    private final List<TableReference> tables;

    public FromClause(FromClauseType type, List<TableReference> tables) {
        this.type = Objects.requireNonNull(type, "type cannot be null");
        if (tables == null || tables.isEmpty()) {
            throw new IllegalArgumentException("FROM clause must reference at least one table");
        }
        this.tables = List.copyOf(tables);
    }

    public static FromClause array(TableReference... tables) {
        return new FromClause(FromClauseType.ARRAY, List.of(tables));
    }

    public static FromClause innerJoin(TableReference... tables) {
        return new FromClause(FromClauseType.INNER_JOIN, List.of(tables));
    }

    public FromClauseType getType() {
        return type;
    }

    public List<TableReference> getTables() {
        return tables;
    }

    @Override
    public String toString() {
        String separator = type == FromClauseType.INNER_JOIN ? " INNER JOIN " : ", ";
        return tables.stream()
                .map(TableReference::toString)
                .collect(Collectors.joining(separator));
    }

    /**
     * FROM子句类型枚举
     */
    public enum FromClauseType {
        /** 表列表 */
        ARRAY,
        /** 内连接 */
        INNER_JOIN
    }
}
