package com.minitsdb.parser.statements;

import com.minitsdb.parser.WhereCondition;

/**
 * DeleteQuery - DELETE删除语句
 *
 * 语法示例:
 * <pre>
 * DELETE FROM cpu WHERE time < now() - 30d;
 * DELETE FROM /.*&#47; WHERE time > '2009-11-10' AND time < '2009-11-11';
 * </pre>
 *
 * 只有时间条件会被存储层用来确定删除范围,所以DELETE只需要时间边界提取。
 */
public class DeleteQuery extends SelectDeleteCommonQuery {

    public DeleteQuery(String queryString, FromClause fromClause, WhereCondition whereCondition) {
        this(queryString, fromClause, whereCondition, TimeRange.unresolved());
    }

    private DeleteQuery(String queryString, FromClause fromClause, WhereCondition whereCondition,
                        TimeRange timeRange) {
        super(queryString, fromClause, whereCondition, timeRange);
    }

    @Override
    public DeleteQuery withTimeRange(TimeRange timeRange) {
        return new DeleteQuery(getQueryString(), getFromClause(), getWhereCondition().orElse(null), timeRange);
    }

    @Override
    public StatementType getType() {
        return StatementType.DELETE;
    }

    @Override
    public String toString() {
        return "DeleteQuery{" +
                "fromClause=" + getFromClause() +
                ", whereCondition=" + getWhereCondition().orElse(null) +
                ", timeRange=" + getTimeRange() +
                '}';
    }
}
