package com.minitsdb.parser.statements;

import com.minitsdb.CommonConstant;
import com.minitsdb.parser.Value;
import com.minitsdb.parser.WhereCondition;
import com.minitsdb.parser.values.BinaryValue;
import com.minitsdb.parser.values.Operator;

import java.util.List;
import java.util.Optional;

/**
 * SelectQuery - SELECT查询语句
 *
 * 语法示例:
 * <pre>
 * SELECT value FROM cpu WHERE time > now() - 1h;
 * SELECT count(value) FROM /.*cpu.*&#47; GROUP BY host;
 * SELECT x.value, y.value FROM cpu AS x INNER JOIN mem AS y;
 * </pre>
 *
 * 设计原则:
 * - 投影列表和GROUP BY列表都是Value,列引用解析器统一处理
 * - 单点查询(time = X AND sequence_number = Y)由WHERE条件推导,不单独保存
 */
public class SelectQuery extends SelectDeleteCommonQuery {

    /** 投影列表 */
    private final List<Value> columnNames;

    /** GROUP BY列表 */
    private final List<Value> groupByElems;

    public SelectQuery(String queryString, List<Value> columnNames, FromClause fromClause,
                       WhereCondition whereCondition, List<Value> groupByElems) {
        this(queryString, columnNames, fromClause, whereCondition, groupByElems, TimeRange.unresolved());
    }

    private SelectQuery(String queryString, List<Value> columnNames, FromClause fromClause,
                        WhereCondition whereCondition, List<Value> groupByElems, TimeRange timeRange) {
        super(queryString, fromClause, whereCondition, timeRange);
        this.columnNames = columnNames != null ? List.copyOf(columnNames) : List.of();
        this.groupByElems = groupByElems != null ? List.copyOf(groupByElems) : List.of();
    }

    public List<Value> getColumnNames() {
        return columnNames;
    }

    public List<Value> getGroupByElems() {
        return groupByElems;
    }

    /**
     * 判断是否为单点查询
     *
     * WHERE条件形如 time = X AND sequence_number = Y 时,查询只会命中一个点,
     * WHERE和GROUP BY不再需要参与列引用解析。
     */
    public boolean isSinglePointQuery() {
        Optional<WhereCondition> where = getWhereCondition();
        if (where.isEmpty() || where.get().getOperation().orElse(null) != WhereCondition.Operation.AND) {
            return false;
        }

        Optional<Value> left = where.get().getLeft().flatMap(WhereCondition::getBoolExpression);
        Optional<Value> right = where.get().getRight().flatMap(WhereCondition::getBoolExpression);
        if (left.isEmpty() || right.isEmpty()) {
            return false;
        }

        return isEqualityOn(left.get(), CommonConstant.TIME_COLUMN)
                && isEqualityOn(right.get(), CommonConstant.SEQUENCE_NUMBER_COLUMN);
    }

    private static boolean isEqualityOn(Value expr, String columnName) {
        if (!(expr instanceof BinaryValue)) {
            return false;
        }
        BinaryValue binary = (BinaryValue) expr;
        return binary.getOperator() == Operator.EQUAL && columnName.equals(binary.getLeft().getName());
    }

    @Override
    public SelectQuery withTimeRange(TimeRange timeRange) {
        return new SelectQuery(getQueryString(), columnNames, getFromClause(),
                getWhereCondition().orElse(null), groupByElems, timeRange);
    }

    @Override
    public StatementType getType() {
        return StatementType.SELECT;
    }

    @Override
    public String toString() {
        return "SelectQuery{" +
                "columnNames=" + columnNames +
                ", fromClause=" + getFromClause() +
                ", whereCondition=" + getWhereCondition().orElse(null) +
                ", groupByElems=" + groupByElems +
                ", timeRange=" + getTimeRange() +
                '}';
    }
}
