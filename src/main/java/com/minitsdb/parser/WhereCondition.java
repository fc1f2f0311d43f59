package com.minitsdb.parser;

import java.util.Objects;
import java.util.Optional;

/**
 * WhereCondition - WHERE条件树
 *
 * 二叉树结构:
 * - 叶子节点: 一个布尔表达式,通常是比较运算,如 host = 'srv1'
 * - 内部节点: 用AND/OR连接的左右两棵子树
 *
 * 设计原则:
 * - 不可变对象: 时间边界提取会对同一棵树跑两遍(开始时间和结束时间),
 *   任何改写都必须创建新节点,未改变的子树直接共享
 * - 统一表示: 叶子和内部节点是同一个类型,用Optional区分,调用方不需要强转
 *
 * 使用示例:
 * <pre>
 * WhereCondition where = WhereCondition.and(
 *     WhereCondition.of(new BinaryValue(new SimpleNameValue("time"), Operator.GREATER_THAN, LiteralValue.duration("1h"))),
 *     WhereCondition.of(new BinaryValue(new SimpleNameValue("host"), Operator.EQUAL, LiteralValue.string("srv1")))
 * );
 * </pre>
 */
public final class WhereCondition {

    /** 叶子节点的布尔表达式(内部节点为null) */
    private final Value boolExpression;

    /** 内部节点的连接方式(叶子节点为null) */
    private final Operation operation;

    private final WhereCondition left;

    private final WhereCondition right;

    private WhereCondition(Value boolExpression, Operation operation, WhereCondition left, WhereCondition right) {
        this.boolExpression = boolExpression;
        this.operation = operation;
        this.left = left;
        this.right = right;
    }

    /**
     * 创建叶子节点
     *
     * @param boolExpression 布尔表达式
     * @return 叶子节点
     */
    public static WhereCondition of(Value boolExpression) {
        Objects.requireNonNull(boolExpression, "boolExpression cannot be null");
        return new WhereCondition(boolExpression, null, null, null);
    }

    /**
     * 创建内部节点
     *
     * @param operation AND或OR
     * @param left 左子树
     * @param right 右子树
     * @return 内部节点
     */
    public static WhereCondition of(Operation operation, WhereCondition left, WhereCondition right) {
        Objects.requireNonNull(operation, "operation cannot be null");
        Objects.requireNonNull(left, "left condition cannot be null");
        Objects.requireNonNull(right, "right condition cannot be null");
        return new WhereCondition(null, operation, left, right);
    }

    public static WhereCondition and(WhereCondition left, WhereCondition right) {
        return of(Operation.AND, left, right);
    }

    public static WhereCondition or(WhereCondition left, WhereCondition right) {
        return of(Operation.OR, left, right);
    }

    public boolean isLeaf() {
        return boolExpression != null;
    }

    public Optional<Value> getBoolExpression() {
        return Optional.ofNullable(boolExpression);
    }

    public Optional<Operation> getOperation() {
        return Optional.ofNullable(operation);
    }

    public Optional<WhereCondition> getLeft() {
        return Optional.ofNullable(left);
    }

    public Optional<WhereCondition> getRight() {
        return Optional.ofNullable(right);
    }

    /**
     * 用新的子树替换当前内部节点的子树
     *
     * 不修改当前节点。两棵子树都没有变化时直接返回this。
     *
     * @param newLeft 新的左子树
     * @param newRight 新的右子树
     * @return 新节点(或this)
     */
    public WhereCondition withChildren(WhereCondition newLeft, WhereCondition newRight) {
        if (isLeaf()) {
            throw new IllegalStateException("Leaf condition has no children: " + this);
        }
        if (newLeft == left && newRight == right) {
            return this;
        }
        return of(operation, newLeft, newRight);
    }

    @Override
    public String toString() {
        if (isLeaf()) {
            return boolExpression.toString();
        }
        return render(left) + " " + operation + " " + render(right);
    }

    private static String render(WhereCondition child) {
        return child.isLeaf() ? child.toString() : "(" + child + ")";
    }

    /**
     * 条件连接方式
     */
    public enum Operation {
        AND,
        OR
    }
}
