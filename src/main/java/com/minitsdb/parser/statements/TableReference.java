package com.minitsdb.parser.statements;

import com.minitsdb.parser.Value;

import java.util.Objects;
import java.util.Optional;

/**
 * TableReference - FROM子句中的一个表
 *
 * 表名可以是普通标识符,也可以是正则(正则表)。
 * 别名可选: FROM cpu AS c
 */
public class TableReference {

    /** 表名或正则 */
    private final Value name;

    /** 别名(没有别名时为null) */
    private final String alias;

    public TableReference(Value name) {
        this(name, null);
    }

    public TableReference(Value name, String alias) {
        Objects.requireNonNull(name, "table name cannot be null");
        if (!name.getType().isName() && name.getType() != Value.ValueType.REGEX) {
            throw new IllegalArgumentException("Table name must be a name or a regex: " + name);
        }
        if (name.getName().isEmpty()) {
            throw new IllegalArgumentException("Table name cannot be empty");
        }
        this.name = name;
        this.alias = alias == null || alias.isEmpty() ? null : alias;
    }

    public Value getName() {
        return name;
    }

    public Optional<String> getAlias() {
        return Optional.ofNullable(alias);
    }

    /**
     * 判断是否为正则表
     */
    public boolean isRegex() {
        return name.getCompiledRegex().isPresent();
    }

    @Override
    public String toString() {
        return alias == null ? name.toString() : name + " AS " + alias;
    }
}
