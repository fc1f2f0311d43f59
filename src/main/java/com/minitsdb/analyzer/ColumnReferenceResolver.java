package com.minitsdb.analyzer;

import com.minitsdb.CommonConstant;
import com.minitsdb.parser.Value;
import com.minitsdb.parser.WhereCondition;
import com.minitsdb.parser.statements.FromClause;
import com.minitsdb.parser.statements.SelectQuery;
import com.minitsdb.parser.statements.TableReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * ColumnReferenceResolver - 列引用解析器
 *
 * 计算SELECT查询中每个表需要读取的列,供存储层做投影下推。
 *
 * 解析步骤:
 * 1. 从投影列表、WHERE条件、GROUP BY列表收集列名:
 *    - 不带前缀的列(value)对所有表生效
 *    - 带前缀的列(x.value)暂时按前缀归类
 * 2. INNER JOIN时把别名前缀还原成真实表名
 * 3. 按FROM子句中的顺序给每个表分配列:
 *    - 正则表只分配不带前缀的列
 *    - 普通表分配自己的前缀列加上不带前缀的列,同名表只出现一次
 * 4. 还没分配掉的前缀说明列名本身含有"."(不是表前缀),
 *    把"前缀.列名"作为完整列名加到每个表上
 *
 * 设计原则:
 * - 纯函数: 不修改查询对象,每次调用使用自己的临时集合
 * - 结果按FROM子句中的Value对象(身份)做key,同名表的不同出现可以区分
 * - 结果中的列表排序并去重,保证输出确定
 */
public class ColumnReferenceResolver {

    private static final Logger logger = LoggerFactory.getLogger(ColumnReferenceResolver.class);

    /**
     * 计算每个表引用的列
     *
     * @param query SELECT查询
     * @return 表(FROM子句中的Value) → 列名列表
     */
    public Map<Value, List<String>> getReferencedColumns(SelectQuery query) {
        Map<String, List<String>> mapping = new LinkedHashMap<>();
        List<String> notPrefixed = new ArrayList<>();

        for (Value value : query.getColumnNames()) {
            if (CommonConstant.TIME_COLUMN.equals(value.getName())
                    || CommonConstant.SEQUENCE_NUMBER_COLUMN.equals(value.getName())) {
                continue;
            }
            notPrefixed.addAll(collectFromValue(value, mapping));
        }

        if (!query.isSinglePointQuery()) {
            query.getWhereCondition()
                    .ifPresent(condition -> notPrefixed.addAll(collectFromCondition(condition, mapping)));

            for (Value groupBy : query.getGroupByElems()) {
                notPrefixed.addAll(collectFromValue(groupBy, mapping));
            }
        }

        List<String> notPrefixedColumns = uniq(notPrefixed);

        revertAlias(query.getFromClause(), mapping);

        Set<String> addedTables = new HashSet<>();
        Map<Value, List<String>> result = new LinkedHashMap<>();
        for (TableReference table : query.getFromClause().getTables()) {
            Value tableName = table.getName();
            if (table.isRegex()) {
                // 正则表不能被前缀引用,只分配不带前缀的列
                result.put(tableName, new ArrayList<>(notPrefixedColumns));
                continue;
            }

            String name = tableName.getName();
            if (!addedTables.add(name)) {
                continue;
            }

            List<String> columns = new ArrayList<>(mapping.getOrDefault(name, List.of()));
            columns.addAll(notPrefixedColumns);
            columns = uniq(columns);
            if (columns.size() > 1 && CommonConstant.WILDCARD.equals(columns.get(0))) {
                columns = new ArrayList<>(List.of(CommonConstant.WILDCARD));
            }
            result.put(tableName, columns);

            mapping.remove(name);
        }

        if (!mapping.isEmpty()) {
            // 剩下的前缀不是表名,而是列名里本来就带的"."
            logger.warn("Columns {} do not belong to any table in '{}', treating them as dotted column names",
                    mapping, query.getFromClause());
            for (Map.Entry<String, List<String>> entry : mapping.entrySet()) {
                for (String columnName : entry.getValue()) {
                    for (List<String> columns : result.values()) {
                        if (!columns.isEmpty() && CommonConstant.WILDCARD.equals(columns.get(0))) {
                            continue;
                        }
                        columns.add(entry.getKey() + "." + columnName);
                    }
                }
            }
        }

        logger.debug("Referenced columns of '{}': {}", query.getFromClause(), result);
        return result;
    }

    /**
     * 把别名前缀还原成真实表名
     *
     * 只有INNER JOIN需要还原,同一个表的多个别名合并到一起。
     */
    private void revertAlias(FromClause fromClause, Map<String, List<String>> mapping) {
        if (fromClause.getType() != FromClause.FromClauseType.INNER_JOIN) {
            return;
        }

        Map<String, Set<String>> columns = new LinkedHashMap<>();
        for (TableReference table : fromClause.getTables()) {
            String name = table.getName().getName();
            String alias = table.getAlias().orElse(name);

            List<String> aliasColumns = mapping.remove(alias);
            if (aliasColumns == null) {
                continue;
            }
            columns.computeIfAbsent(name, k -> new LinkedHashSet<>()).addAll(aliasColumns);
        }

        for (Map.Entry<String, Set<String>> entry : columns.entrySet()) {
            mapping.put(entry.getKey(), new ArrayList<>(entry.getValue()));
        }
    }

    /**
     * 收集一个Value引用的列
     *
     * @param value 表达式
     * @param mapping 带前缀的列会被放进这里: 前缀 → 列名
     * @return 不带前缀的列
     */
    private List<String> collectFromValue(Value value, Map<String, List<String>> mapping) {
        List<String> notAssigned = new ArrayList<>();

        switch (value.getType()) {
            case SIMPLE_NAME:
            case TABLE_NAME:
                String name = value.getName();
                int idx = name.lastIndexOf('.');
                if (idx != -1) {
                    mapping.computeIfAbsent(name.substring(0, idx), k -> new ArrayList<>())
                            .add(name.substring(idx + 1));
                    break;
                }
                notAssigned.add(name);
                break;

            case WILDCARD:
                notAssigned.add(CommonConstant.WILDCARD);
                break;

            case EXPRESSION:
            case FUNCTION_CALL:
                for (Value elem : value.getElems()) {
                    List<String> nested = collectFromValue(elem, mapping);
                    // count(*)之类的通配符不算投影通配符
                    if (!nested.isEmpty() && CommonConstant.WILDCARD.equals(nested.get(0))) {
                        nested = nested.subList(1, nested.size());
                    }
                    notAssigned.addAll(nested);
                }
                break;

            default:
                // 字面量和正则不引用列
                break;
        }
        return notAssigned;
    }

    private List<String> collectFromCondition(WhereCondition condition, Map<String, List<String>> mapping) {
        if (condition.isLeaf()) {
            return collectFromValue(condition.getBoolExpression().orElseThrow(), mapping);
        }

        List<String> notPrefixed = new ArrayList<>();
        notPrefixed.addAll(collectFromCondition(condition.getLeft().orElseThrow(), mapping));
        notPrefixed.addAll(collectFromCondition(condition.getRight().orElseThrow(), mapping));
        return notPrefixed;
    }

    /**
     * 去重并排序
     */
    private static List<String> uniq(Collection<String> columns) {
        return new ArrayList<>(new TreeSet<>(columns));
    }
}
