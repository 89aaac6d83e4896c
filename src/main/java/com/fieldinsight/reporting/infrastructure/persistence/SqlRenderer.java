package com.fieldinsight.reporting.infrastructure.persistence;

import com.fieldinsight.reporting.core.model.FilterLogic;
import com.fieldinsight.reporting.core.model.MeasureFormula;
import com.fieldinsight.reporting.core.model.plan.JoinClause;
import com.fieldinsight.reporting.core.model.plan.OrderItem;
import com.fieldinsight.reporting.core.model.plan.PredicateFragment;
import com.fieldinsight.reporting.core.model.plan.PredicateGroup;
import com.fieldinsight.reporting.core.model.plan.QueryPlan;
import com.fieldinsight.reporting.core.model.plan.SelectItem;
import com.fieldinsight.reporting.core.model.plan.TableRef;
import jakarta.enterprise.context.ApplicationScoped;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.StringJoiner;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * QueryPlan -> PostgreSQL 参数化 SQL
 * 取值全部以 ? 占位符绑定，参数顺序与占位符出现顺序一致；
 * 输出列按位置命名，{@link SqlRequest#columnLabels()} 给出每一列对应的展示名
 */
@ApplicationScoped
public class SqlRenderer {

    private static final Pattern DIVISOR = Pattern.compile("/\\s*\\$\\{([A-Za-z0-9_\\-]+)\\}");

    public SqlRequest render(QueryPlan plan) {
        List<Object> params = new ArrayList<>();
        StringBuilder sql = new StringBuilder("SELECT ");

        Map<String, String> aggregateExprs = new HashMap<>();
        for (SelectItem item : plan.select()) {
            if (item.kind() == SelectItem.Kind.AGGREGATE) {
                aggregateExprs.put(item.sourceId(), aggregateExpr(item));
            }
        }

        // 输出列使用位置别名 c1..cN，展示名可能超过 PostgreSQL 标识符长度上限（63字节）
        StringJoiner projections = new StringJoiner(", ");
        List<String> columnLabels = new ArrayList<>();
        for (SelectItem item : plan.select()) {
            columnLabels.add(item.alias());
            projections.add(projection(item, aggregateExprs, params) + " AS " + columnAlias(columnLabels.size()));
        }
        sql.append(projections);

        sql.append(" FROM ").append(tableRef(plan.base()));
        for (JoinClause join : plan.joins()) {
            sql.append(' ').append(join.kind().sql()).append(' ').append(tableRef(join.table()))
                    .append(" ON ").append(join.leftAlias()).append('.').append(join.leftField())
                    .append(" = ").append(join.table().alias()).append('.').append(join.rightField());
        }

        if (!plan.where().isEmpty()) {
            StringJoiner where = new StringJoiner(" AND ");
            for (PredicateGroup group : plan.where()) {
                where.add(group(group, params));
            }
            sql.append(" WHERE ").append(where);
        }

        if (!plan.groupBy().isEmpty()) {
            StringJoiner groupBy = new StringJoiner(", ");
            for (String alias : plan.groupBy()) {
                groupBy.add(String.valueOf(position(plan, alias)));
            }
            sql.append(" GROUP BY ").append(groupBy);
        }

        if (!plan.orderBy().isEmpty()) {
            StringJoiner orderBy = new StringJoiner(", ");
            for (OrderItem order : plan.orderBy()) {
                orderBy.add(columnAlias(position(plan, order.alias())) + " "
                        + order.direction().code().toUpperCase(Locale.ROOT));
            }
            sql.append(" ORDER BY ").append(orderBy);
        }

        if (plan.limit() != null) {
            sql.append(" LIMIT ?");
            params.add(plan.limit());
        }
        if (plan.offset() != null && plan.offset() > 0) {
            sql.append(" OFFSET ?");
            params.add(plan.offset());
        }
        return new SqlRequest(sql.toString(), params, columnLabels);
    }

    private static String projection(SelectItem item, Map<String, String> aggregateExprs, List<Object> params) {
        String column = item.tableAlias() + "." + item.field();
        switch (item.kind()) {
            case COLUMN:
                return column;
            case TRUNCATED_DATE:
                return "date_trunc('" + item.granularity().unit() + "', " + column + ")";
            case BUCKET: {
                StringBuilder sb = new StringBuilder("CASE");
                for (SelectItem.Bucket bucket : item.buckets()) {
                    sb.append(" WHEN ").append(bucket.condition().sql()).append(" THEN ?");
                    params.addAll(bucket.condition().parameters());
                    params.add(bucket.label());
                }
                return sb.append(" ELSE CAST(").append(column).append(" AS TEXT) END").toString();
            }
            case AGGREGATE:
                return aggregateExprs.get(item.sourceId());
            case FORMULA:
                return formulaExpr(item.formula(), aggregateExprs);
            default:
                throw new IllegalStateException("Unhandled projection kind " + item.kind());
        }
    }

    static String aggregateExpr(SelectItem item) {
        String column = item.field() != null ? item.tableAlias() + "." + item.field() : null;
        switch (item.aggregation()) {
            case SUM:
                return "SUM(" + column + ")";
            case AVG:
                return "AVG(" + column + ")";
            case COUNT:
                return column != null ? "COUNT(" + column + ")" : "COUNT(*)";
            case MIN:
                return "MIN(" + column + ")";
            case MAX:
                return "MAX(" + column + ")";
            case MEDIAN:
                return "PERCENTILE_CONT(0.5) WITHIN GROUP (ORDER BY " + column + ")";
            case STDDEV:
                return "STDDEV_SAMP(" + column + ")";
            default:
                throw new IllegalStateException("Unhandled aggregation " + item.aggregation());
        }
    }

    /**
     * ${id} 替换为被引用指标的聚合表达式，除数为 0 时结果为 NULL
     */
    static String formulaExpr(String formula, Map<String, String> aggregateExprs) {
        Matcher divisors = DIVISOR.matcher(formula);
        StringBuilder sb = new StringBuilder();
        while (divisors.find()) {
            String expr = "NULLIF(CAST(" + aggregateExprs.get(divisors.group(1)) + " AS double precision), 0)";
            divisors.appendReplacement(sb, Matcher.quoteReplacement("/ " + expr));
        }
        divisors.appendTail(sb);

        Matcher refs = MeasureFormula.REFERENCE_PATTERN.matcher(sb.toString());
        StringBuilder out = new StringBuilder();
        while (refs.find()) {
            String expr = "CAST(" + aggregateExprs.get(refs.group(1)) + " AS double precision)";
            refs.appendReplacement(out, Matcher.quoteReplacement(expr));
        }
        refs.appendTail(out);
        return "(" + out + ")";
    }

    private static String group(PredicateGroup group, List<Object> params) {
        List<PredicateFragment> fragments = group.fragments();
        fragments.forEach(f -> params.addAll(f.parameters()));
        if (fragments.size() == 1) {
            return fragments.get(0).sql();
        }
        StringJoiner joiner = new StringJoiner(group.logic() == FilterLogic.OR ? " OR " : " AND ", "(", ")");
        fragments.forEach(f -> joiner.add(f.sql()));
        return joiner.toString();
    }

    private static String tableRef(TableRef ref) {
        return ref.table().equals(ref.alias()) ? ref.table() : ref.table() + " AS " + ref.alias();
    }

    private static int position(QueryPlan plan, String alias) {
        for (int i = 0; i < plan.select().size(); i++) {
            if (plan.select().get(i).alias().equals(alias)) {
                return i + 1;
            }
        }
        throw new IllegalStateException("Group by alias not in projection: " + alias);
    }

    static String columnAlias(int position) {
        return "c" + position;
    }
}
