package com.fieldinsight.reporting.core.compiler;

import com.fieldinsight.reporting.core.exception.FilterValueException;
import com.fieldinsight.reporting.core.exception.InvalidFilterRangeException;
import com.fieldinsight.reporting.core.model.Filter;
import com.fieldinsight.reporting.core.model.FilterOperator;
import com.fieldinsight.reporting.core.model.FilterValue;
import com.fieldinsight.reporting.core.model.SqlIdentifiers;
import com.fieldinsight.reporting.core.model.plan.PredicateFragment;
import jakarta.enterprise.context.ApplicationScoped;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeParseException;
import java.time.temporal.Temporal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * 过滤条件编译器
 * 把一个 Filter 编译为参数化谓词片段，过滤值只会出现在绑定参数里
 */
@ApplicationScoped
public class FilterPredicateCompiler {

    private static final char LIKE_ESCAPE = '\\';

    public PredicateFragment compile(Filter filter, String tableAlias) {
        SqlIdentifiers.require(tableAlias, "table alias");
        String column = tableAlias + "." + filter.field();
        FilterOperator op = filter.operator();
        FilterValue value = filter.value();

        switch (op) {
            case EQUALS:
                return fragment(column, op, column + " = ?", single(value));
            case NOT_EQUALS:
                return fragment(column, op, column + " <> ?", single(value));
            case CONTAINS:
                return fragment(column, op, likeSql(column, false),
                        List.of("%" + escapeLike(single(value)) + "%"));
            case NOT_CONTAINS:
                return fragment(column, op, likeSql(column, true),
                        List.of("%" + escapeLike(single(value)) + "%"));
            case STARTS_WITH:
                return fragment(column, op, likeSql(column, false), List.of(escapeLike(single(value)) + "%"));
            case ENDS_WITH:
                return fragment(column, op, likeSql(column, false), List.of("%" + escapeLike(single(value))));
            case IS_NULL:
                return fragment(column, op, column + " IS NULL", List.of());
            case IS_NOT_NULL:
                return fragment(column, op, column + " IS NOT NULL", List.of());
            case GREATER_THAN:
                return fragment(column, op, column + " > ?", single(value));
            case GREATER_THAN_OR_EQUAL:
                return fragment(column, op, column + " >= ?", single(value));
            case LESS_THAN:
                return fragment(column, op, column + " < ?", single(value));
            case LESS_THAN_OR_EQUAL:
                return fragment(column, op, column + " <= ?", single(value));
            case BETWEEN:
            case NOT_BETWEEN: {
                FilterValue.Range range = (FilterValue.Range) value;
                checkRange(filter.field(), range);
                String keyword = op == FilterOperator.BETWEEN ? " BETWEEN ? AND ?" : " NOT BETWEEN ? AND ?";
                return fragment(column, op, column + keyword, List.of(range.lower(), range.upper()));
            }
            case IN:
            case NOT_IN: {
                List<Object> values = ((FilterValue.ValueList) value).values();
                String placeholders = String.join(", ", Collections.nCopies(values.size(), "?"));
                String keyword = op == FilterOperator.IN ? " IN (" : " NOT IN (";
                return fragment(column, op, column + keyword + placeholders + ")", values);
            }
            case REGEX: {
                String pattern = String.valueOf(((FilterValue.Single) value).value());
                checkPattern(filter.field(), pattern);
                return fragment(column, op, column + " ~ ?", List.of(pattern));
            }
            default:
                throw new IllegalStateException("Unhandled operator " + op);
        }
    }

    private static PredicateFragment fragment(String column, FilterOperator op, String sql, List<Object> params) {
        return new PredicateFragment(column, op, sql, params);
    }

    private static List<Object> single(FilterValue value) {
        List<Object> params = new ArrayList<>(1);
        params.add(((FilterValue.Single) value).value());
        return params;
    }

    private static String likeSql(String column, boolean negated) {
        return "LOWER(" + column + ")" + (negated ? " NOT LIKE " : " LIKE ") + "LOWER(?) ESCAPE '\\'";
    }

    private static String escapeLike(List<Object> single) {
        String raw = String.valueOf(single.get(0));
        StringBuilder sb = new StringBuilder(raw.length() + 4);
        for (char c : raw.toCharArray()) {
            if (c == '%' || c == '_' || c == LIKE_ESCAPE) {
                sb.append(LIKE_ESCAPE);
            }
            sb.append(c);
        }
        return sb.toString();
    }

    private static void checkPattern(String field, String pattern) {
        try {
            Pattern.compile(pattern);
        } catch (PatternSyntaxException e) {
            throw new FilterValueException(
                    String.format("Invalid regular expression on '%s': %s", field, e.getDescription()), e);
        }
    }

    /**
     * 下界不得大于上界；数字按数值比较，ISO 日期按时间比较，其余按字符串比较
     */
    static void checkRange(String field, FilterValue.Range range) {
        Object lower = range.lower();
        Object upper = range.upper();

        BigDecimal lowerNum = toNumber(lower);
        BigDecimal upperNum = toNumber(upper);
        if (lowerNum != null && upperNum != null) {
            if (lowerNum.compareTo(upperNum) > 0) {
                throw new InvalidFilterRangeException(field, lower, upper);
            }
            return;
        }

        Instant lowerTime = toInstant(lower);
        Instant upperTime = toInstant(upper);
        if (lowerTime != null && upperTime != null) {
            if (lowerTime.isAfter(upperTime)) {
                throw new InvalidFilterRangeException(field, lower, upper);
            }
            return;
        }

        if (lowerNum != null || upperNum != null) {
            throw new FilterValueException(String.format(
                    "Range on '%s' mixes numeric and non-numeric bounds: [%s, %s]", field, lower, upper));
        }
        if (String.valueOf(lower).compareTo(String.valueOf(upper)) > 0) {
            throw new InvalidFilterRangeException(field, lower, upper);
        }
    }

    private static BigDecimal toNumber(Object value) {
        if (value instanceof BigDecimal) {
            return (BigDecimal) value;
        }
        if (value instanceof Number) {
            return new BigDecimal(value.toString());
        }
        if (value instanceof String) {
            try {
                return new BigDecimal(((String) value).trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    /**
     * 带时区偏移的取值按绝对时刻比较，不带偏移的按 UTC 解释
     */
    private static Instant toInstant(Object value) {
        if (value instanceof Temporal) {
            if (value instanceof Instant) {
                return (Instant) value;
            }
            if (value instanceof OffsetDateTime) {
                return ((OffsetDateTime) value).toInstant();
            }
            if (value instanceof ZonedDateTime) {
                return ((ZonedDateTime) value).toInstant();
            }
            if (value instanceof LocalDateTime) {
                return ((LocalDateTime) value).toInstant(ZoneOffset.UTC);
            }
            if (value instanceof LocalDate) {
                return ((LocalDate) value).atStartOfDay(ZoneOffset.UTC).toInstant();
            }
            return null;
        }
        if (!(value instanceof String)) {
            return null;
        }
        String text = ((String) value).trim();
        try {
            if (text.length() == 10) {
                return LocalDate.parse(text).atStartOfDay(ZoneOffset.UTC).toInstant();
            }
            if (text.endsWith("Z") || text.matches(".*[+-]\\d{2}:\\d{2}$")) {
                return OffsetDateTime.parse(text).toInstant();
            }
            return LocalDateTime.parse(text).toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            return null;
        }
    }
}
