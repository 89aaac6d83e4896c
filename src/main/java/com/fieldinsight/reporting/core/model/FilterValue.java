package com.fieldinsight.reporting.core.model;

import com.fasterxml.jackson.annotation.JsonValue;
import com.fieldinsight.reporting.core.exception.FilterValueException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

/**
 * 过滤值的几种形态
 * 由 {@link #decode(FilterOperator, Object)} 根据操作符的取值形态解码，形态不符直接拒绝
 */
public interface FilterValue {

    /**
     * 原始取值，用于序列化和缓存Key计算
     */
    Object raw();

    /**
     * 是否携带实际取值（分区优化只认有值的过滤）
     */
    boolean isPresent();

    record None() implements FilterValue {
        @Override
        @JsonValue
        public Object raw() {
            return null;
        }

        @Override
        public boolean isPresent() {
            return true;
        }
    }

    record Single(Object value) implements FilterValue {
        public Single {
            if (value == null) {
                throw new FilterValueException("Filter value is required");
            }
        }

        @Override
        @JsonValue
        public Object raw() {
            return value;
        }

        @Override
        public boolean isPresent() {
            return !(value instanceof String) || !((String) value).isBlank();
        }
    }

    record Range(Object lower, Object upper) implements FilterValue {
        public Range {
            if (lower == null || upper == null) {
                throw new FilterValueException("Range filter requires both a lower and an upper bound");
            }
        }

        @Override
        @JsonValue
        public Object raw() {
            return List.of(lower, upper);
        }

        @Override
        public boolean isPresent() {
            return true;
        }
    }

    record ValueList(List<Object> values) implements FilterValue {
        public ValueList {
            if (values == null || values.isEmpty()) {
                throw new FilterValueException("Membership filter requires at least one value");
            }
            values = Collections.unmodifiableList(new ArrayList<>(values));
        }

        @Override
        @JsonValue
        public Object raw() {
            return values;
        }

        @Override
        public boolean isPresent() {
            return true;
        }
    }

    static FilterValue decode(FilterOperator operator, Object raw) {
        switch (operator.arity()) {
            case NONE:
                return new None();
            case SINGLE:
                if (raw instanceof Collection || (raw != null && raw.getClass().isArray())) {
                    throw new FilterValueException(
                            String.format("Operator '%s' expects a single value", operator.code()));
                }
                return new Single(raw);
            case RANGE: {
                List<Object> bounds = toList(raw);
                if (bounds.size() != 2) {
                    throw new FilterValueException(String.format(
                            "Operator '%s' expects exactly two bounds, got %d", operator.code(), bounds.size()));
                }
                return new Range(bounds.get(0), bounds.get(1));
            }
            case LIST:
                return new ValueList(toList(raw));
            default:
                throw new IllegalStateException("Unhandled arity " + operator.arity());
        }
    }

    private static List<Object> toList(Object raw) {
        if (raw == null) {
            return List.of();
        }
        if (raw instanceof Collection) {
            return new ArrayList<>((Collection<?>) raw);
        }
        if (raw instanceof Object[]) {
            return Arrays.asList((Object[]) raw);
        }
        if (raw instanceof String) {
            // 旧版前端把区间/列表编码为逗号分隔字符串
            List<Object> parts = new ArrayList<>();
            for (String part : ((String) raw).split(",")) {
                String trimmed = part.trim();
                if (!trimmed.isEmpty()) {
                    parts.add(trimmed);
                }
            }
            return parts;
        }
        return List.of(raw);
    }
}
