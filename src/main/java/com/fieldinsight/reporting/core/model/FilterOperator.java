package com.fieldinsight.reporting.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.fieldinsight.reporting.core.exception.UnsupportedOperatorException;

import java.util.Locale;

/**
 * 过滤操作符（封闭集合）
 * 每个操作符声明其取值形态，过滤值在构造时按形态解码
 */
public enum FilterOperator {
    EQUALS("equals", Arity.SINGLE),
    NOT_EQUALS("not_equals", Arity.SINGLE),
    CONTAINS("contains", Arity.SINGLE),
    NOT_CONTAINS("not_contains", Arity.SINGLE),
    STARTS_WITH("starts_with", Arity.SINGLE),
    ENDS_WITH("ends_with", Arity.SINGLE),
    IS_NULL("is_null", Arity.NONE),
    IS_NOT_NULL("is_not_null", Arity.NONE),
    GREATER_THAN("greater_than", Arity.SINGLE),
    GREATER_THAN_OR_EQUAL("greater_than_or_equal", Arity.SINGLE),
    LESS_THAN("less_than", Arity.SINGLE),
    LESS_THAN_OR_EQUAL("less_than_or_equal", Arity.SINGLE),
    BETWEEN("between", Arity.RANGE),
    NOT_BETWEEN("not_between", Arity.RANGE),
    IN("in", Arity.LIST),
    NOT_IN("not_in", Arity.LIST),
    REGEX("regex", Arity.SINGLE);

    public enum Arity {
        NONE, SINGLE, RANGE, LIST
    }

    private final String code;
    private final Arity arity;

    FilterOperator(String code, Arity arity) {
        this.code = code;
        this.arity = arity;
    }

    @JsonValue
    public String code() {
        return code;
    }

    public Arity arity() {
        return arity;
    }

    public boolean isComparison() {
        return this == GREATER_THAN || this == GREATER_THAN_OR_EQUAL
                || this == LESS_THAN || this == LESS_THAN_OR_EQUAL;
    }

    /**
     * 对字段值做等值/成员约束（分区键判定只认这两类）
     */
    public boolean isPointLookup() {
        return this == EQUALS || this == IN;
    }

    @JsonCreator
    public static FilterOperator fromCode(String code) {
        if (code != null) {
            String normalized = code.trim().toLowerCase(Locale.ROOT);
            for (FilterOperator op : values()) {
                if (op.code.equals(normalized)) {
                    return op;
                }
            }
        }
        throw new UnsupportedOperatorException(code);
    }
}
