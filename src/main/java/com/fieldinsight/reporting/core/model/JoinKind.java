package com.fieldinsight.reporting.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.fieldinsight.reporting.core.exception.InvalidReportConfigurationException;

import java.util.Locale;

public enum JoinKind {
    INNER("INNER JOIN"),
    LEFT("LEFT JOIN"),
    RIGHT("RIGHT JOIN");

    private final String sql;

    JoinKind(String sql) {
        this.sql = sql;
    }

    public String sql() {
        return sql;
    }

    @JsonValue
    public String code() {
        return name();
    }

    @JsonCreator
    public static JoinKind fromCode(String code) {
        if (code == null || code.isBlank()) {
            return INNER;
        }
        try {
            return valueOf(code.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new InvalidReportConfigurationException("Unknown join kind: " + code, e);
        }
    }
}
