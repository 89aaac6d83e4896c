package com.fieldinsight.reporting.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.fieldinsight.reporting.core.exception.InvalidReportConfigurationException;

import java.util.Locale;

public enum FilterLogic {
    AND("and"),
    OR("or");

    private final String code;

    FilterLogic(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }

    @JsonCreator
    public static FilterLogic fromCode(String code) {
        if (code == null || code.isBlank()) {
            return AND;
        }
        String normalized = code.trim().toLowerCase(Locale.ROOT);
        if ("and".equals(normalized)) {
            return AND;
        }
        if ("or".equals(normalized)) {
            return OR;
        }
        throw new InvalidReportConfigurationException("Unknown filter logic: " + code);
    }
}
