package com.fieldinsight.reporting.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum SortDirection {
    ASC,
    DESC;

    @JsonValue
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static SortDirection fromCode(String code) {
        return code != null && "desc".equalsIgnoreCase(code.trim()) ? DESC : ASC;
    }
}
