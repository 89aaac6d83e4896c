package com.fieldinsight.reporting.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.fieldinsight.reporting.core.exception.InvalidReportConfigurationException;

import java.util.Locale;

public enum DataType {
    STRING("string"),
    NUMBER("number"),
    DATE("date"),
    DATETIME("datetime"),
    BOOLEAN("boolean"),
    JSON("json");

    private final String code;

    DataType(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }

    public boolean isTemporal() {
        return this == DATE || this == DATETIME;
    }

    @JsonCreator
    public static DataType fromCode(String code) {
        if (code == null) {
            return STRING;
        }
        String normalized = code.trim().toLowerCase(Locale.ROOT);
        for (DataType type : values()) {
            if (type.code.equals(normalized)) {
                return type;
            }
        }
        // 旧版配置中存在 text/integer/numeric 等写法
        switch (normalized) {
            case "text":
            case "uuid":
                return STRING;
            case "integer":
            case "numeric":
                return NUMBER;
            default:
                throw new InvalidReportConfigurationException("Unknown data type: " + code);
        }
    }
}
