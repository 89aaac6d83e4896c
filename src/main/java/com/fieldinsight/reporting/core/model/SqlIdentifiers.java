package com.fieldinsight.reporting.core.model;

import com.fieldinsight.reporting.core.exception.InvalidReportConfigurationException;

import java.util.regex.Pattern;

/**
 * 表名/列名/别名校验
 * 只有通过校验的标识符才会出现在生成的 SQL 文本中，值一律走绑定参数
 */
public final class SqlIdentifiers {

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]{0,62}");

    private SqlIdentifiers() {
    }

    public static String require(String value, String what) {
        if (value == null || !IDENTIFIER.matcher(value).matches()) {
            throw new InvalidReportConfigurationException(
                    String.format("Invalid %s identifier: '%s'", what, value));
        }
        return value;
    }

    public static boolean isValid(String value) {
        return value != null && IDENTIFIER.matcher(value).matches();
    }

    /**
     * 展示名作为带引号的列别名输出，不允许包含双引号和控制字符
     */
    public static String requireDisplayName(String value, String what) {
        if (value == null || value.isBlank() || value.length() > 128) {
            throw new InvalidReportConfigurationException("Missing or too long display name for " + what);
        }
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c == '"' || Character.isISOControl(c)) {
                throw new InvalidReportConfigurationException(
                        String.format("Display name of %s contains an illegal character: '%s'", what, value));
            }
        }
        return value;
    }
}
