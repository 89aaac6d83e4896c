package com.fieldinsight.reporting.core.model;

import com.fieldinsight.reporting.core.exception.InvalidReportConfigurationException;

import java.util.LinkedHashSet;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 派生指标公式，如 ${dead_count} / ${total_count} * 100
 * 只允许指标引用、数字、四则运算和括号
 */
public final class MeasureFormula {

    // 匹配 ${measureId}
    public static final Pattern REFERENCE_PATTERN = Pattern.compile("\\$\\{([A-Za-z0-9_\\-]+)\\}");

    private static final Pattern ARITHMETIC = Pattern.compile("[0-9.+\\-*/()\\s]*");

    private MeasureFormula() {
    }

    public static void validate(String formula, String measureId) {
        if (formula.isBlank()) {
            throw new InvalidReportConfigurationException("Formula of measure '" + measureId + "' is empty");
        }
        String rest = REFERENCE_PATTERN.matcher(formula).replaceAll(" ");
        if (!ARITHMETIC.matcher(rest).matches()) {
            throw new InvalidReportConfigurationException(String.format(
                    "Formula of measure '%s' contains unsupported tokens: %s", measureId, formula));
        }
        if (references(formula).isEmpty()) {
            throw new InvalidReportConfigurationException(
                    "Formula of measure '" + measureId + "' does not reference any measure");
        }
    }

    public static Set<String> references(String formula) {
        Set<String> refs = new LinkedHashSet<>();
        Matcher matcher = REFERENCE_PATTERN.matcher(formula);
        while (matcher.find()) {
            refs.add(matcher.group(1));
        }
        return refs;
    }
}
