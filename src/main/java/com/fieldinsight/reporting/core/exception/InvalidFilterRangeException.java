package com.fieldinsight.reporting.core.exception;

/**
 * 区间过滤的下界大于上界
 */
public class InvalidFilterRangeException extends InvalidReportConfigurationException {

    private final Object lower;
    private final Object upper;

    public InvalidFilterRangeException(String field, Object lower, Object upper) {
        super(String.format("Invalid range on '%s': lower bound %s is greater than upper bound %s",
                field, lower, upper));
        this.lower = lower;
        this.upper = upper;
    }

    public Object getLower() {
        return lower;
    }

    public Object getUpper() {
        return upper;
    }
}
