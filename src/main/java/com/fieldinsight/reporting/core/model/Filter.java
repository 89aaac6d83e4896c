package com.fieldinsight.reporting.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fieldinsight.reporting.core.exception.FilterValueException;
import com.fieldinsight.reporting.core.exception.InvalidReportConfigurationException;

/**
 * 过滤条件
 *
 * @param dataSource       所属数据源ID，为空表示主数据源
 * @param relationshipPath 过滤字段属于其它实体时的显式连接路径，最后一跳的目标表即字段所在表
 */
public record Filter(
        String id,
        String field,
        FilterOperator operator,
        FilterValue value,
        String dataSource,
        FilterLogic logic,
        RelationshipPath relationshipPath) {

    public Filter {
        SqlIdentifiers.require(field, "filter field");
        if (operator == null) {
            throw new InvalidReportConfigurationException("Filter on '" + field + "' has no operator");
        }
        if (value == null) {
            value = FilterValue.decode(operator, null);
        }
        checkArity(operator, value);
        logic = logic != null ? logic : FilterLogic.AND;
        id = id != null ? id : field + ":" + operator.code();
    }

    /**
     * 从原始（JSON）取值构造，操作符编码未知时抛出 UnsupportedOperatorException
     */
    @JsonCreator
    public static Filter of(
            @JsonProperty("id") String id,
            @JsonProperty("field") String field,
            @JsonProperty("operator") String operator,
            @JsonProperty("value") Object value,
            @JsonProperty("dataSource") String dataSource,
            @JsonProperty("logic") String logic,
            @JsonProperty("relationshipPath") RelationshipPath relationshipPath) {
        FilterOperator op = FilterOperator.fromCode(operator);
        return new Filter(id, field, op, FilterValue.decode(op, value), dataSource,
                FilterLogic.fromCode(logic), relationshipPath);
    }

    public static Filter of(String field, FilterOperator operator, Object value) {
        return new Filter(null, field, operator, FilterValue.decode(operator, value), null, FilterLogic.AND, null);
    }

    public Filter onDataSource(String dataSourceId) {
        return new Filter(id, field, operator, value, dataSourceId, logic, relationshipPath);
    }

    public Filter withLogic(FilterLogic newLogic) {
        return new Filter(id, field, operator, value, dataSource, newLogic, relationshipPath);
    }

    public Filter withId(String newId) {
        return new Filter(newId, field, operator, value, dataSource, logic, relationshipPath);
    }

    public boolean hasRelationshipPath() {
        return relationshipPath != null;
    }

    private static void checkArity(FilterOperator operator, FilterValue value) {
        boolean consistent;
        switch (operator.arity()) {
            case NONE:
                consistent = value instanceof FilterValue.None;
                break;
            case SINGLE:
                consistent = value instanceof FilterValue.Single;
                break;
            case RANGE:
                consistent = value instanceof FilterValue.Range;
                break;
            case LIST:
                consistent = value instanceof FilterValue.ValueList;
                break;
            default:
                consistent = false;
        }
        if (!consistent) {
            throw new FilterValueException(String.format("Operator '%s' cannot take a %s value",
                    operator.code(), value.getClass().getSimpleName()));
        }
    }
}
