package com.fieldinsight.reporting.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 权限层提供的执行上下文
 * 引擎不解释其含义，只把它转换为隐式过滤条件
 *
 * @param allowedProgramIds    可访问的项目范围，为空表示不限制
 * @param defaultProgramId     未指定项目过滤时默认使用的项目
 * @param defaultDateRangeDays 未指定时间范围时默认回溯的天数
 */
public record ExecutionContext(
        String companyId,
        String userId,
        List<String> allowedProgramIds,
        String defaultProgramId,
        Integer defaultDateRangeDays) {

    public ExecutionContext {
        allowedProgramIds = allowedProgramIds != null
                ? Collections.unmodifiableList(new ArrayList<>(allowedProgramIds))
                : List.of();
    }

    public static ExecutionContext unscoped() {
        return new ExecutionContext(null, null, List.of(), null, null);
    }
}
