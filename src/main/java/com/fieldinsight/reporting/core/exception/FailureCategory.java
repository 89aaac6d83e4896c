package com.fieldinsight.reporting.core.exception;

/**
 * 失败分类
 * 上游据此区分“报表定义无效”和“暂时无法获取数据”，给出不同的界面处理
 */
public enum FailureCategory {
    /** 报表配置错误，执行前即可发现，重试无意义 */
    CONFIGURATION,
    /** 数据源不可用、查询被拒绝或超时 */
    EXECUTION,
    /** 返回行结构与声明的维度/指标不一致 */
    TRANSFORMATION
}
