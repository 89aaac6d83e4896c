package com.fieldinsight.reporting.core.model.result;

/**
 * 单个指标在结果集上的汇总，NoValue 不参与计算
 *
 * @param count      行数
 * @param valueCount 有值的行数
 */
public record MeasureSummary(int count, int valueCount, MeasureValue sum, MeasureValue avg,
                             MeasureValue min, MeasureValue max) {
}
