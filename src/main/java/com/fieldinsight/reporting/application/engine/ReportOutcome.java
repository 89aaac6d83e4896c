package com.fieldinsight.reporting.application.engine;

import com.fieldinsight.reporting.core.exception.FailureCategory;
import com.fieldinsight.reporting.core.model.OptimizationMetadata;
import com.fieldinsight.reporting.core.model.result.AggregatedData;

/**
 * 一次报表执行的结果：成功时携带数据和优化信息，失败时携带失败类别
 */
public interface ReportOutcome {

    boolean isSuccess();

    static ReportOutcome success(AggregatedData data, OptimizationMetadata optimization) {
        return new Success(data, optimization);
    }

    static ReportOutcome failure(FailureCategory category, String message) {
        return new Failure(category, message);
    }

    record Success(AggregatedData data, OptimizationMetadata optimization) implements ReportOutcome {
        @Override
        public boolean isSuccess() {
            return true;
        }
    }

    record Failure(FailureCategory category, String message) implements ReportOutcome {
        @Override
        public boolean isSuccess() {
            return false;
        }
    }
}
