package com.fieldinsight.reporting.core.model.result;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public record DataMetadata(List<DimensionDescriptor> dimensions, List<MeasureDescriptor> measures) {

    public DataMetadata {
        dimensions = Collections.unmodifiableList(new ArrayList<>(dimensions));
        measures = Collections.unmodifiableList(new ArrayList<>(measures));
    }
}
