package com.fieldinsight.reporting.core.model.plan;

import com.fieldinsight.reporting.core.model.FilterLogic;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 同一字段上的一组谓词，组内按 logic 组合，组间始终 AND
 */
public record PredicateGroup(FilterLogic logic, List<PredicateFragment> fragments) {

    public PredicateGroup {
        fragments = Collections.unmodifiableList(new ArrayList<>(fragments));
    }

    public static PredicateGroup single(PredicateFragment fragment) {
        return new PredicateGroup(FilterLogic.AND, List.of(fragment));
    }
}
