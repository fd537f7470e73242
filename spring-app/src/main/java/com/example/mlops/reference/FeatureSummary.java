package com.example.mlops.reference;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Frozen description of one feature's reference distribution.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "kind")
@JsonSubTypes({
        @JsonSubTypes.Type(value = NumericSummary.class, name = "numeric"),
        @JsonSubTypes.Type(value = CategoricalSummary.class, name = "categorical")
})
public interface FeatureSummary {

    /** Number of reference observations the summary was built from. */
    long count();
}
