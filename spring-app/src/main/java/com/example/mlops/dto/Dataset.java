package com.example.mlops.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.List;

/**
 * Labeled rows fetched for a single {@link DataWindow}.
 */
public record Dataset(DataWindow window, List<LabeledRow> rows) {

    public Dataset {
        rows = rows == null ? List.of() : List.copyOf(rows);
    }

    @JsonIgnore
    public boolean isEmpty() {
        return rows.isEmpty();
    }

    public int size() {
        return rows.size();
    }

    /** Input vectors only, in row order. */
    public List<FeatureVector> features() {
        return rows.stream().map(LabeledRow::features).toList();
    }
}
