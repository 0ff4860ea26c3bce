package com.conveyal.hills.binning;

import com.conveyal.hills.model.RecordRelationship;

import java.util.Collections;
import java.util.Map;

/** The outcome of accumulating one category: its fine grid matrix and the count of records by relationship type. */
public class CategoryAccumulation {

    public final FineGridMatrix matrix;

    public final Map<RecordRelationship, Integer> relationshipCounts;

    CategoryAccumulation (FineGridMatrix matrix, Map<RecordRelationship, Integer> relationshipCounts) {
        this.matrix = matrix;
        this.relationshipCounts = Collections.unmodifiableMap(relationshipCounts);
    }

    public int count (RecordRelationship relationship) {
        return relationshipCounts.getOrDefault(relationship, 0);
    }

}
