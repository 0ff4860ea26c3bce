package com.conveyal.hills.analysis;

import com.conveyal.hills.binning.ConservationResult;
import com.conveyal.hills.model.CategoryKey;
import com.conveyal.hills.model.RecordRelationship;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Everything noteworthy that happened during one analysis run: data quality counters, record relationship counts per
 * category, conservation check results and every warning raised. Warnings are logged as they are added, but the
 * caller should rely on this object rather than on log output. Filled in by the thread running the analysis and
 * treated as read-only once the result has been returned.
 */
public class AnalysisDiagnostics {

    private static final Logger LOG = LoggerFactory.getLogger(AnalysisDiagnostics.class);

    public int recordsRead;

    public int missingEntryDropped;

    public int missingExitDropped;

    public int censoredDeparturesAdjusted;

    public int uncategorizedDropped;

    public int excludedDropped;

    public int recordsAnalyzed;

    private final List<String> warnings = new ArrayList<>();

    private final Map<CategoryKey, Map<RecordRelationship, Integer>> relationshipCounts = new TreeMap<>();

    private final Map<CategoryKey, ConservationResult> conservation = new TreeMap<>();

    public void warn (String warning) {
        LOG.warn(warning);
        warnings.add(warning);
    }

    /** Record warnings that have already been logged by the component that raised them. */
    void addLoggedWarnings (List<String> logged) {
        warnings.addAll(logged);
    }

    void putRelationshipCounts (CategoryKey category, Map<RecordRelationship, Integer> counts) {
        Map<RecordRelationship, Integer> copy = new EnumMap<>(RecordRelationship.class);
        copy.putAll(counts);
        relationshipCounts.put(category, Collections.unmodifiableMap(copy));
    }

    void putConservation (CategoryKey category, ConservationResult result) {
        conservation.put(category, result);
        warnings.addAll(result.warnings);
    }

    public List<String> getWarnings () {
        return Collections.unmodifiableList(warnings);
    }

    public Map<CategoryKey, Map<RecordRelationship, Integer>> getRelationshipCounts () {
        return Collections.unmodifiableMap(relationshipCounts);
    }

    public Map<CategoryKey, ConservationResult> getConservation () {
        return Collections.unmodifiableMap(conservation);
    }

    /** Number of records in the category with the given relationship to the window. */
    public int relationshipCount (CategoryKey category, RecordRelationship relationship) {
        Map<RecordRelationship, Integer> counts = relationshipCounts.get(category);
        if (counts == null) return 0;
        return counts.getOrDefault(relationship, 0);
    }

    public boolean hasWarnings () {
        return !warnings.isEmpty();
    }

}
