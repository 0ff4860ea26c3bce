package com.conveyal.hills.binning;

import com.conveyal.hills.model.AnalysisWindow;
import com.conveyal.hills.model.RecordRelationship;

import java.time.LocalDateTime;

import static com.conveyal.hills.model.RecordRelationship.BACKWARDS;
import static com.conveyal.hills.model.RecordRelationship.INNER;
import static com.conveyal.hills.model.RecordRelationship.LEFT;
import static com.conveyal.hills.model.RecordRelationship.NONE;
import static com.conveyal.hills.model.RecordRelationship.OUTER;
import static com.conveyal.hills.model.RecordRelationship.RIGHT;

/**
 * Classifies a single stay against the analysis window. The window is half-open: an instant equal to the window start
 * is inside it, an instant equal to the window end is not.
 */
public abstract class RecordClassifier {

    public static RecordRelationship classify (LocalDateTime entry, LocalDateTime exit,
                                              LocalDateTime windowStart, LocalDateTime windowEnd) {
        if (exit.isBefore(entry)) {
            return BACKWARDS;
        }
        boolean entryInside = inside(entry, windowStart, windowEnd);
        boolean exitInside = inside(exit, windowStart, windowEnd);
        boolean entryBefore = entry.isBefore(windowStart);
        boolean exitAfter = !exit.isBefore(windowEnd);
        if (entryInside && exitInside) {
            return INNER;
        } else if (entryInside && exitAfter) {
            return RIGHT;
        } else if (entryBefore && exitInside) {
            return LEFT;
        } else if (entryBefore && exitAfter) {
            return OUTER;
        } else {
            return NONE;
        }
    }

    public static RecordRelationship classify (LocalDateTime entry, LocalDateTime exit, AnalysisWindow window) {
        return classify(entry, exit, window.start, window.end);
    }

    private static boolean inside (LocalDateTime instant, LocalDateTime windowStart, LocalDateTime windowEnd) {
        return !instant.isBefore(windowStart) && instant.isBefore(windowEnd);
    }

}
