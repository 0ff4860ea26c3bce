package com.conveyal.hills.summary;

/** Statistics of one measure within one group. */
public class SummaryRow {

    public final GroupKey key;

    public final SummaryStatistics statistics;

    public SummaryRow (GroupKey key, SummaryStatistics statistics) {
        this.key = key;
        this.statistics = statistics;
    }

    public double get (String column) {
        return statistics.get(column);
    }

}
