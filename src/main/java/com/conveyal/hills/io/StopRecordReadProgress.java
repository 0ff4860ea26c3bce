package com.conveyal.hills.io;

import org.slf4j.Logger;

/**
 * Tallies the rows of a stop data file as they are read, logging every logFrequency rows with the input line reached.
 * Rows with an empty entry or exit cell are counted separately. Those rows are still returned by the reader and only
 * dropped later, when the analysis preprocesses its records.
 */
class StopRecordReadProgress {

    private final Logger logger;

    private final int logFrequency;

    private int rows = 0;

    private int missingEntry = 0;

    private int missingExit = 0;

    private long lastLine = 0;

    StopRecordReadProgress (Logger logger, int logFrequency) {
        this.logger = logger;
        this.logFrequency = logFrequency;
    }

    void row (long line, boolean hasEntry, boolean hasExit) {
        rows += 1;
        lastLine = line;
        if (!hasEntry) {
            missingEntry += 1;
        }
        if (!hasExit) {
            missingExit += 1;
        }
        if (rows % logFrequency == 0) {
            logger.info("Read {} stop records through line {}", rows, line);
        }
    }

    void done () {
        logger.info("Done. Read {} stop records ending at line {}, {} without entry time, {} without exit time.",
                rows, lastLine, missingEntry, missingExit);
    }

    int rows () {
        return rows;
    }

    int missingEntry () {
        return missingEntry;
    }

    int missingExit () {
        return missingExit;
    }

}
