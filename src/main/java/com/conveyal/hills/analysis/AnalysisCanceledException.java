package com.conveyal.hills.analysis;

/** Thrown out of a running analysis after its caller has asked for it to stop. */
public class AnalysisCanceledException extends RuntimeException {

    public AnalysisCanceledException (String message) {
        super(message);
    }

    public AnalysisCanceledException (String message, Throwable cause) {
        super(message, cause);
    }

}
