package com.conveyal.hills.model;

/**
 * Generic runtime exception for any problem with the inputs to an occupancy analysis: invalid parameters, malformed
 * stop data, or configuration that cannot be interpreted. These are raised before any computation begins.
 */
public class HillsException extends RuntimeException {

    public HillsException (String message) {
        super(message);
    }

    public HillsException (String message, Throwable cause) {
        super(message, cause);
    }

}
