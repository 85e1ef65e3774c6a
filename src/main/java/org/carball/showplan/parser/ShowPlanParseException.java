package org.carball.showplan.parser;

/**
 * Document level failure. No partial plan is produced when this is thrown.
 */
public class ShowPlanParseException extends RuntimeException {

    public ShowPlanParseException(String message) {
        super(message);
    }

    public ShowPlanParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
