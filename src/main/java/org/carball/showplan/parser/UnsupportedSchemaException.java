package org.carball.showplan.parser;

/**
 * Well-formed XML whose root is not a showplan document.
 */
public class UnsupportedSchemaException extends ShowPlanParseException {

    public UnsupportedSchemaException(String message) {
        super(message);
    }
}
