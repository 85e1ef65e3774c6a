package org.carball.showplan.parser;

/**
 * The input is empty or not well-formed XML.
 */
public class MalformedPlanXmlException extends ShowPlanParseException {

    public MalformedPlanXmlException(String message) {
        super(message);
    }

    public MalformedPlanXmlException(String message, Throwable cause) {
        super(message, cause);
    }
}
