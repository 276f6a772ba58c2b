package edu.brandeis.cosi103a.gokifu;

/**
 * Thrown when a record violates the structure of its dialect badly enough that no tree is produced.
 */
public class ParseFailureException extends ConversionException {
    public ParseFailureException(String message) {
        super(message);
    }
}
