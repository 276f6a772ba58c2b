package edu.brandeis.cosi103a.gokifu;

/**
 * Base type for every failure raised while turning a legacy record into a game tree.
 */
public class ConversionException extends RuntimeException {
    public ConversionException(String message) {
        super(message);
    }
}
