package edu.brandeis.cosi103a.gokifu;

/**
 * Thrown when a normalized record declares a board size outside 1..19.
 */
public class BoardSizeException extends ConversionException {
    public BoardSizeException(int size) {
        super("Unsupported board size: " + size);
    }
}
