package edu.brandeis.cosi103a.gokifu;

/**
 * Thrown when a board coordinate cannot be encoded as a two-letter position.
 */
public class CoordinateRangeException extends ConversionException {
    public CoordinateRangeException(int x, int y) {
        super("Coordinate out of range: (" + x + ", " + y + ")");
    }
}
