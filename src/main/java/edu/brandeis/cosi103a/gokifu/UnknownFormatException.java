package edu.brandeis.cosi103a.gokifu;

/**
 * Thrown when a file name or format tag does not map to a supported dialect.
 */
public class UnknownFormatException extends ConversionException {
    public UnknownFormatException(String name) {
        super("Couldn't detect file type for " + name
            + " -- make sure it has an extension of .gib, .ngf, .ugf or .ugi");
    }
}
