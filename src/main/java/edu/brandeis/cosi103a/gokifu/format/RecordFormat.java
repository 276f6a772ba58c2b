package edu.brandeis.cosi103a.gokifu.format;

import edu.brandeis.cosi103a.gokifu.parser.GibParser;
import edu.brandeis.cosi103a.gokifu.parser.NgfParser;
import edu.brandeis.cosi103a.gokifu.parser.RecordParser;
import edu.brandeis.cosi103a.gokifu.parser.UgfParser;

import java.nio.charset.Charset;
import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * The legacy record formats this converter reads, each bound to its file extension,
 * the charset its files are written in, and its parser.
 */
public enum RecordFormat {
    GIB(".gib", "UTF-8", new GibParser()),
    NGF(".ngf", "GB18030", new NgfParser()),
    UGF(".ugf", "x-SJIS_0213", new UgfParser()),
    // .ugi files are UGF records under another name
    UGI(".ugi", "x-SJIS_0213", new UgfParser());

    private static final Pattern EXTENSION = Pattern.compile("(\\.\\w+)$");

    private final String extension;
    private final String charsetName;
    private final RecordParser parser;

    RecordFormat(String extension, String charsetName, RecordParser parser) {
        this.extension = extension;
        this.charsetName = charsetName;
        this.parser = parser;
    }

    public String extension() {
        return extension;
    }

    /**
     * Charset the format's files are encoded in.
     */
    public Charset charset() {
        return Charset.forName(charsetName);
    }

    public RecordParser parser() {
        return parser;
    }

    /**
     * Looks up a format by its extension, with or without the leading dot, ignoring case.
     */
    public static Optional<RecordFormat> forExtension(String ext) {
        String normalized = (ext.startsWith(".") ? ext : "." + ext).toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
            .filter(f -> f.extension.equals(normalized))
            .findFirst();
    }

    /**
     * Detects the format from the last extension of a file name.
     */
    public static Optional<RecordFormat> forFilename(String filename) {
        Matcher m = EXTENSION.matcher(filename);
        return m.find() ? forExtension(m.group(1)) : Optional.empty();
    }

    /**
     * Looks up a format by tag name ("gib", "UGF") or extension (".ngf"), ignoring case.
     */
    public static Optional<RecordFormat> forName(String name) {
        if (name.startsWith(".")) {
            return forExtension(name);
        }
        return Arrays.stream(values())
            .filter(f -> f.name().equalsIgnoreCase(name))
            .findFirst();
    }
}
