package edu.brandeis.cosi103a.gokifu.web;

import com.fasterxml.jackson.annotation.JsonProperty;
import edu.brandeis.cosi103a.gokifu.format.RecordFormat;

/**
 * Public description of a supported input format.
 */
public record FormatInfo(
    @JsonProperty("tag") String tag,
    @JsonProperty("extension") String extension,
    @JsonProperty("charset") String charset
) {

    public static FormatInfo of(RecordFormat format) {
        return new FormatInfo(format.name(), format.extension(), format.charset().name());
    }
}
