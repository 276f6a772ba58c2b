package edu.brandeis.cosi103a.gokifu.runner;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Result of converting a single input file. Fields that do not apply are written as null.
 */
public record FileOutcome(
    @JsonProperty("input") String input,
    @JsonProperty("status") Status status,
    @JsonProperty("format") Optional<String> format,
    @JsonProperty("output") Optional<String> output,
    @JsonProperty("error") Optional<String> error
) {

    public enum Status {
        CONVERTED,
        FAILED
    }

    public static FileOutcome converted(Path input, String format, Path output) {
        return new FileOutcome(input.toString(), Status.CONVERTED,
            Optional.of(format), Optional.of(output.toString()), Optional.empty());
    }

    public static FileOutcome failed(Path input, Throwable cause) {
        String message = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        return new FileOutcome(input.toString(), Status.FAILED,
            Optional.empty(), Optional.empty(), Optional.of(message));
    }

    public boolean succeeded() {
        return status == Status.CONVERTED;
    }
}
