package edu.brandeis.cosi103a.gokifu.runner;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * Summary of one batch run, written as JSON when the CLI is given {@code --report}.
 */
public record ConversionReport(
    @JsonProperty("converted") int converted,
    @JsonProperty("failed") int failed,
    @JsonProperty("files") ImmutableList<FileOutcome> files
) {

    public static ConversionReport of(List<FileOutcome> outcomes) {
        int converted = (int) outcomes.stream().filter(FileOutcome::succeeded).count();
        return new ConversionReport(converted, outcomes.size() - converted, ImmutableList.copyOf(outcomes));
    }
}
