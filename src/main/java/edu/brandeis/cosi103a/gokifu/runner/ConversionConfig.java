package edu.brandeis.cosi103a.gokifu.runner;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Batch conversion settings parsed from CLI args.
 *
 * @param inputs    record files to convert, in the order given
 * @param outputDir directory for the SGF files; empty means next to each input
 * @param report    where to write the JSON report, if anywhere
 * @param threads   size of the conversion thread pool
 */
public record ConversionConfig(
    List<Path> inputs,
    Optional<Path> outputDir,
    Optional<Path> report,
    int threads
) {

    public static final int DEFAULT_THREADS = Math.min(8, Math.max(2, Runtime.getRuntime().availableProcessors()));

    /**
     * Convenience constructor: outputs beside the inputs, no report, default thread count.
     */
    public ConversionConfig(List<Path> inputs) {
        this(inputs, Optional.empty(), Optional.empty(), DEFAULT_THREADS);
    }
}
