package edu.brandeis.cosi103a.gokifu.runner;

import edu.brandeis.cosi103a.gokifu.ConversionException;
import edu.brandeis.cosi103a.gokifu.format.LoadedRecord;
import edu.brandeis.cosi103a.gokifu.format.RecordConverter;
import edu.brandeis.cosi103a.gokifu.format.RecordLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Converts record files to SGF files, one independent task per input.
 * A failed input is reported in its outcome and never stops the others.
 */
public class BatchConverter {

    private static final Logger log = LoggerFactory.getLogger(BatchConverter.class);

    public static final String OUTPUT_EXTENSION = ".sgf";

    private final Optional<Path> outputDir;

    /**
     * @param outputDir directory for converted files; empty to write each one next to its input
     */
    public BatchConverter(Optional<Path> outputDir) {
        this.outputDir = outputDir;
    }

    /**
     * Converts every input on a fixed-size pool and returns the outcomes in input order.
     */
    public List<FileOutcome> convertAll(List<Path> inputs, int threads) throws InterruptedException {
        ExecutorService threadPool = Executors.newFixedThreadPool(Math.max(1, threads));
        try {
            List<Future<FileOutcome>> futures = new ArrayList<>();
            for (Path input : inputs) {
                futures.add(threadPool.submit(() -> convertFile(input)));
            }

            List<FileOutcome> outcomes = new ArrayList<>();
            for (int i = 0; i < futures.size(); i++) {
                try {
                    outcomes.add(futures.get(i).get());
                } catch (ExecutionException e) {
                    Path input = inputs.get(i);
                    log.error("Unexpected error converting {}", input, e.getCause());
                    outcomes.add(FileOutcome.failed(input, e.getCause()));
                }
            }
            return outcomes;
        } finally {
            threadPool.shutdown();
        }
    }

    /**
     * Converts one file. Nothing is written when the conversion fails.
     */
    public FileOutcome convertFile(Path input) {
        try {
            LoadedRecord record = RecordLoader.load(input);
            String sgf = RecordConverter.convert(record.text(), record.format());
            Path output = outputPathFor(input);
            if (output.getParent() != null) {
                Files.createDirectories(output.getParent());
            }
            Files.writeString(output, sgf, StandardCharsets.UTF_8);
            log.debug("Converted {} ({}) to {}", input, record.format(), output);
            return FileOutcome.converted(input, record.format().name(), output);
        } catch (ConversionException | IOException e) {
            log.warn("Conversion failed for {}: {}", input, e.getMessage());
            return FileOutcome.failed(input, e);
        }
    }

    /**
     * Output path for an input: same base name with the extension replaced by {@code .sgf}.
     */
    Path outputPathFor(Path input) {
        String filename = input.getFileName().toString();
        int dot = filename.lastIndexOf('.');
        String baseName = dot > 0 ? filename.substring(0, dot) : filename;
        String outputName = baseName + OUTPUT_EXTENSION;
        return outputDir.map(dir -> dir.resolve(outputName))
            .orElseGet(() -> input.resolveSibling(outputName));
    }
}
