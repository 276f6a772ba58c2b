package edu.brandeis.cosi103a.gokifu.runner;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Main entry point for the batch converter CLI.
 *
 * <p>Invocation:
 * <pre>
 * java -jar go-kifu-converter.jar game1.gib game2.ngf game3.ugi \
 *   --output ./sgf --report ./sgf/report.json --threads 4
 * </pre>
 *
 * <p>Each input is converted to an {@code .sgf} file with the same base name. Inputs that
 * fail are reported and skipped.
 */
public class ConverterCli {

    static final int EXIT_OK = 0;
    static final int EXIT_USAGE = 1;
    static final int EXIT_FAILURES = 2;
    static final int EXIT_ERROR = 3;

    public static void main(String[] args) {
        int status = execute(args, System.out, System.err);
        if (status != EXIT_OK) {
            System.exit(status);
        }
    }

    /**
     * Runs a batch, mapping argument errors to {@link #EXIT_USAGE} and run failures
     * (report I/O, interruption) to {@link #EXIT_ERROR}.
     */
    static int execute(String[] args, PrintStream out, PrintStream err) {
        try {
            return run(args, out, err);
        } catch (IllegalArgumentException e) {
            err.println(e.getMessage());
            printUsage(err);
            return EXIT_USAGE;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            err.println("Conversion run interrupted");
            return EXIT_ERROR;
        } catch (IOException e) {
            err.println("Conversion run failed: " + e.getMessage());
            return EXIT_ERROR;
        }
    }

    /**
     * Runs a batch and returns the process exit status.
     *
     * @throws IllegalArgumentException if the arguments are malformed
     */
    static int run(String[] args, PrintStream out, PrintStream err) throws IOException, InterruptedException {
        if (args.length == 0) {
            printUsage(out);
            return EXIT_USAGE;
        }

        ConversionConfig config = parseArgs(args);
        if (config.inputs().isEmpty()) {
            throw new IllegalArgumentException("No input files given");
        }

        BatchConverter converter = new BatchConverter(config.outputDir());
        List<FileOutcome> outcomes = converter.convertAll(config.inputs(), config.threads());

        for (FileOutcome outcome : outcomes) {
            if (outcome.succeeded()) {
                out.printf("Converted %s -> %s%n", outcome.input(), outcome.output().orElse(""));
            } else {
                err.printf("Conversion failed for %s: %s%n", outcome.input(), outcome.error().orElse(""));
            }
        }

        ConversionReport report = ConversionReport.of(outcomes);
        if (config.report().isPresent()) {
            new ReportFileWriter().write(report, config.report().get());
            out.println("Report written to " + config.report().get());
        }

        out.printf("%d converted, %d failed%n", report.converted(), report.failed());
        return report.failed() == 0 ? EXIT_OK : EXIT_FAILURES;
    }

    /**
     * Parses CLI arguments into a ConversionConfig. Anything that is not an option is an input file.
     *
     * @throws IllegalArgumentException if an option is unknown or missing its value
     */
    static ConversionConfig parseArgs(String[] args) {
        List<Path> inputs = new ArrayList<>();
        Optional<Path> outputDir = Optional.empty();
        Optional<Path> report = Optional.empty();
        int threads = ConversionConfig.DEFAULT_THREADS;

        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--output" -> outputDir = Optional.of(Path.of(optionValue(args, ++i, "--output")));
                case "--report" -> report = Optional.of(Path.of(optionValue(args, ++i, "--report")));
                case "--threads" -> {
                    String value = optionValue(args, ++i, "--threads");
                    try {
                        threads = Integer.parseInt(value);
                    } catch (NumberFormatException e) {
                        throw new IllegalArgumentException("--threads requires a number, got: " + value);
                    }
                    if (threads < 1) {
                        throw new IllegalArgumentException("--threads must be at least 1");
                    }
                }
                default -> {
                    if (args[i].startsWith("--")) {
                        throw new IllegalArgumentException("Unknown argument: " + args[i]);
                    }
                    inputs.add(Path.of(args[i]));
                }
            }
        }

        return new ConversionConfig(List.copyOf(inputs), outputDir, report, threads);
    }

    private static String optionValue(String[] args, int index, String option) {
        if (index >= args.length) {
            throw new IllegalArgumentException(option + " requires an argument");
        }
        return args[index];
    }

    private static void printUsage(PrintStream out) {
        out.println("Usage: ConverterCli <record files...> [options]");
        out.println();
        out.println("Converts .gib, .ngf, .ugf and .ugi game records to .sgf files.");
        out.println();
        out.println("Options:");
        out.println("  --output <dir>     Write SGF files here instead of next to each input");
        out.println("  --report <file>    Write a JSON summary of the run");
        out.println("  --threads <n>      Number of files converted in parallel");
    }
}
