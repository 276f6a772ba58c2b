package edu.brandeis.cosi103a.gokifu.format;

import edu.brandeis.cosi103a.gokifu.ConversionException;
import edu.brandeis.cosi103a.gokifu.tree.PropertyTree;
import edu.brandeis.cosi103a.gokifu.tree.SgfWriter;
import edu.brandeis.cosi103a.gokifu.tree.TreeNormalizer;

import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;

/**
 * Converts decoded legacy records to SGF text: parse, normalize, write.
 *
 * <p>Every call is independent, so one converter may be shared between threads.
 */
public final class RecordConverter {

    private RecordConverter() {}

    /**
     * Parses and normalizes a record without writing it.
     *
     * @throws ConversionException if the record cannot be parsed or has an unsupported board size
     */
    public static PropertyTree parse(String text, RecordFormat format) {
        PropertyTree tree = format.parser().parse(text).seal();
        return TreeNormalizer.normalize(tree);
    }

    /**
     * Converts a record to a complete SGF string.
     *
     * @throws ConversionException if the record cannot be converted
     */
    public static String convert(String text, RecordFormat format) {
        return SgfWriter.toSgf(parse(text, format));
    }

    /**
     * Converts a record and streams the SGF text to {@code sink} as UTF-8.
     * Nothing is written if parsing fails. The sink is flushed but not closed.
     *
     * @throws ConversionException if the record cannot be converted
     * @throws IOException         if writing to the sink fails
     */
    public static void convert(String text, RecordFormat format, OutputStream sink) throws IOException {
        PropertyTree tree = parse(text, format);
        Writer writer = new OutputStreamWriter(sink, StandardCharsets.UTF_8);
        SgfWriter.write(tree, writer);
        writer.flush();
    }
}
