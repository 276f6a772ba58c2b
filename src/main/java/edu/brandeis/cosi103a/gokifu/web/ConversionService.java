package edu.brandeis.cosi103a.gokifu.web;

import edu.brandeis.cosi103a.gokifu.UnknownFormatException;
import edu.brandeis.cosi103a.gokifu.format.RecordConverter;
import edu.brandeis.cosi103a.gokifu.format.RecordFormat;
import edu.brandeis.cosi103a.gokifu.format.RecordLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.Arrays;
import java.util.List;

/**
 * Service wrapping the record converter for HTTP callers.
 */
@Service
public class ConversionService {

    private static final Logger log = LoggerFactory.getLogger(ConversionService.class);

    private final String outputExtension;

    public ConversionService(@Value("${converter.output-extension:.sgf}") String outputExtension) {
        this.outputExtension = outputExtension;
    }

    public List<FormatInfo> listFormats() {
        return Arrays.stream(RecordFormat.values()).map(FormatInfo::of).toList();
    }

    /**
     * Converts already-decoded text in the named format ("gib", "ngf", "ugf", "ugi").
     *
     * @throws UnknownFormatException if the format name is not recognised
     */
    public String convertText(String formatName, String text) {
        RecordFormat format = RecordFormat.forName(formatName)
            .orElseThrow(() -> new UnknownFormatException(formatName));
        return RecordConverter.convert(text, format);
    }

    /**
     * Converts an uploaded file, detecting the format from its name and decoding it with the
     * format's legacy charset.
     *
     * @throws UnknownFormatException if the file name has no supported extension
     */
    public String convertUpload(String filename, byte[] content) {
        RecordFormat format = RecordFormat.forFilename(filename)
            .orElseThrow(() -> new UnknownFormatException(filename));
        log.info("Converting upload {} ({} bytes) as {}", filename, content.length, format);
        return RecordConverter.convert(RecordLoader.decode(content, format), format);
    }

    /**
     * Name to offer for the converted download of {@code filename}.
     */
    public String outputFilename(String filename) {
        int dot = filename.lastIndexOf('.');
        return (dot > 0 ? filename.substring(0, dot) : filename) + outputExtension;
    }
}
