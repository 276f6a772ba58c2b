package edu.brandeis.cosi103a.gokifu.format;

import edu.brandeis.cosi103a.gokifu.UnknownFormatException;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads legacy record files, choosing the format and charset from the file extension.
 */
public final class RecordLoader {

    private RecordLoader() {}

    /**
     * @throws UnknownFormatException if the extension is not one of .gib, .ngf, .ugf or .ugi
     * @throws IOException            if the file cannot be read
     */
    public static LoadedRecord load(Path file) throws IOException {
        String filename = file.getFileName().toString();
        RecordFormat format = RecordFormat.forFilename(filename)
            .orElseThrow(() -> new UnknownFormatException(filename));
        return new LoadedRecord(format, decode(Files.readAllBytes(file), format));
    }

    /**
     * Decodes raw file content with the format's legacy charset.
     * Unmappable bytes become replacement characters rather than failing the load.
     */
    public static String decode(byte[] content, RecordFormat format) {
        return format.charset().decode(ByteBuffer.wrap(content)).toString();
    }
}
