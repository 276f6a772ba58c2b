package edu.brandeis.cosi103a.gokifu.runner;

import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.guava.GuavaModule;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Writes conversion reports to disk.
 * Reports are written atomically to prevent partial writes.
 */
public class ReportFileWriter {

    private final ObjectMapper objectMapper;

    public ReportFileWriter() {
        this(reportMapper());
    }

    public ReportFileWriter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Writes the report to {@code target}, creating parent directories as needed.
     */
    public void write(ConversionReport report, Path target) throws IOException {
        Path absolute = target.toAbsolutePath();
        Files.createDirectories(absolute.getParent());
        Path temp = absolute.resolveSibling(absolute.getFileName() + ".tmp");
        objectMapper.writeValue(temp.toFile(), report);
        Files.move(temp, absolute, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
    }

    /**
     * Mapper for the report file: indented, with the Guava file list and the
     * {@code Optional} outcome fields, and properties in declaration order.
     */
    static ObjectMapper reportMapper() {
        return JsonMapper.builder()
            .addModule(new GuavaModule())
            .addModule(new Jdk8Module())
            .enable(SerializationFeature.INDENT_OUTPUT)
            .disable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
            .build();
    }

    /**
     * Reads a report previously written by {@link #write}.
     */
    ConversionReport read(Path source) throws IOException {
        return objectMapper.readValue(source.toFile(), ConversionReport.class);
    }
}
