package edu.brandeis.cosi103a.gokifu;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Access to the record files under {@code src/test/resources/fixtures}.
 */
public final class Fixtures {

    private Fixtures() {}

    public static String read(String name) {
        try (InputStream in = open(name)) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static Path copyTo(String name, Path dir) throws IOException {
        Path target = dir.resolve(name);
        try (InputStream in = open(name)) {
            Files.copy(in, target);
        }
        return target;
    }

    private static InputStream open(String name) {
        InputStream in = Fixtures.class.getClassLoader().getResourceAsStream("fixtures/" + name);
        if (in == null) {
            throw new IllegalStateException("Resource not found: fixtures/" + name);
        }
        return in;
    }
}
