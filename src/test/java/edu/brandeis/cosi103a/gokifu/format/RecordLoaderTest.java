package edu.brandeis.cosi103a.gokifu.format;

import edu.brandeis.cosi103a.gokifu.Fixtures;
import edu.brandeis.cosi103a.gokifu.UnknownFormatException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class RecordLoaderTest {

    @Test
    void load_detectsFormatAndDecodes(@TempDir Path tempDir) throws Exception {
        Path file = Fixtures.copyTo("handicap.gib", tempDir);

        LoadedRecord record = RecordLoader.load(file);

        assertEquals(RecordFormat.GIB, record.format());
        assertTrue(record.text().contains("GAMEBLACKNAME=Lee Sedol"));
    }

    @Test
    void load_decodesLegacyCharset(@TempDir Path tempDir) throws Exception {
        Path file = tempDir.resolve("game.ngf");
        String name = "李昌镐";
        Files.write(file, ("Game\n19\n" + name + "\n").getBytes(RecordFormat.NGF.charset()));

        assertTrue(RecordLoader.load(file).text().contains(name));
    }

    @Test
    void load_unknownExtension(@TempDir Path tempDir) throws Exception {
        Path file = Files.writeString(tempDir.resolve("game.txt"), "whatever");
        UnknownFormatException e = assertThrows(UnknownFormatException.class, () -> RecordLoader.load(file));
        assertTrue(e.getMessage().contains("game.txt"));
    }

    @Test
    void load_missingFile(@TempDir Path tempDir) {
        assertThrows(java.nio.file.NoSuchFileException.class, () -> RecordLoader.load(tempDir.resolve("absent.ugi")));
    }
}
