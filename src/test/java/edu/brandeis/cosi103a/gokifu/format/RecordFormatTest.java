package edu.brandeis.cosi103a.gokifu.format;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class RecordFormatTest {

    @Test
    void forFilename_detectsEachExtension() {
        assertEquals(Optional.of(RecordFormat.GIB), RecordFormat.forFilename("game.gib"));
        assertEquals(Optional.of(RecordFormat.NGF), RecordFormat.forFilename("/tmp/records/game.NGF"));
        assertEquals(Optional.of(RecordFormat.UGF), RecordFormat.forFilename("game.ugf"));
        assertEquals(Optional.of(RecordFormat.UGI), RecordFormat.forFilename("my.game.Ugi"));
    }

    @Test
    void forFilename_unknownOrMissingExtension() {
        assertEquals(Optional.empty(), RecordFormat.forFilename("game.sgf"));
        assertEquals(Optional.empty(), RecordFormat.forFilename("game"));
        assertEquals(Optional.empty(), RecordFormat.forFilename("game.gib.bak"));
    }

    @Test
    void forName_acceptsTagOrExtension() {
        assertEquals(Optional.of(RecordFormat.NGF), RecordFormat.forName("ngf"));
        assertEquals(Optional.of(RecordFormat.UGI), RecordFormat.forName("UGI"));
        assertEquals(Optional.of(RecordFormat.GIB), RecordFormat.forName(".gib"));
        assertEquals(Optional.empty(), RecordFormat.forName("sgf"));
    }

    @Test
    void charsets_matchLegacyEncodings() {
        assertEquals(StandardCharsets.UTF_8, RecordFormat.GIB.charset());
        assertEquals("GB18030", RecordFormat.NGF.charset().name());
        assertEquals(RecordFormat.UGF.charset(), RecordFormat.UGI.charset());
    }

    @Test
    void ugfAndUgiShareTheSectionedParser() {
        assertSame(RecordFormat.UGF.parser().getClass(), RecordFormat.UGI.parser().getClass());
        assertNotSame(RecordFormat.GIB.parser().getClass(), RecordFormat.NGF.parser().getClass());
    }
}
