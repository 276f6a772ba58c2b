package edu.brandeis.cosi103a.gokifu.board;

import edu.brandeis.cosi103a.gokifu.CoordinateRangeException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.HashSet;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class CoordinatesTest {

    @Test
    void encodePoint_corners() {
        assertEquals("aa", Coordinates.encodePoint(1, 1));
        assertEquals("ss", Coordinates.encodePoint(19, 19));
        assertEquals("zz", Coordinates.encodePoint(26, 26));
    }

    @Test
    void encodePoint_xIsFirstLetter() {
        assertEquals("pd", Coordinates.encodePoint(16, 4));
        assertEquals("pd", Coordinates.encodePoint(new Point(16, 4)));
    }

    @Test
    void encodePoint_isBijectionOnBoardRange() {
        Set<String> codes = new HashSet<>();
        for (int x = 1; x <= 26; x++) {
            for (int y = 1; y <= 26; y++) {
                String code = Coordinates.encodePoint(x, y);
                codes.add(code);
                assertEquals(new Point(x, y), Coordinates.decodePoint(code));
            }
        }
        assertEquals(26 * 26, codes.size());
    }

    @Test
    void encodePoint_rejectsOutOfRange() {
        assertThrows(CoordinateRangeException.class, () -> Coordinates.encodePoint(0, 1));
        assertThrows(CoordinateRangeException.class, () -> Coordinates.encodePoint(1, 27));
        assertThrows(CoordinateRangeException.class, () -> Coordinates.encodePoint(-3, 5));
    }

    @Test
    void tryEncodePoint_emptyWhenOutOfRange() {
        assertEquals(Optional.of("cd"), Coordinates.tryEncodePoint(3, 4));
        assertEquals(Optional.empty(), Coordinates.tryEncodePoint(27, 4));
        assertEquals(Optional.empty(), Coordinates.tryEncodePoint(3, 0));
    }

    @Test
    void decodePoint_rejectsNonCodes() {
        assertThrows(IllegalArgumentException.class, () -> Coordinates.decodePoint("a"));
        assertThrows(IllegalArgumentException.class, () -> Coordinates.decodePoint("A1"));
    }

    @Test
    void escapeValue_prefixesBackslashAndClosingBracket() {
        assertEquals("plain", Coordinates.escapeValue("plain"));
        assertEquals("a\\]b", Coordinates.escapeValue("a]b"));
        assertEquals("c:\\\\dir", Coordinates.escapeValue("c:\\dir"));
        assertEquals("[open", Coordinates.escapeValue("[open"));
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "no specials", "]", "\\", "\\]", "]]\\\\", "trailing \\", "Cho [Hun]hyun"})
    void unescapeValue_reversesEscape(String original) {
        assertEquals(original, Coordinates.unescapeValue(Coordinates.escapeValue(original)));
    }
}
