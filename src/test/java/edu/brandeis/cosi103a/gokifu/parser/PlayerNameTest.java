package edu.brandeis.cosi103a.gokifu.parser;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class PlayerNameTest {

    @Test
    void parse_nameAndRank() {
        assertEquals(new PlayerName("Lee Sedol", "9D"), PlayerName.parse("Lee Sedol (9D)"));
        assertEquals(new PlayerName("Lee", "9D"), PlayerName.parse("Lee(9D)"));
    }

    @Test
    void parse_fallsBackToRawName() {
        assertEquals(new PlayerName("Lee Sedol", ""), PlayerName.parse("Lee Sedol"));
        assertEquals(new PlayerName("Lee (9D", ""), PlayerName.parse("Lee (9D"));
        assertEquals(new PlayerName("A (b) (c)", ""), PlayerName.parse("A (b) (c)"));
        assertEquals(new PlayerName(" (9D)", ""), PlayerName.parse(" (9D)"));
    }
}
