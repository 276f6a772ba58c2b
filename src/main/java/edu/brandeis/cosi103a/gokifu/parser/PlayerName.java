package edu.brandeis.cosi103a.gokifu.parser;

import com.google.common.base.Splitter;

import java.util.List;

/**
 * A player name with an optional rank, as written in "Name (Rank)" form.
 */
public record PlayerName(String name, String rank) {

    private static final Splitter OPEN_PAREN = Splitter.on('(');

    /**
     * Splits "Name (Rank)" into its parts. Anything else, including an empty name before
     * the parenthesis, yields the raw string as the name and an empty rank.
     */
    public static PlayerName parse(String raw) {
        List<String> parts = OPEN_PAREN.splitToList(raw);
        if (parts.size() == 2 && parts.get(1).endsWith(")")) {
            String name = parts.get(0).trim();
            String rank = parts.get(1).substring(0, parts.get(1).length() - 1);
            if (!name.isEmpty()) {
                return new PlayerName(name, rank);
            }
        }
        return new PlayerName(raw, "");
    }
}
