package edu.brandeis.cosi103a.gokifu.parser;

import com.google.common.base.CharMatcher;
import com.google.common.base.Splitter;
import edu.brandeis.cosi103a.gokifu.ParseFailureException;
import edu.brandeis.cosi103a.gokifu.board.Coordinates;
import edu.brandeis.cosi103a.gokifu.board.HandicapPoints;
import edu.brandeis.cosi103a.gokifu.board.Point;
import edu.brandeis.cosi103a.gokifu.tree.PropertyTree;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parser for Tygem GIB records.
 *
 * <p>Header tags are lines like {@code \[GAMEBLACKNAME=Lee (9D)\]} and may appear anywhere;
 * the first usable value of each root property wins. An {@code INI} line sets up handicap
 * stones and must come before the first {@code STO} move line. Moves form a single line of
 * play on a 19x19 board, with zero-based coordinates counted from the top left.
 */
public class GibParser implements RecordParser {

    private static final Logger log = LoggerFactory.getLogger(GibParser.class);

    static final int BOARD_SIZE = 19;

    private static final Splitter LINES = Splitter.on('\n');
    private static final Splitter TOKENS = Splitter.on(CharMatcher.whitespace()).omitEmptyStrings();

    private static final Pattern MAIN_RESULT_CODE = Pattern.compile("GRLT:(\\d+),");
    private static final Pattern MAIN_RESULT_SCORE = Pattern.compile("ZIPSU:(\\d+),");
    private static final Pattern MAIN_KOMI = Pattern.compile("GONGJE:(\\d+),");
    private static final Pattern TAG_DATE = Pattern.compile("C(\\d{4}):(\\d\\d):(\\d\\d)");
    private static final Pattern TAG_RESULT_CODE = Pattern.compile(",W(\\d+),");
    private static final Pattern TAG_RESULT_SCORE = Pattern.compile(",Z(\\d+),");
    private static final Pattern TAG_KOMI = Pattern.compile(",G(\\d+),");

    @Override
    public PropertyTree parse(String text) {
        PropertyTree tree = new PropertyTree();
        int root = tree.root();
        int node = root;

        for (String rawLine : LINES.split(text)) {
            String line = rawLine.trim();

            tagValue(line, "GAMEBLACKNAME").ifPresent(raw -> commitPlayer(tree, raw, "PB", "BR"));
            tagValue(line, "GAMEWHITENAME").ifPresent(raw -> commitPlayer(tree, raw, "PW", "WR"));

            if (line.startsWith("\\[GAMEINFOMAIN=")) {
                readGameInfo(tree, line);
            }
            if (line.startsWith("\\[GAMETAG=")) {
                readGameTag(tree, line);
            }

            if (line.startsWith("INI")) {
                if (node != root) {
                    throw new ParseFailureException("GIB setup line found after the first move");
                }
                readSetup(tree, line);
            }

            if (line.startsWith("STO")) {
                Optional<Move> move = parseStone(line);
                if (move.isEmpty()) {
                    log.debug("Skipping malformed GIB move line: {}", line);
                    continue;
                }
                node = tree.addChild(node);
                tree.setValue(node, move.get().color(), move.get().position());
            }
        }

        if (tree.childCount(root) == 0) {
            throw new ParseFailureException("No moves found in GIB record");
        }
        return tree;
    }

    /**
     * Extracts the value of a {@code \[NAME=value\]} line.
     */
    private static Optional<String> tagValue(String line, String name) {
        String prefix = "\\[" + name + "=";
        if (line.startsWith(prefix) && line.endsWith("\\]") && line.length() >= prefix.length() + 2) {
            return Optional.of(line.substring(prefix.length(), line.length() - 2));
        }
        return Optional.empty();
    }

    private static void commitPlayer(PropertyTree tree, String raw, String nameKey, String rankKey) {
        int root = tree.root();
        PlayerName player = PlayerName.parse(raw);
        if (!player.name().isEmpty() && !tree.has(root, nameKey)) {
            tree.commitText(root, nameKey, player.name());
        }
        if (!player.rank().isEmpty() && !tree.has(root, rankKey)) {
            tree.commitText(root, rankKey, player.rank());
        }
    }

    private static void readGameInfo(PropertyTree tree, String line) {
        int root = tree.root();
        if (!tree.has(root, "RE")) {
            GibResult.find(line, MAIN_RESULT_CODE, MAIN_RESULT_SCORE)
                .ifPresent(result -> tree.setValue(root, "RE", result));
        }
        if (!tree.has(root, "KM")) {
            firstInt(MAIN_KOMI, line)
                .filter(komi -> komi != 0)
                .ifPresent(komi -> tree.setValue(root, "KM", Numbers.tenths(komi)));
        }
    }

    private static void readGameTag(PropertyTree tree, String line) {
        int root = tree.root();
        if (!tree.has(root, "DT")) {
            Matcher date = TAG_DATE.matcher(line);
            if (date.find()) {
                tree.setValue(root, "DT", date.group(1) + "-" + date.group(2) + "-" + date.group(3));
            }
        }
        if (!tree.has(root, "RE")) {
            GibResult.find(line, TAG_RESULT_CODE, TAG_RESULT_SCORE)
                .ifPresent(result -> tree.setValue(root, "RE", result));
        }
        if (!tree.has(root, "KM")) {
            firstInt(TAG_KOMI, line)
                .ifPresent(komi -> tree.setValue(root, "KM", Numbers.tenths(komi)));
        }
    }

    private static void readSetup(PropertyTree tree, String line) {
        List<String> setup = TOKENS.splitToList(line);
        if (setup.size() < 4) {
            return;
        }
        Optional<Integer> parsed = Numbers.leadingInt(setup.get(3));
        if (parsed.isEmpty()) {
            log.debug("Ignoring GIB setup line without a handicap: {}", line);
            return;
        }
        int handicap = parsed.get();
        if (handicap < 0 || handicap > HandicapPoints.MAX_HANDICAP) {
            throw new ParseFailureException("GIB handicap out of range: " + handicap);
        }
        if (handicap >= 2) {
            int root = tree.root();
            tree.setValue(root, "HA", String.valueOf(handicap));
            for (Point point : HandicapPoints.compute(BOARD_SIZE, handicap, true)) {
                tree.addValue(root, "AB", Coordinates.encodePoint(point));
            }
        }
    }

    /**
     * Reads {@code STO 0 <n> <colour> <x> <y>}; colour 1 is Black, anything else White.
     */
    static Optional<Move> parseStone(String line) {
        List<String> move = TOKENS.splitToList(line);
        if (move.size() < 6) {
            return Optional.empty();
        }
        String color = "1".equals(move.get(3)) ? "B" : "W";
        Optional<Integer> x = Numbers.leadingInt(move.get(4));
        Optional<Integer> y = Numbers.leadingInt(move.get(5));
        if (x.isEmpty() || y.isEmpty()) {
            return Optional.empty();
        }
        return Coordinates.tryEncodePoint(x.get() + 1, y.get() + 1)
            .map(position -> new Move(color, position));
    }

    private static Optional<Integer> firstInt(Pattern pattern, String line) {
        Matcher m = pattern.matcher(line);
        return m.find() ? Numbers.leadingInt(m.group(1)) : Optional.empty();
    }
}
