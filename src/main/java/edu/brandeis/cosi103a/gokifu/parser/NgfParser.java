package edu.brandeis.cosi103a.gokifu.parser;

import com.google.common.base.CharMatcher;
import com.google.common.base.Splitter;
import edu.brandeis.cosi103a.gokifu.BoardSizeException;
import edu.brandeis.cosi103a.gokifu.ParseFailureException;
import edu.brandeis.cosi103a.gokifu.board.Coordinates;
import edu.brandeis.cosi103a.gokifu.board.HandicapPoints;
import edu.brandeis.cosi103a.gokifu.board.Point;
import edu.brandeis.cosi103a.gokifu.tree.PropertyTree;
import edu.brandeis.cosi103a.gokifu.tree.TreeNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Parser for WeiqiTV NGF records.
 *
 * <p>The header has no keys: each field lives on a fixed line. Moves are lines like
 * {@code PMAB BPD} where the letter after the move number is the colour and the next two
 * letters are the coordinates, with {@code B} meaning 1.
 */
public class NgfParser implements RecordParser {

    private static final Logger log = LoggerFactory.getLogger(NgfParser.class);

    static final int LINE_BOARD_SIZE = 1;
    static final int LINE_WHITE = 2;
    static final int LINE_BLACK = 3;
    static final int LINE_HANDICAP = 5;
    static final int LINE_KOMI = 7;
    static final int LINE_DATE = 8;
    static final int LINE_RESULT = 10;

    private static final int DEFAULT_BOARD_SIZE = 19;
    private static final int MIN_MOVE_LINE = 7;

    private static final Splitter LINES = Splitter.on('\n');
    private static final Splitter TOKENS = Splitter.on(CharMatcher.whitespace()).omitEmptyStrings();

    @Override
    public PropertyTree parse(String text) {
        List<String> lines = LINES.splitToList(text.trim());

        int boardSize = line(lines, LINE_BOARD_SIZE).flatMap(Numbers::leadingInt).orElse(DEFAULT_BOARD_SIZE);
        int handicap = line(lines, LINE_HANDICAP).flatMap(Numbers::leadingInt).orElse(0);
        String white = line(lines, LINE_WHITE).map(NgfParser::firstToken).orElse("");
        String black = line(lines, LINE_BLACK).map(NgfParser::firstToken).orElse("");
        String rawDate = line(lines, LINE_DATE).map(s -> s.length() > 8 ? s.substring(0, 8) : s).orElse("");
        double komi = line(lines, LINE_KOMI).flatMap(Numbers::leadingDecimal).orElse(0.0);

        // Even games store komi without the half point
        if (handicap == 0 && komi == Math.rint(komi)) {
            komi += 0.5;
        }

        String result = line(lines, LINE_RESULT).map(NgfParser::result).orElse("");

        if (handicap < 0 || handicap > HandicapPoints.MAX_HANDICAP) {
            throw new ParseFailureException("NGF handicap out of range: " + handicap);
        }

        PropertyTree tree = new PropertyTree();
        int root = tree.root();

        tree.setValue(root, "SZ", String.valueOf(boardSize));

        if (handicap >= 2) {
            if (boardSize < 1 || boardSize > TreeNormalizer.MAX_BOARD_SIZE) {
                throw new BoardSizeException(boardSize);
            }
            tree.setValue(root, "HA", String.valueOf(handicap));
            // NGF uses the same corner order as Tygem
            for (Point point : HandicapPoints.compute(boardSize, handicap, true)) {
                tree.addValue(root, "AB", Coordinates.encodePoint(point));
            }
        }

        if (komi != 0) {
            tree.setValue(root, "KM", Numbers.format(komi));
        }

        if (rawDate.length() == 8 && CharMatcher.inRange('0', '9').matchesAllOf(rawDate)) {
            tree.setValue(root, "DT",
                rawDate.substring(0, 4) + "-" + rawDate.substring(4, 6) + "-" + rawDate.substring(6, 8));
        }

        if (!white.isEmpty()) {
            tree.commitText(root, "PW", white);
        }
        if (!black.isEmpty()) {
            tree.commitText(root, "PB", black);
        }
        if (!result.isEmpty()) {
            tree.setValue(root, "RE", result);
        }

        int node = root;
        for (String rawLine : lines) {
            String line = rawLine.trim().toUpperCase(Locale.ROOT);
            if (!line.startsWith("PM") || line.length() < MIN_MOVE_LINE) {
                continue;
            }
            Optional<Move> move = parseMove(line);
            if (move.isEmpty()) {
                log.debug("Skipping malformed NGF move line: {}", line);
                continue;
            }
            node = tree.addChild(node);
            tree.setValue(node, move.get().color(), move.get().position());
        }

        if (tree.childCount(root) == 0) {
            throw new ParseFailureException("No moves found in NGF record");
        }
        return tree;
    }

    /**
     * Decodes an upper-cased {@code PM} line of at least seven characters.
     */
    static Optional<Move> parseMove(String line) {
        char color = line.charAt(4);
        if (color != 'B' && color != 'W') {
            return Optional.empty();
        }
        int x = line.charAt(5) - 'A';
        int y = line.charAt(6) - 'A';
        return Coordinates.tryEncodePoint(x, y).map(position -> new Move(String.valueOf(color), position));
    }

    private static String result(String line) {
        if (line.contains("hite win")) {
            return "W+";
        }
        if (line.contains("lack win")) {
            return "B+";
        }
        return "";
    }

    private static String firstToken(String line) {
        List<String> tokens = TOKENS.splitToList(line);
        return tokens.isEmpty() ? "" : tokens.get(0);
    }

    private static Optional<String> line(List<String> lines, int index) {
        return index < lines.size() ? Optional.of(lines.get(index)) : Optional.empty();
    }
}
