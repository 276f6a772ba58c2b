package edu.brandeis.cosi103a.gokifu.parser;

import com.google.common.base.Splitter;
import edu.brandeis.cosi103a.gokifu.ParseFailureException;
import edu.brandeis.cosi103a.gokifu.board.Coordinates;
import edu.brandeis.cosi103a.gokifu.tree.PropertyTree;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Parser for PandaNet UGF/UGI records.
 *
 * <p>The record is split into bracketed sections. {@code [Header]} holds {@code KEY=value}
 * lines; {@code [Data]} holds comma-separated move records such as {@code PD,B1,1,0}, where
 * letters count from {@code A} = 1. Other sections are ignored.
 */
public class UgfParser implements RecordParser {

    private static final Logger log = LoggerFactory.getLogger(UgfParser.class);

    private static final Splitter LINES = Splitter.on('\n');
    private static final Splitter COMMA = Splitter.on(',');

    private static final String HEADER = "[HEADER]";
    private static final String DATA = "[DATA]";

    /**
     * Coordinate type whose rows count up from the bottom edge.
     */
    static final String BOTTOM_ORIGIN = "IGS";

    /**
     * Node-number field carried by the pre-placed handicap stones.
     */
    private static final char SETUP_NODE = '0';

    @Override
    public PropertyTree parse(String text) {
        return new Run().parse(text);
    }

    /**
     * Mutable state for one parse.
     */
    private static final class Run {
        final PropertyTree tree = new PropertyTree();
        final int root = tree.root();
        int node = root;

        Integer boardSize;
        Integer handicap;
        int handicapStonesSet;
        String coordinateType = "";
        String section = "";

        PropertyTree parse(String text) {
            for (String rawLine : LINES.split(text)) {
                String line = rawLine.trim();

                if (line.length() >= 2 && line.startsWith("[") && line.endsWith("]")) {
                    enterSection(line.toUpperCase(Locale.ROOT));
                    continue;
                }

                if (HEADER.equals(section)) {
                    readHeader(line);
                } else if (DATA.equals(section)) {
                    Optional<Move> move = parseRecord(line.toUpperCase(Locale.ROOT));
                    if (move.isEmpty()) {
                        log.debug("Skipping malformed UGF data line: {}", line);
                    }
                }
            }

            if (tree.childCount(root) == 0) {
                throw new ParseFailureException("No moves found in UGF record");
            }
            return tree;
        }

        void enterSection(String name) {
            if (DATA.equals(name)) {
                // Data records can only be decoded against a sane header
                if (handicap == null || boardSize == null) {
                    throw new ParseFailureException("UGF data section before board size and handicap");
                }
                if (boardSize < 1 || boardSize > 19 || handicap < 0) {
                    throw new ParseFailureException(
                        "UGF header has invalid board size " + boardSize + " or handicap " + handicap);
                }
            }
            section = name;
        }

        void readHeader(String line) {
            String upper = line.toUpperCase(Locale.ROOT);

            if (upper.startsWith("HDCP=")) {
                List<String> fields = COMMA.splitToList(afterEquals(line));
                Numbers.leadingInt(fields.get(0)).ifPresent(h -> {
                    handicap = h;
                    // The stones themselves arrive in the data section
                    if (h >= 2) {
                        tree.setValue(root, "HA", String.valueOf(h));
                    }
                });
                if (fields.size() > 1) {
                    Numbers.leadingDecimal(fields.get(1))
                        .ifPresent(komi -> tree.setValue(root, "KM", Numbers.format(komi)));
                }
            } else if (upper.startsWith("SIZE=")) {
                Numbers.leadingInt(afterEquals(line)).ifPresent(size -> {
                    boardSize = size;
                    tree.setValue(root, "SZ", String.valueOf(size));
                });
            } else if (upper.startsWith("COORDINATETYPE=")) {
                coordinateType = afterEquals(upper);
            } else if (upper.startsWith("PLAYERB=")) {
                tree.commitText(root, "PB", afterEquals(line));
            } else if (upper.startsWith("PLAYERW=")) {
                tree.commitText(root, "PW", afterEquals(line));
            } else if (upper.startsWith("PLACE=")) {
                tree.commitText(root, "PC", afterEquals(line));
            } else if (upper.startsWith("TITLE=")) {
                tree.commitText(root, "GN", afterEquals(line));
            } else if (upper.startsWith("WINNER=B")) {
                tree.setValue(root, "RE", "B+");
            } else if (upper.startsWith("WINNER=W")) {
                tree.setValue(root, "RE", "W+");
            }
        }

        /**
         * Applies one upper-cased data record to the tree, returning the move it decoded.
         */
        Optional<Move> parseRecord(String line) {
            List<String> fields = COMMA.splitToList(line);
            if (fields.size() < 2 || fields.get(0).length() < 2 || fields.get(1).isEmpty()) {
                return Optional.empty();
            }
            char color = fields.get(1).charAt(0);
            if (color != 'B' && color != 'W') {
                return Optional.empty();
            }
            boolean setupNode = fields.size() > 2 && !fields.get(2).isEmpty()
                && fields.get(2).charAt(0) == SETUP_NODE;

            int x = fields.get(0).charAt(0) - 'A' + 1;
            int y = fields.get(0).charAt(1) - 'A' + 1;
            if (BOTTOM_ORIGIN.equals(coordinateType)) {
                y = boardSize - y + 1;
            }

            // Off-board coordinates such as "YA" mark a pass
            String position = (x < 1 || x > boardSize || y < 1 || y > boardSize)
                ? ""
                : Coordinates.encodePoint(x, y);
            Move move = new Move(String.valueOf(color), position);

            boolean beforeFirstMove = tree.parent(node).isEmpty();
            if (handicap >= 2 && handicapStonesSet != handicap && setupNode && color == 'B' && beforeFirstMove) {
                handicapStonesSet++;
                tree.addValue(root, "AB", position);
            } else {
                node = tree.addChild(node);
                tree.setValue(node, move.color(), move.position());
            }
            return Optional.of(move);
        }

        private static String afterEquals(String line) {
            return line.substring(line.indexOf('=') + 1);
        }
    }
}
