package edu.brandeis.cosi103a.gokifu.board;

import com.google.common.base.CharMatcher;
import edu.brandeis.cosi103a.gokifu.CoordinateRangeException;

import java.util.Optional;

/**
 * Position codes and value escaping for the output tree format.
 */
public final class Coordinates {

    public static final int MAX_COORDINATE = 26;

    private static final CharMatcher NEEDS_ESCAPE = CharMatcher.anyOf("\\]");

    private Coordinates() {}

    /**
     * Encodes a 1-based point as two lowercase letters, e.g. (1, 1) is "aa" and (16, 4) is "pd".
     *
     * @throws CoordinateRangeException if either coordinate is outside 1..26
     */
    public static String encodePoint(int x, int y) {
        if (x < 1 || x > MAX_COORDINATE || y < 1 || y > MAX_COORDINATE) {
            throw new CoordinateRangeException(x, y);
        }
        return new String(new char[]{(char) ('a' + x - 1), (char) ('a' + y - 1)});
    }

    public static String encodePoint(Point point) {
        return encodePoint(point.x(), point.y());
    }

    /**
     * Like {@link #encodePoint(int, int)}, but reports an unencodable point as empty
     * so that record loops can skip it.
     */
    public static Optional<String> tryEncodePoint(int x, int y) {
        if (x < 1 || x > MAX_COORDINATE || y < 1 || y > MAX_COORDINATE) {
            return Optional.empty();
        }
        return Optional.of(encodePoint(x, y));
    }

    /**
     * Inverse of {@link #encodePoint(int, int)}.
     *
     * @throws IllegalArgumentException if the code is not two letters in a..z
     */
    public static Point decodePoint(String code) {
        if (code.length() != 2 || !CharMatcher.inRange('a', 'z').matchesAllOf(code)) {
            throw new IllegalArgumentException("Not a position code: " + code);
        }
        return new Point(code.charAt(0) - 'a' + 1, code.charAt(1) - 'a' + 1);
    }

    /**
     * Prefixes every backslash and closing bracket with a backslash.
     * Values are escaped once, when they are stored on a node.
     */
    public static String escapeValue(String s) {
        if (NEEDS_ESCAPE.matchesNoneOf(s)) {
            return s;
        }
        StringBuilder sb = new StringBuilder(s.length() + 8);
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (NEEDS_ESCAPE.matches(c)) {
                sb.append('\\');
            }
            sb.append(c);
        }
        return sb.toString();
    }

    /**
     * Drops the backslash in front of each escaped character.
     */
    public static String unescapeValue(String s) {
        if (s.indexOf('\\') < 0) {
            return s;
        }
        StringBuilder sb = new StringBuilder(s.length());
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c == '\\' && i + 1 < s.length()) {
                c = s.charAt(++i);
            }
            sb.append(c);
        }
        return sb.toString();
    }
}
