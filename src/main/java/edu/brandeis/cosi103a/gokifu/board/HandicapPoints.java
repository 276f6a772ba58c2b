package edu.brandeis.cosi103a.gokifu.board;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Standard star-point placement for handicap stones.
 *
 * <p>Two corner conventions exist for the 3rd and 4th stone. The Tygem layout puts the
 * 3rd stone in the top-left corner; the other layout puts it in the bottom-right.
 */
public final class HandicapPoints {

    public static final int MAX_HANDICAP = 9;

    private HandicapPoints() {}

    /**
     * Computes the handicap stone positions for a board.
     *
     * @param boardSize   board width and height
     * @param handicap    number of stones; values above 9 are treated as 9
     * @param tygemLayout whether the 3rd stone goes top-left rather than bottom-right
     * @return the points in placement order; empty for boards smaller than 4 or handicaps below 2
     */
    public static Set<Point> compute(int boardSize, int handicap, boolean tygemLayout) {
        Set<Point> points = new LinkedHashSet<>();

        if (boardSize < 4) {
            return points;
        }

        handicap = Math.min(handicap, MAX_HANDICAP);

        // Star points sit on the third line for small boards, the fourth otherwise
        int d = boardSize < 13 ? 2 : 3;
        int near = 1 + d;
        int far = boardSize - d;

        Point topLeft = new Point(near, near);
        Point bottomRight = new Point(far, far);

        if (handicap >= 2) {
            points.add(new Point(far, near));
            points.add(new Point(near, far));
        }
        if (handicap >= 3) {
            points.add(tygemLayout ? topLeft : bottomRight);
        }
        if (handicap >= 4) {
            points.add(tygemLayout ? bottomRight : topLeft);
        }

        // Even boards have no midpoint, so nothing beyond the four corners
        if (boardSize % 2 == 0) {
            return points;
        }

        int mid = (boardSize + 1) / 2;

        if (List.of(5, 7, 9).contains(handicap)) {
            points.add(new Point(mid, mid));
        }
        if (handicap >= 6) {
            points.add(new Point(near, mid));
            points.add(new Point(far, mid));
        }
        if (handicap >= 8) {
            points.add(new Point(mid, near));
            points.add(new Point(mid, far));
        }

        return points;
    }
}
