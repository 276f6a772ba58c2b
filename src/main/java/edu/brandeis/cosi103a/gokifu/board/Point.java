package edu.brandeis.cosi103a.gokifu.board;

/**
 * A board intersection, 1-based from the top-left corner.
 */
public record Point(int x, int y) {
}
