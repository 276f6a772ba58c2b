package edu.brandeis.cosi103a.gokifu.parser;

/**
 * One decoded move record: the colour tag ("B" or "W") and its position code.
 * An empty position is a pass.
 */
record Move(String color, String position) {
}
