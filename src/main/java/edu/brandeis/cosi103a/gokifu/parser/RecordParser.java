package edu.brandeis.cosi103a.gokifu.parser;

import edu.brandeis.cosi103a.gokifu.ParseFailureException;
import edu.brandeis.cosi103a.gokifu.tree.PropertyTree;

/**
 * Turns the decoded text of one legacy game record into a raw property tree.
 *
 * <p>Implementations skip individual malformed lines and keep going, but fail the whole
 * parse on structural problems or when no moves were found.
 */
@FunctionalInterface
public interface RecordParser {

    /**
     * @param text the complete record, already decoded from its legacy charset
     * @return a tree whose root carries the game metadata and whose descendants are the moves
     * @throws ParseFailureException if the record cannot be converted
     */
    PropertyTree parse(String text);
}
