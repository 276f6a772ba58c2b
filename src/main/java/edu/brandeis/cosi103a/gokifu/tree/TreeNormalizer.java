package edu.brandeis.cosi103a.gokifu.tree;

import edu.brandeis.cosi103a.gokifu.BoardSizeException;
import edu.brandeis.cosi103a.gokifu.parser.Numbers;

/**
 * Root-level fix-ups applied to every freshly parsed tree.
 */
public final class TreeNormalizer {

    public static final String FILE_FORMAT = "4";
    public static final String GAME_TYPE = "1";
    public static final String CHARSET = "UTF-8";
    public static final int DEFAULT_BOARD_SIZE = 19;
    public static final int MAX_BOARD_SIZE = 19;

    private TreeNormalizer() {}

    /**
     * Forces the FF, GM and CA tags, defaults SZ to 19 and checks the board size.
     *
     * @throws BoardSizeException if the resulting size is outside 1..19
     */
    public static PropertyTree normalize(PropertyTree tree) {
        int root = tree.root();
        tree.setValue(root, "FF", FILE_FORMAT);
        tree.setValue(root, "GM", GAME_TYPE);
        tree.setValue(root, "CA", CHARSET);

        int size;
        if (tree.has(root, "SZ")) {
            // A size that does not even start with a number counts as invalid
            size = tree.firstValue(root, "SZ")
                .flatMap(Numbers::leadingInt)
                .orElse(0);
        } else {
            size = DEFAULT_BOARD_SIZE;
            tree.setValue(root, "SZ", String.valueOf(size));
        }

        if (size < 1 || size > MAX_BOARD_SIZE) {
            throw new BoardSizeException(size);
        }
        return tree;
    }
}
