package edu.brandeis.cosi103a.gokifu.tree;

import com.google.common.collect.ImmutableList;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.Map;

/**
 * Emits a property tree in SGF text form.
 *
 * <p>A run of single-child nodes stays inside one group; a node with several children
 * closes its run by writing each child as its own nested group. Values are written
 * verbatim since they were escaped when stored.
 */
public final class SgfWriter {

    private SgfWriter() {}

    public static String toSgf(PropertyTree tree) {
        StringBuilder sb = new StringBuilder();
        try {
            write(tree, sb);
        } catch (IOException e) {
            // StringBuilder never throws
            throw new UncheckedIOException(e);
        }
        return sb.toString();
    }

    /**
     * Writes the whole tree, starting at the root, to {@code out} in emission order.
     */
    public static void write(PropertyTree tree, Appendable out) throws IOException {
        writeGroup(tree, tree.root(), out);
    }

    private static void writeGroup(PropertyTree tree, int start, Appendable out) throws IOException {
        out.append('(');
        int node = start;
        while (true) {
            out.append(';');
            for (Map.Entry<String, ImmutableList<String>> property : tree.properties(node).entrySet()) {
                out.append(property.getKey());
                for (String value : property.getValue()) {
                    out.append('[').append(value).append(']');
                }
            }
            List<Integer> children = tree.children(node);
            if (children.size() == 1) {
                node = children.get(0);
                continue;
            }
            for (int child : children) {
                writeGroup(tree, child, out);
            }
            break;
        }
        out.append(")\n");
    }
}
