package com.cobf.complexity.frontend;

import org.treesitter.TSNode;
import org.treesitter.TSParser;
import org.treesitter.TSTree;
import org.treesitter.TreeSitterC;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * A tree-sitter parse of one C translation unit together with the source
 * bytes its node offsets point into.
 */
final class SourceTree {

    private final byte[] bytes;
    // Nodes are only valid while the tree is reachable
    private final TSTree tree;

    private SourceTree(byte[] bytes, TSTree tree) {
        this.bytes = bytes;
        this.tree = tree;
    }

    static SourceTree parse(String source) {
        TSParser parser = new TSParser();
        parser.setLanguage(new TreeSitterC());
        return new SourceTree(source.getBytes(StandardCharsets.UTF_8), parser.parseString(null, source));
    }

    TSNode root() {
        return tree.getRootNode();
    }

    String text(TSNode node) {
        int start = node.getStartByte();
        return new String(bytes, start, node.getEndByte() - start, StandardCharsets.UTF_8);
    }

    /** One-based source line of the node's first byte. */
    static int line(TSNode node) {
        return node.getStartPoint().getRow() + 1;
    }

    /** The child stored under {@code field}, or null when there is none. */
    static TSNode field(TSNode node, String field) {
        TSNode child = node.getChildByFieldName(field);
        return child == null || child.isNull() ? null : child;
    }

    /** Every child stored under {@code field}, in source order. */
    static List<TSNode> fields(TSNode node, String field) {
        List<TSNode> result = new ArrayList<>();
        for (int i = 0; i < node.getChildCount(); i++) {
            if (field.equals(node.getFieldNameForChild(i))) {
                result.add(node.getChild(i));
            }
        }
        return result;
    }

    /** Named children without comments, in source order. */
    static List<TSNode> namedChildren(TSNode node) {
        List<TSNode> result = new ArrayList<>();
        for (int i = 0; i < node.getNamedChildCount(); i++) {
            TSNode child = node.getNamedChild(i);
            if (!child.getType().equals("comment")) {
                result.add(child);
            }
        }
        return result;
    }
}
