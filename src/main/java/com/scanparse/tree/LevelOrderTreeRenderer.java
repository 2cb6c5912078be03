package com.scanparse.tree;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.StringJoiner;

/**
 * Renders a tree breadth-first, one line per depth level.
 * <p>
 * Each line holds the labels of one level joined by single spaces, left-to-right,
 * and ends with a newline. Levels are delimited by swapping a current-level queue
 * with a next-level queue rather than by tracking depth.
 */
public class LevelOrderTreeRenderer implements TreeRenderer {

    private static final String SEPARATOR = " ";
    private static final char LINE_END = '\n';

    @Override
    public String render(ParseNode root) {
        if (root == null) {
            return "";
        }

        StringBuilder result = new StringBuilder();
        Deque<ParseNode> currentLevel = new ArrayDeque<>();
        currentLevel.add(root);

        while (!currentLevel.isEmpty()) {
            Deque<ParseNode> nextLevel = new ArrayDeque<>();
            StringJoiner levelOutput = new StringJoiner(SEPARATOR);

            while (!currentLevel.isEmpty()) {
                ParseNode node = currentLevel.poll();
                levelOutput.add(node.label());
                nextLevel.addAll(node.children());
            }

            result.append(levelOutput).append(LINE_END);
            currentLevel = nextLevel;
        }

        return result.toString();
    }
}
