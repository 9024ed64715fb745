package com.checkcommits.parser;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Finds where each commit block of the log starts.
 */
public final class BlockSegmenter {

    private static final Logger log = LoggerFactory.getLogger(BlockSegmenter.class);

    private BlockSegmenter() {
    }

    /**
     * Returns the indices of all lines that start a commit block, followed by {@code lines.size()}
     * as an upper bound. Block {@code i} spans {@code [bounds[i], bounds[i + 1])}.
     *
     * <p>Every line belongs to exactly one block: a non-empty log always has a block starting at
     * index 0, and a {@code commit} line with a malformed id still starts a block of its own.
     * Such blocks are rejected by {@link CommitBlockParser}.</p>
     */
    public static List<Integer> blockBounds(List<String> lines) {
        List<Integer> bounds = new ArrayList<>();
        for (int i = 0; i < lines.size(); i++) {
            if (LinePatterns.startsCommitBlock(lines.get(i))) {
                bounds.add(i);
            }
        }
        if (!lines.isEmpty() && (bounds.isEmpty() || bounds.get(0) > 0)) {
            log.debug("Log does not start with a commit header: '{}'", lines.get(0));
            bounds.add(0, 0);
        }
        bounds.add(lines.size());
        return bounds;
    }

    /** Views on the blocks of the log, in log order. */
    public static List<List<String>> blocks(List<String> lines) {
        List<Integer> bounds = blockBounds(lines);
        List<List<String>> blocks = new ArrayList<>(bounds.size() - 1);
        for (int i = 0; i < bounds.size() - 1; i++) {
            blocks.add(lines.subList(bounds.get(i), bounds.get(i + 1)));
        }
        return blocks;
    }
}
