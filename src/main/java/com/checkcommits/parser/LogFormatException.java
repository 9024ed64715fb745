package com.checkcommits.parser;

import java.util.List;

/**
 * Thrown when a commit block does not have the shape {@code git log --numstat} produces.
 * The whole run is aborted: records parsed from such a log cannot be trusted.
 */
public class LogFormatException extends RuntimeException {

    private final transient List<String> block;

    public LogFormatException(String reason, List<String> block) {
        this(reason, block, null);
    }

    public LogFormatException(String reason, List<String> block, Throwable cause) {
        super(describe(reason, block), cause);
        this.block = List.copyOf(block);
    }

    public List<String> getBlock() {
        return block;
    }

    private static String describe(String reason, List<String> block) {
        StringBuilder message = new StringBuilder(reason).append(" block:").append(System.lineSeparator());
        for (String line : block) {
            message.append("    ").append(line).append(System.lineSeparator());
        }
        return message.toString();
    }
}
