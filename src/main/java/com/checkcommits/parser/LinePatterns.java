package com.checkcommits.parser;

import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Line shapes found in the output of {@code git log --numstat}.
 *
 * <pre>
 * commit 0123456789abcdef0123456789abcdef01234567
 * Author: Jane Doe &lt;jane@example.com&gt;
 * Date:   Wed Jan 7 10:15:00 2015 -0500
 *
 *     Fix JIRA-42
 *
 * 10	2	src/main/Foo.java
 * </pre>
 *
 * Every matcher is anchored at the start of the line and has no side effects.
 */
public final class LinePatterns {

    /** Format git uses for the {@code Date:} line by default. */
    public static final DateTimeFormatter GIT_DATE_FORMAT =
            DateTimeFormatter.ofPattern("EEE MMM d HH:mm:ss yyyy Z", Locale.ENGLISH);

    /** Project key, hyphen, issue number, e.g. {@code JIRA-1234}. */
    public static final Pattern DEFAULT_TICKET_PATTERN = Pattern.compile("[A-Z]+-\\d+");

    private static final Pattern COMMIT_PATTERN = Pattern.compile("commit\\s+([a-f0-9]{40})");
    private static final Pattern HEADER_START_PATTERN = Pattern.compile("commit\\s");
    private static final Pattern AUTHOR_PATTERN = Pattern.compile("Author:\\s+(.*)\\s+<(.*)>");
    private static final Pattern DATE_PATTERN = Pattern.compile("Date:\\s+(.*)");
    // binary files show up as "-\t-\tpath" and intentionally do not match
    private static final Pattern FILE_PATTERN = Pattern.compile("(\\d+)\\s+(\\d+)\\s+(\\S.*)");

    private LinePatterns() {
    }

    /** Group 1 is the commit id. */
    public static LineMatch commitHeader(String line) {
        return LineMatch.of(COMMIT_PATTERN.matcher(line));
    }

    public static boolean isCommitHeader(String line) {
        return commitHeader(line).matched();
    }

    /**
     * Whether the line starts a new commit block, well formed or not. A start without a valid
     * id still opens a block, so that {@link CommitBlockParser} rejects it.
     */
    public static boolean startsCommitBlock(String line) {
        return HEADER_START_PATTERN.matcher(line).lookingAt();
    }

    /** Group 1 is the display name, group 2 the address between the angle brackets. */
    public static LineMatch authorLine(String line) {
        return LineMatch.of(AUTHOR_PATTERN.matcher(line));
    }

    /** Group 1 is the raw date text. */
    public static LineMatch dateLine(String line) {
        return LineMatch.of(DATE_PATTERN.matcher(line));
    }

    /** Groups: lines added, lines deleted, path. */
    public static LineMatch fileChange(String line) {
        return LineMatch.of(FILE_PATTERN.matcher(line));
    }

    public static boolean isFileChange(String line) {
        return fileChange(line).matched();
    }

    public static boolean containsTicket(String text, Pattern ticketPattern) {
        return ticketPattern.matcher(text).find();
    }

    /**
     * Converts the text of a {@code Date:} line to UTC epoch seconds, honoring its offset.
     *
     * @throws DateTimeParseException if the text is not in {@link #GIT_DATE_FORMAT}
     */
    public static long toEpochSeconds(String dateText) {
        return ZonedDateTime.parse(dateText.trim(), GIT_DATE_FORMAT).toEpochSecond();
    }
}
