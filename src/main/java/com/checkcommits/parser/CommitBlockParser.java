package com.checkcommits.parser;

import com.checkcommits.classifier.DefectClassifier;
import com.checkcommits.pojo.CommitRecord;

import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

/**
 * Turns the lines of one commit block into one {@link CommitRecord} per changed file.
 *
 * <p>A block starts with the commit header and runs up to the next header. The author and
 * date lines may be preceded by other headers (e.g. {@code Merge:}), so both are searched for.
 * Everything after the date line is either a numstat line or part of the message.</p>
 */
public class CommitBlockParser {

    private final String repository;
    private final DefectClassifier classifier;

    public CommitBlockParser(String repository, DefectClassifier classifier) {
        this.repository = repository;
        this.classifier = classifier;
    }

    /**
     * @return the records of the block in numstat order; empty for commits without
     *         file changes such as merges
     * @throws LogFormatException if the block lacks its header, author or date
     */
    public List<CommitRecord> parse(List<String> block) {
        if (block.isEmpty()) {
            throw new LogFormatException("Empty commit", block);
        }
        String commitId = parseCommitId(block);
        List<String> rest = block.subList(1, block.size());
        String author = parseAuthor(rest, block);
        int dateIndex = findDateLine(rest, block);
        long timestamp = parseTimestamp(rest.get(dateIndex), block);

        List<String> files = new ArrayList<>();
        StringBuilder message = new StringBuilder();
        for (String line : rest.subList(dateIndex + 1, rest.size())) {
            if (LinePatterns.isFileChange(line)) {
                files.add(line);
            } else {
                message.append(line).append('\n');
            }
        }
        if (files.isEmpty()) {
            return List.of();
        }

        boolean defect = classifier.isDefect(commitId, message.toString());
        CommitRecord first = new CommitRecord(repository, timestamp, commitId, author, defect);
        List<CommitRecord> records = new ArrayList<>(files.size());
        for (String fileLine : files) {
            CommitRecord record = records.isEmpty() ? first : first.copyForNextFile();
            parseFileChange(record, fileLine, block);
            records.add(record);
        }
        return records;
    }

    private String parseCommitId(List<String> block) {
        LineMatch match = LinePatterns.commitHeader(block.get(0));
        if (!match.matched()) {
            throw new LogFormatException("Unable to extract commit info from line '" + block.get(0) + "' in", block);
        }
        return match.group(1);
    }

    private String parseAuthor(List<String> lines, List<String> block) {
        for (String line : lines) {
            LineMatch match = LinePatterns.authorLine(line);
            if (match.matched()) {
                return match.group(2);
            }
        }
        throw new LogFormatException("Unable to identify author in", block);
    }

    private int findDateLine(List<String> lines, List<String> block) {
        for (int i = 0; i < lines.size(); i++) {
            if (LinePatterns.dateLine(lines.get(i)).matched()) {
                return i;
            }
        }
        throw new LogFormatException("Unable to create timestamp from", block);
    }

    private long parseTimestamp(String dateLine, List<String> block) {
        String dateText = LinePatterns.dateLine(dateLine).group(1);
        try {
            return LinePatterns.toEpochSeconds(dateText);
        } catch (DateTimeParseException e) {
            throw new LogFormatException("Unable to parse date '" + dateText.trim() + "' in", block, e);
        }
    }

    private void parseFileChange(CommitRecord record, String line, List<String> block) {
        LineMatch match = LinePatterns.fileChange(line);
        try {
            record.setFileChange(match.group(3).trim(),
                    Integer.parseInt(match.group(1)), Integer.parseInt(match.group(2)));
        } catch (NumberFormatException e) {
            throw new LogFormatException("Unable to parse file changes in line '" + line + "' in", block, e);
        }
    }
}
