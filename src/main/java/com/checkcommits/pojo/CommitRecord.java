package com.checkcommits.pojo;

import lombok.Getter;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One file touched by one commit.
 *
 * <p>The commit-level fields are fixed at construction. The file-level fields start out
 * unset ({@code file == null}, counters at {@link #NOT_PARSED}) and are filled exactly once
 * through {@link #setFileChange(String, int, int)}.</p>
 */
@Getter
public class CommitRecord {

    public static final int NOT_PARSED = -1;

    /** Keys of {@link #toMap()}, in output order. */
    public static final String[] FIELD_NAMES = {
            "repository", "timestamp", "commit_id", "file",
            "lines_added", "lines_deleted", "author", "is_defect"
    };

    private final String repository;
    private final long timestamp;
    private final String commitId;
    private final String author;
    private final boolean defect;

    private String file;
    private int linesAdded = NOT_PARSED;
    private int linesDeleted = NOT_PARSED;

    public CommitRecord(String repository, long timestamp, String commitId, String author, boolean defect) {
        this.repository = repository;
        this.timestamp = timestamp;
        this.commitId = commitId;
        this.author = author;
        this.defect = defect;
    }

    /**
     * Starts the record for the next file of the same commit: commit-level fields are shared,
     * file-level fields are unset.
     */
    public CommitRecord copyForNextFile() {
        return new CommitRecord(repository, timestamp, commitId, author, defect);
    }

    public void setFileChange(String file, int linesAdded, int linesDeleted) {
        if (this.file != null) {
            throw new IllegalStateException("File change already recorded for " + commitId + ": " + this.file);
        }
        if (linesAdded < 0 || linesDeleted < 0) {
            throw new IllegalArgumentException("Line counts must not be negative: +" + linesAdded + " -" + linesDeleted);
        }
        this.file = file;
        this.linesAdded = linesAdded;
        this.linesDeleted = linesDeleted;
    }

    public boolean hasFileChange() {
        return file != null;
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put(FIELD_NAMES[0], repository);
        map.put(FIELD_NAMES[1], timestamp);
        map.put(FIELD_NAMES[2], commitId);
        map.put(FIELD_NAMES[3], file);
        map.put(FIELD_NAMES[4], linesAdded);
        map.put(FIELD_NAMES[5], linesDeleted);
        map.put(FIELD_NAMES[6], author);
        map.put(FIELD_NAMES[7], defect);
        return map;
    }

    /**
     * Compact key/value rendering, e.g.
     * {@code {"repository":"demo","timestamp":1420643700,...,"is_defect":"true"}}.
     * Strings and booleans are quoted, numbers are not.
     */
    @Override
    public String toString() {
        StringBuilder result = new StringBuilder("{");
        for (Map.Entry<String, Object> entry : toMap().entrySet()) {
            if (result.length() > 1) {
                result.append(',');
            }
            result.append('"').append(entry.getKey()).append("\":");
            Object value = entry.getValue();
            if (value instanceof String || value instanceof Boolean) {
                result.append('"').append(value).append('"');
            } else {
                result.append(value);
            }
        }
        return result.append('}').toString();
    }
}
