package com.checkcommits.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Builder;
import lombok.Getter;

@Getter
@Builder
@JsonPropertyOrder({"repository", "timestamp", "commit_id", "file", "lines_added", "lines_deleted", "author", "is_defect"})
public class CommitRecordDto {
    @JsonProperty("repository")
    private String repository;
    @JsonProperty("timestamp")
    private long timestamp;
    @JsonProperty("commit_id")
    private String commitId;
    @JsonProperty("file")
    private String file;
    @JsonProperty("lines_added")
    private int linesAdded;
    @JsonProperty("lines_deleted")
    private int linesDeleted;
    @JsonProperty("author")
    private String author;
    @JsonProperty("is_defect")
    private boolean defect;
}
