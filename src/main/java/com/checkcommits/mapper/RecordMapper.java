package com.checkcommits.mapper;

import com.checkcommits.dto.CommitRecordDto;
import com.checkcommits.pojo.CommitRecord;

import java.util.List;
import java.util.stream.Collectors;

public class RecordMapper {

    public static CommitRecordDto toDto(CommitRecord record) {
        if (!record.hasFileChange()) {
            throw new IllegalArgumentException("Record of commit " + record.getCommitId() + " has no file change yet");
        }
        return CommitRecordDto.builder()
                .repository(record.getRepository())
                .timestamp(record.getTimestamp())
                .commitId(record.getCommitId())
                .file(record.getFile())
                .linesAdded(record.getLinesAdded())
                .linesDeleted(record.getLinesDeleted())
                .author(record.getAuthor())
                .defect(record.isDefect())
                .build();
    }

    public static List<CommitRecordDto> toDtos(List<CommitRecord> records) {
        return records.stream()
                .map(RecordMapper::toDto)
                .collect(Collectors.toList());
    }
}
