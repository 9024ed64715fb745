package com.checkcommits.service;

import com.checkcommits.classifier.DefectClassifier;
import com.checkcommits.classifier.DefectCommits;
import com.checkcommits.parser.CommitLogParser;
import com.checkcommits.pojo.CommitRecord;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static com.checkcommits.LogFixtures.*;
import static org.assertj.core.api.Assertions.*;

/**
 * Tests the class {@link RecordWriter}.
 */
class RecordWriterTest {

    @TempDir
    Path tempDir;

    private final RecordWriter writer = new RecordWriter();

    @Test
    void shouldWriteJsonCsvAndText() throws IOException {
        List<CommitRecord> records = parseFixture();

        List<File> written = writer.writeAll("demo", records, new RecordWriter.OutputOptions(tempDir.toFile(), true, true));

        assertThat(written).extracting(File::getName)
                .containsExactly("demo.json", "demo.csv", "demo-commit-recs.txt");

        JsonNode json = new ObjectMapper().readTree(tempDir.resolve("demo.json").toFile());
        assertThat(json.isArray()).isTrue();
        assertThat(json).hasSize(5);
        List<String> keys = new ArrayList<>();
        json.get(4).fieldNames().forEachRemaining(keys::add);
        assertThat(keys).containsExactly(CommitRecord.FIELD_NAMES);
        assertThat(json.get(4).get("commit_id").asText()).isEqualTo(JIRA_FIX);
        assertThat(json.get(4).get("timestamp").asLong()).isEqualTo(1_420_643_700L);
        assertThat(json.get(4).get("is_defect").asBoolean()).isTrue();
        assertThat(json.get(4).get("lines_added").asInt()).isEqualTo(10);

        List<String> csv = Files.readAllLines(tempDir.resolve("demo.csv"), StandardCharsets.UTF_8);
        assertThat(csv).hasSize(6);
        assertThat(csv.get(0)).isEqualTo(String.join(",", CommitRecord.FIELD_NAMES));
        assertThat(csv.get(5)).isEqualTo("demo,1420643700," + JIRA_FIX + ",foo.txt,10,2,a@x.com,true");

        List<String> text = Files.readAllLines(tempDir.resolve("demo-commit-recs.txt"), StandardCharsets.UTF_8);
        assertThat(text).hasSize(5);
        assertThat(text.get(4)).isEqualTo(records.get(4).toString());
    }

    @Test
    void shouldWriteOnlyJsonWhenViewsAreDisabled() {
        List<File> written = writer.writeAll("demo", parseFixture(),
                new RecordWriter.OutputOptions(tempDir.resolve("out").toFile(), false, false));

        assertThat(written).singleElement().extracting(File::getName).isEqualTo("demo.json");
        assertThat(tempDir.resolve("out/demo.json")).exists();
        assertThat(tempDir.resolve("out/demo.csv")).doesNotExist();
        assertThat(tempDir.resolve("out/demo-commit-recs.txt")).doesNotExist();
    }

    @Test
    void shouldWriteEmptyArrayForLogWithoutRecords() throws IOException {
        writer.writeAll("empty", List.of(), new RecordWriter.OutputOptions(tempDir.toFile(), false, false));

        JsonNode json = new ObjectMapper().readTree(tempDir.resolve("empty.json").toFile());
        assertThat(json.isArray()).isTrue();
        assertThat(json).isEmpty();
    }

    private List<CommitRecord> parseFixture() {
        return new CommitLogParser("demo", new DefectClassifier(DefectCommits.none())).parse(numstatLog());
    }
}
