package com.checkcommits.service;

import com.checkcommits.mapper.RecordMapper;
import com.checkcommits.pojo.CommitRecord;
import com.checkcommits.util.CsvUtils;
import com.checkcommits.util.JsonUtils;
import com.checkcommits.util.TextUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.File;
import java.util.ArrayList;
import java.util.List;

/**
 * Writes the records of a run: always {@code <repo>.json}, optionally the CSV and text views.
 */
@Service
public class RecordWriter {

    private static final Logger log = LoggerFactory.getLogger(RecordWriter.class);

    public record OutputOptions(File outputDir, boolean csv, boolean text) {
    }

    /** @return the files written, JSON first */
    public List<File> writeAll(String repoName, List<CommitRecord> records, OutputOptions options) {
        List<File> written = new ArrayList<>();

        File json = new File(options.outputDir(), JsonUtils.generateJsonFileName(repoName));
        JsonUtils.writeRecords(RecordMapper.toDtos(records), json);
        written.add(json);

        if (options.csv()) {
            File csv = new File(options.outputDir(), CsvUtils.generateCsvFileName(repoName));
            CsvUtils.writeRecords(records, csv);
            written.add(csv);
        }
        if (options.text()) {
            File text = new File(options.outputDir(), TextUtils.generateTextFileName(repoName));
            TextUtils.writeRecords(records, text);
            written.add(text);
        }

        written.forEach(file -> log.info("Wrote {} records to {}", records.size(), file.getPath()));
        return written;
    }
}
