package com.checkcommits.util;

import com.checkcommits.pojo.CommitRecord;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;

import java.io.File;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.List;

public class CsvUtils {

    private static final CSVFormat FORMAT = CSVFormat.DEFAULT.builder()
            .setHeader(CommitRecord.FIELD_NAMES)
            .setRecordSeparator(System.lineSeparator())
            .build();

    public static String generateCsvFileName(String repoName) {
        return repoName + ".csv";
    }

    /** Header row with the record keys, then one row per record in the same column order. */
    public static void writeRecords(List<CommitRecord> records, File outputFile) {
        try {
            JsonUtils.mkdirsFor(outputFile);
            try (Writer out = Files.newBufferedWriter(outputFile.toPath(), StandardCharsets.UTF_8);
                 CSVPrinter printer = new CSVPrinter(out, FORMAT)) {
                for (CommitRecord record : records) {
                    printer.printRecord(record.toMap().values());
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write CSV output to " + outputFile, e);
        }
    }
}
