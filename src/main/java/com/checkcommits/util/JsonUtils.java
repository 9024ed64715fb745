package com.checkcommits.util;

import com.checkcommits.dto.CommitRecordDto;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.File;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.List;

public class JsonUtils {
    private static final ObjectMapper mapper = new ObjectMapper();

    public static String generateJsonFileName(String repoName) {
        return repoName + ".json";
    }

    /** Writes the records as one JSON array of flat objects. */
    public static void writeRecords(List<CommitRecordDto> records, File outputFile) {
        try {
            mkdirsFor(outputFile);
            mapper.writerWithDefaultPrettyPrinter().writeValue(outputFile, records);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write JSON output to " + outputFile, e);
        }
    }

    static void mkdirsFor(File outputFile) throws IOException {
        File parent = outputFile.getAbsoluteFile().getParentFile();
        if (parent != null && !parent.isDirectory() && !parent.mkdirs()) {
            throw new IOException("Unable to create directory " + parent);
        }
    }
}
