package com.checkcommits.util;

import com.checkcommits.pojo.CommitRecord;
import org.apache.commons.io.FileUtils;

import java.io.File;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.List;

public class TextUtils {

    public static String generateTextFileName(String repoName) {
        return repoName + "-commit-recs.txt";
    }

    /** One {@link CommitRecord#toString()} line per record. */
    public static void writeRecords(List<CommitRecord> records, File outputFile) {
        try {
            FileUtils.writeLines(outputFile, StandardCharsets.UTF_8.name(), records, "\n");
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write text output to " + outputFile, e);
        }
    }
}
