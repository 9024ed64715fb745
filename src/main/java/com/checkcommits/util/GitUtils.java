package com.checkcommits.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

public class GitUtils {

    private static final Logger log = LoggerFactory.getLogger(GitUtils.class);

    /** Overrides {@code log.date} and {@code log.showSignature} so the dump has the layout the parser reads. */
    static final String[] NUMSTAT_LOG_ARGUMENTS = {"log", "--numstat", "--date=default", "--no-show-signature"};

    /** Runs {@code git -C <repoPath> log --numstat} and returns its output lines. */
    public static List<String> readNumstatLog(String repoPath) {
        return runGit(repoPath, NUMSTAT_LOG_ARGUMENTS);
    }

    static List<String> runGit(String repoPath, String... arguments) {
        List<String> command = new ArrayList<>(List.of("git", "-C", new File(repoPath).getAbsolutePath()));
        command.addAll(List.of(arguments));
        log.debug("Running {}", command);
        try {
            ProcessBuilder pb = new ProcessBuilder(command);
            pb.redirectError(ProcessBuilder.Redirect.INHERIT);
            Process process = pb.start();

            List<String> output = new ArrayList<>();
            try (BufferedReader reader = new BufferedReader(
                    new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
                String line;
                while ((line = reader.readLine()) != null) {
                    output.add(line);
                }
            }

            int exitCode = process.waitFor();
            if (exitCode != 0) {
                throw new IllegalStateException(String.join(" ", command) + " failed with exit code " + exitCode);
            }
            log.debug("Read {} lines from git", output.size());
            return output;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to run " + String.join(" ", command), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for " + String.join(" ", command), e);
        }
    }
}
