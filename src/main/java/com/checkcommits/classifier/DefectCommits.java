package com.checkcommits.classifier;

import org.apache.commons.io.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Collection;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Commits the user has marked as defect fixes, read from a plain text file with one
 * 40 character commit id per line.
 */
public final class DefectCommits {

    private static final Logger log = LoggerFactory.getLogger(DefectCommits.class);

    private static final DefectCommits NONE = new DefectCommits(Set.of());

    private final Set<String> commitIds;

    private DefectCommits(Set<String> commitIds) {
        this.commitIds = commitIds;
    }

    public static DefectCommits none() {
        return NONE;
    }

    public static DefectCommits of(Collection<String> commitIds) {
        return new DefectCommits(commitIds.stream()
                .map(String::trim)
                .filter(id -> !id.isEmpty())
                .collect(Collectors.toUnmodifiableSet()));
    }

    /**
     * Reads the file if it is there. A missing or unreadable file is not an error: the run
     * then relies on the commit message heuristic alone.
     */
    public static DefectCommits load(File defectsFile) {
        if (!defectsFile.isFile()) {
            log.info("NOTE: No external defect commits specified ({} not found).", defectsFile.getPath());
            return none();
        }
        try {
            DefectCommits defectCommits = of(FileUtils.readLines(defectsFile, StandardCharsets.UTF_8));
            log.info("Loaded {} external defect commits from {}", defectCommits.size(), defectsFile.getPath());
            return defectCommits;
        } catch (IOException e) {
            log.warn("NOTE: Unable to open external defect commits file {} ({}). Will use internal heuristics.",
                    defectsFile.getPath(), e.getMessage());
            return none();
        }
    }

    public boolean isDefect(String commitId) {
        return commitIds.contains(commitId);
    }

    public int size() {
        return commitIds.size();
    }
}
