package com.checkcommits.service;

import com.checkcommits.classifier.DefectClassifier;
import com.checkcommits.classifier.DefectCommits;
import com.checkcommits.config.CheckCommitsProperties;
import com.checkcommits.parser.CommitLogParser;
import com.checkcommits.pojo.CommitRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.File;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.regex.Pattern;

/**
 * Runs the whole analysis for one repository: read the history, parse it, write the results.
 */
@Service
public class CommitAnalysisService {

    private static final Logger log = LoggerFactory.getLogger(CommitAnalysisService.class);

    private final GitRepositoryManager repoManager;
    private final RecordWriter recordWriter;
    private final CheckCommitsProperties properties;

    public CommitAnalysisService(GitRepositoryManager repoManager,
                                 RecordWriter recordWriter,
                                 CheckCommitsProperties properties) {
        this.repoManager = repoManager;
        this.recordWriter = recordWriter;
        this.properties = properties;
    }

    public List<CommitRecord> analyze(String repoPath) {
        String repoName = repoManager.resolveRepositoryName(repoPath);
        log.info("Working with repository: {}", repoName);

        DefectCommits defectCommits = DefectCommits.load(defectsFile(repoName));
        DefectClassifier classifier = new DefectClassifier(defectCommits, Pattern.compile(properties.getTicketPattern()));

        List<String> history = repoManager.readHistory(repoPath);
        List<CommitRecord> records = parse(new CommitLogParser(repoName, classifier), history);

        recordWriter.writeAll(repoName, records, new RecordWriter.OutputOptions(
                new File(properties.getOutputDir()), properties.isCsv(), properties.isText()));
        return records;
    }

    private List<CommitRecord> parse(CommitLogParser parser, List<String> history) {
        if (!properties.isParallel()) {
            return parser.parse(history);
        }
        ExecutorService executor = Executors.newFixedThreadPool(Runtime.getRuntime().availableProcessors());
        try {
            return parser.parseParallel(history, executor);
        } finally {
            executor.shutdownNow();
        }
    }

    File defectsFile(String repoName) {
        String configured = properties.getDefectsFile();
        return configured == null || configured.isBlank() ? new File(repoName + ".dft") : new File(configured);
    }
}
