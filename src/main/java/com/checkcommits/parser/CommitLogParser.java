package com.checkcommits.parser;

import com.checkcommits.classifier.DefectClassifier;
import com.checkcommits.pojo.CommitRecord;
import com.google.common.base.Stopwatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

/**
 * Parses a complete {@code git log --numstat} dump into change records, block by block,
 * keeping the order of the log.
 *
 * <p>Parsing is all or nothing: a malformed block raises {@link LogFormatException} and no
 * records are returned for the log.</p>
 */
public class CommitLogParser {

    private static final Logger log = LoggerFactory.getLogger(CommitLogParser.class);

    private final CommitBlockParser blockParser;

    public CommitLogParser(String repository, DefectClassifier classifier) {
        this(new CommitBlockParser(repository, classifier));
    }

    public CommitLogParser(CommitBlockParser blockParser) {
        this.blockParser = blockParser;
    }

    public List<CommitRecord> parse(String logText) {
        return parse(logText.lines().toList());
    }

    public List<CommitRecord> parse(List<String> lines) {
        Stopwatch sw = Stopwatch.createStarted();
        List<Integer> bounds = BlockSegmenter.blockBounds(lines);
        List<CommitRecord> records = new ArrayList<>();
        for (int i = 0; i < bounds.size() - 1; i++) {
            records.addAll(blockParser.parse(lines.subList(bounds.get(i), bounds.get(i + 1))));
        }
        logSummary(bounds.size() - 1, records, sw);
        return records;
    }

    /**
     * Same result as {@link #parse(List)}, with the blocks parsed on the given executor.
     * The executor is not shut down.
     */
    public List<CommitRecord> parseParallel(List<String> lines, ExecutorService executor) {
        Stopwatch sw = Stopwatch.createStarted();
        List<List<String>> blocks = BlockSegmenter.blocks(lines);
        List<Future<List<CommitRecord>>> futures = new ArrayList<>(blocks.size());
        for (List<String> block : blocks) {
            futures.add(executor.submit(() -> blockParser.parse(block)));
        }

        List<CommitRecord> records = new ArrayList<>();
        try {
            for (Future<List<CommitRecord>> future : futures) {
                records.addAll(future.get());
            }
        } catch (ExecutionException e) {
            cancelAll(futures);
            if (e.getCause() instanceof RuntimeException runtimeException) {
                throw runtimeException;
            }
            throw new IllegalStateException("Parsing commit block failed", e.getCause());
        } catch (InterruptedException e) {
            cancelAll(futures);
            Thread.currentThread().interrupt();
            throw new CancellationException("Interrupted while parsing commit log");
        }
        logSummary(blocks.size(), records, sw);
        return records;
    }

    private static void cancelAll(List<Future<List<CommitRecord>>> futures) {
        futures.forEach(future -> future.cancel(true));
    }

    private static void logSummary(int commits, List<CommitRecord> records, Stopwatch sw) {
        long defects = records.stream().filter(CommitRecord::isDefect).count();
        log.info("Parsed {} commits into {} records ({} defect records) in {} ms",
                commits, records.size(), defects, sw.elapsed(TimeUnit.MILLISECONDS));
    }
}
