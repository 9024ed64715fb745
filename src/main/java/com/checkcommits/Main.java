package com.checkcommits;

import com.checkcommits.config.CheckCommitsProperties;
import com.checkcommits.parser.LogFormatException;
import com.checkcommits.service.CommitAnalysisService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

import java.io.UncheckedIOException;
import java.util.Arrays;

/**
 * Usage: {@code check-commits [repo-path] [--check-commits.csv=false] [--check-commits.text=false] ...}
 *
 * <p>Writes {@code <repo>.json} (plus CSV and text views) describing every file of every
 * commit in the repository's history. The repository defaults to the working directory.</p>
 */
@SpringBootApplication
@EnableConfigurationProperties(CheckCommitsProperties.class)
public class Main implements CommandLineRunner, ExitCodeGenerator {

    static final int EXIT_FAILURE = 1;

    private static final Logger log = LoggerFactory.getLogger(Main.class);

    private final CommitAnalysisService analysisService;

    private int exitCode;

    public Main(CommitAnalysisService analysisService) {
        this.analysisService = analysisService;
    }

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(Main.class, args)));
    }

    @Override
    public void run(String... args) {
        // --key=value arguments are Spring properties, the first other one is the repository
        String repoPath = Arrays.stream(args)
                .filter(arg -> !arg.startsWith("--"))
                .findFirst()
                .orElse(".");
        try {
            analysisService.analyze(repoPath);
        } catch (LogFormatException e) {
            log.error("FATAL ERROR: {}", e.getMessage());
            exitCode = EXIT_FAILURE;
        } catch (IllegalStateException | UncheckedIOException e) {
            log.error("ERROR: {}", e.getMessage(), e);
            exitCode = EXIT_FAILURE;
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
