package com.checkcommits.config;

import com.checkcommits.parser.LinePatterns;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Settings under the {@code check-commits} prefix, e.g. {@code --check-commits.csv=false}.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "check-commits")
public class CheckCommitsProperties {

    /** Directory receiving the JSON, CSV and text files. */
    private String outputDir = ".";

    /** Also write {@code <repo>.csv}. */
    private boolean csv = true;

    /** Also write {@code <repo>-commit-recs.txt}. */
    private boolean text = true;

    /** List of defect commit ids; {@code <repo>.dft} in the working directory when empty. */
    private String defectsFile = "";

    /** Ticket reference that marks a commit message as a defect fix. */
    private String ticketPattern = LinePatterns.DEFAULT_TICKET_PATTERN.pattern();

    /** Parse commit blocks on all available processors. */
    private boolean parallel = false;
}
