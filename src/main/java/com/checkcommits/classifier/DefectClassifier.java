package com.checkcommits.classifier;

import com.checkcommits.parser.LinePatterns;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Decides whether a commit fixes a defect. Rules are tried in order; the first match wins.
 */
public class DefectClassifier {

    private static final Logger log = LoggerFactory.getLogger(DefectClassifier.class);

    public interface DefectRule {
        boolean matches(String commitId, String message);

        String description();
    }

    /** Commit listed in the external defect file. */
    public static class ListedCommitRule implements DefectRule {
        private final DefectCommits defectCommits;

        public ListedCommitRule(DefectCommits defectCommits) {
            this.defectCommits = defectCommits;
        }

        @Override
        public boolean matches(String commitId, String message) {
            return defectCommits.isDefect(commitId);
        }

        @Override
        public String description() {
            return "listed in external defect commits";
        }
    }

    /** Ticket reference such as JIRA-42 somewhere in the commit message. */
    public static class TicketReferenceRule implements DefectRule {
        private final Pattern ticketPattern;

        public TicketReferenceRule(Pattern ticketPattern) {
            this.ticketPattern = ticketPattern;
        }

        @Override
        public boolean matches(String commitId, String message) {
            return LinePatterns.containsTicket(message, ticketPattern);
        }

        @Override
        public String description() {
            return "message references ticket " + ticketPattern.pattern();
        }
    }

    private final List<DefectRule> rules;

    public DefectClassifier(DefectCommits defectCommits) {
        this(defectCommits, LinePatterns.DEFAULT_TICKET_PATTERN);
    }

    public DefectClassifier(DefectCommits defectCommits, Pattern ticketPattern) {
        this(List.of(new ListedCommitRule(defectCommits), new TicketReferenceRule(ticketPattern)));
    }

    public DefectClassifier(List<DefectRule> rules) {
        this.rules = List.copyOf(rules);
    }

    public boolean isDefect(String commitId, String message) {
        Optional<DefectRule> match = matchingRule(commitId, message);
        match.ifPresent(rule -> log.debug("Commit {} is a defect fix: {}", commitId, rule.description()));
        return match.isPresent();
    }

    public Optional<DefectRule> matchingRule(String commitId, String message) {
        return rules.stream()
                .filter(rule -> rule.matches(commitId, message))
                .findFirst();
    }

    List<DefectRule> getRules() {
        return rules;
    }
}
