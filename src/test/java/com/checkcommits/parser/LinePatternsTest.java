package com.checkcommits.parser;

import org.junit.jupiter.api.Test;

import java.time.format.DateTimeParseException;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests the class {@link LinePatterns}.
 */
class LinePatternsTest {
    private static final String COMMIT_ID = "0123456789abcdef0123456789abcdef01234567";

    @Test
    void shouldExtractCommitId() {
        assertThat(LinePatterns.commitHeader("commit " + COMMIT_ID).group(1)).isEqualTo(COMMIT_ID);
        assertThat(LinePatterns.commitHeader("commit\t" + COMMIT_ID + " (HEAD -> main)").group(1))
                .isEqualTo(COMMIT_ID);
    }

    @Test
    void shouldRejectMalformedCommitHeaders() {
        assertThat(LinePatterns.isCommitHeader("commit 0123456789abcdef")).isFalse();
        assertThat(LinePatterns.isCommitHeader("commit " + COMMIT_ID.toUpperCase())).isFalse();
        assertThat(LinePatterns.isCommitHeader("    commit " + COMMIT_ID)).isFalse();
        assertThat(LinePatterns.isCommitHeader("commits " + COMMIT_ID)).isFalse();
    }

    @Test
    void shouldStartBlockAtAnyColumnZeroCommitLine() {
        assertThat(LinePatterns.startsCommitBlock("commit " + COMMIT_ID)).isTrue();
        assertThat(LinePatterns.startsCommitBlock("commit 0123456789abcdef")).isTrue();
        assertThat(LinePatterns.startsCommitBlock("commit\t" + COMMIT_ID)).isTrue();
        assertThat(LinePatterns.startsCommitBlock("    commit " + COMMIT_ID)).isFalse();
        assertThat(LinePatterns.startsCommitBlock("commits " + COMMIT_ID)).isFalse();
        assertThat(LinePatterns.startsCommitBlock("commit")).isFalse();
    }

    @Test
    void shouldExtractAuthorAddress() {
        LineMatch match = LinePatterns.authorLine("Author: Jane Q. Doe <jane@example.com>");

        assertThat(match.matched()).isTrue();
        assertThat(match.group(1)).isEqualTo("Jane Q. Doe");
        assertThat(match.group(2)).isEqualTo("jane@example.com");
        assertThat(LinePatterns.authorLine("Author: jane@example.com").matched()).isFalse();
    }

    @Test
    void shouldConvertDateToUtcEpochSeconds() {
        LineMatch match = LinePatterns.dateLine("Date:   Wed Jan 07 10:15:00 2015 -0500");

        assertThat(match.matched()).isTrue();
        assertThat(LinePatterns.toEpochSeconds(match.group(1))).isEqualTo(1_420_643_700L);
        assertThat(LinePatterns.toEpochSeconds("Wed Jan 7 10:15:00 2015 -0500")).isEqualTo(1_420_643_700L);
        assertThat(LinePatterns.toEpochSeconds("Wed Jan 7 15:15:00 2015 +0000")).isEqualTo(1_420_643_700L);
    }

    @Test
    void shouldRejectDatesInOtherFormats() {
        assertThatExceptionOfType(DateTimeParseException.class)
                .isThrownBy(() -> LinePatterns.toEpochSeconds("2015-01-07T10:15:00-05:00"));
    }

    @Test
    void shouldMatchNumstatLines() {
        LineMatch match = LinePatterns.fileChange("10\t2\tsrc/main/Foo.java");

        assertThat(match.matched()).isTrue();
        assertThat(match.groups()).containsExactly("10", "2", "src/main/Foo.java");
        assertThat(LinePatterns.isFileChange("0 0 README")).isTrue();
    }

    @Test
    void shouldNotMatchBinaryOrMessageLines() {
        assertThat(LinePatterns.isFileChange("-\t-\timages/logo.png")).isFalse();
        assertThat(LinePatterns.isFileChange("    10\t2\tindented.txt")).isFalse();
        assertThat(LinePatterns.isFileChange("")).isFalse();
        assertThat(LinePatterns.fileChange("Fix things")).isEqualTo(LineMatch.NO_MATCH);
    }

    @Test
    void shouldFindTicketAnywhereInText() {
        assertThat(LinePatterns.containsTicket("    fix JIRA-42 for real", LinePatterns.DEFAULT_TICKET_PATTERN)).isTrue();
        assertThat(LinePatterns.containsTicket("see PROJ-1", LinePatterns.DEFAULT_TICKET_PATTERN)).isTrue();
        assertThat(LinePatterns.containsTicket("jira-42", LinePatterns.DEFAULT_TICKET_PATTERN)).isFalse();
        assertThat(LinePatterns.containsTicket("JIRA-", LinePatterns.DEFAULT_TICKET_PATTERN)).isFalse();
    }

    @Test
    void shouldNotExposeGroupsOfFailedMatch() {
        assertThatIllegalStateException().isThrownBy(() -> LineMatch.NO_MATCH.group(1));
    }
}
