package com.checkcommits.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests the class {@link GitUtils}.
 */
class GitUtilsTest {

    @Test
    void shouldPinLogLayoutAgainstUserConfiguration() {
        assertThat(GitUtils.NUMSTAT_LOG_ARGUMENTS)
                .startsWith("log", "--numstat")
                .contains("--date=default", "--no-show-signature");
    }
}
