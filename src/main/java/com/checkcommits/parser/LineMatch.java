package com.checkcommits.parser;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.regex.Matcher;

/**
 * Outcome of checking one log line against one of the {@link LinePatterns}.
 * Groups are 1-based, like {@link Matcher#group(int)}.
 */
public record LineMatch(boolean matched, List<String> groups) {

    public static final LineMatch NO_MATCH = new LineMatch(false, List.of());

    static LineMatch of(Matcher matcher) {
        if (!matcher.lookingAt()) {
            return NO_MATCH;
        }
        String[] captured = new String[matcher.groupCount()];
        for (int i = 0; i < captured.length; i++) {
            captured[i] = matcher.group(i + 1);
        }
        return new LineMatch(true, Collections.unmodifiableList(Arrays.asList(captured)));
    }

    public String group(int index) {
        if (!matched) {
            throw new IllegalStateException("No groups on a line that did not match");
        }
        return groups.get(index - 1);
    }
}
