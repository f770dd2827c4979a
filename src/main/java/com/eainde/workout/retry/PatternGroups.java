package com.eainde.workout.retry;

import java.util.Arrays;
import java.util.List;
import java.util.regex.Pattern;

final class PatternGroups {

    private PatternGroups() {
    }

    static List<Pattern> compile(String... regexes) {
        return Arrays.stream(regexes)
                .map(regex -> Pattern.compile(regex, Pattern.CASE_INSENSITIVE))
                .toList();
    }

    static boolean anyMatch(List<Pattern> patterns, String text) {
        return patterns.stream().anyMatch(pattern -> pattern.matcher(text).find());
    }
}
