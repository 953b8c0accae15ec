package eu.virtualparadox.notedraft.query.edit;

import java.util.Arrays;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Case-insensitive substring match that also tolerates differences in whitespace runs.
 */
public class CaseInsensitiveMatcher extends RegexSpanMatcher {

    @Override
    public String name() {
        return "case-insensitive";
    }

    @Override
    protected Pattern patternFor(final String needle) {
        final String trimmed = needle.trim();
        if (trimmed.isEmpty()) {
            return null;
        }
        final String regex = Arrays.stream(trimmed.split("\\s+"))
                .map(Pattern::quote)
                .collect(Collectors.joining("\\s+"));
        return Pattern.compile(regex, FLAGS);
    }
}
