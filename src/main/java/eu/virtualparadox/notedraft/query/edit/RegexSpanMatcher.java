package eu.virtualparadox.notedraft.query.edit;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Base for matchers that turn the needle into a case-insensitive pattern.
 */
abstract class RegexSpanMatcher implements SpanMatcher {

    static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE;

    /**
     * @return the pattern for this needle, or {@code null} when the strategy does not apply
     */
    protected abstract Pattern patternFor(String needle);

    @Override
    public Optional<Span> find(final String haystack, final String needle) {
        final Pattern pattern = patternFor(needle);
        if (pattern == null) {
            return Optional.empty();
        }
        final Matcher m = pattern.matcher(haystack);
        return m.find() ? Optional.of(new Span(m.start(), m.end())) : Optional.empty();
    }
}
