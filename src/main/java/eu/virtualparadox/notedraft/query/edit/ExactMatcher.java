package eu.virtualparadox.notedraft.query.edit;

import java.util.Optional;

public class ExactMatcher implements SpanMatcher {

    @Override
    public String name() {
        return "exact";
    }

    @Override
    public Optional<Span> find(final String haystack, final String needle) {
        if (needle.isEmpty()) {
            return Optional.empty();
        }
        final int start = haystack.indexOf(needle);
        return start < 0 ? Optional.empty() : Optional.of(new Span(start, start + needle.length()));
    }
}
