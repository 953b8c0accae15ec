package eu.virtualparadox.notedraft.query.edit;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Merges a revised passage into existing prose.
 *
 * <p>The target excerpt is searched with each matcher in turn: exact, case-insensitive,
 * word tokens, then head/tail. The first hit is replaced in place. When nothing matches,
 * the {@link EUnmatchedPolicy} chosen by the caller decides.</p>
 */
@Slf4j
@Component
public class EditReconciler {

    private final List<SpanMatcher> matchers;

    public EditReconciler() {
        this(List.of(new ExactMatcher(), new CaseInsensitiveMatcher(), new TokenRegexMatcher(), new HeadTailMatcher()));
    }

    public EditReconciler(final List<SpanMatcher> matchers) {
        this.matchers = List.copyOf(matchers);
    }

    public ReconciliationResult reconcile(final String current,
                                          final String target,
                                          final String replacement,
                                          final EUnmatchedPolicy policy) {
        final String text = StringUtils.defaultString(current);
        final String revised = StringUtils.defaultString(replacement);

        if (StringUtils.isNotBlank(target)) {
            for (SpanMatcher matcher : matchers) {
                final Optional<Span> span = matcher.find(text, target);
                if (span.isPresent()) {
                    final Span s = span.get();
                    log.debug("Edit target located by {} matcher at [{}, {})", matcher.name(), s.start(), s.end());
                    return new ReconciliationResult(text.substring(0, s.start()) + revised + text.substring(s.end()),
                            EReconcileOutcome.REPLACED, matcher.name(), s);
                }
            }
        }

        log.debug("Edit target not found, applying {}", policy);
        return switch (policy) {
            case APPEND -> new ReconciliationResult(
                    text.isBlank() ? revised : text.stripTrailing() + "\n\n" + revised,
                    EReconcileOutcome.APPENDED, null, null);
            case REPLACE_ALL -> new ReconciliationResult(revised, EReconcileOutcome.REPLACED_ALL, null, null);
            case REJECT -> new ReconciliationResult(text, EReconcileOutcome.REJECTED, null, null);
        };
    }
}
