package eu.virtualparadox.notedraft.query.question;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * In-memory list of open questions for the current case. All updates are serialized.
 */
@Component
@RequiredArgsConstructor
public class OpenQuestionLedger {

    private final OpenQuestionExtractor extractor;
    private final OpenQuestionMerger merger;
    private final Clock clock;

    private List<OpenQuestion> questions = List.of();

    /**
     * Re-reads the questions of one section from its latest text.
     */
    public synchronized List<OpenQuestion> refresh(final String sectionId, final String sectionText) {
        questions = List.copyOf(merger.merge(questions, sectionId, extractor.extract(sectionText), clock.instant()));
        return forSection(sectionId);
    }

    public synchronized List<OpenQuestion> all() {
        return questions;
    }

    public synchronized List<OpenQuestion> open() {
        return questions.stream().filter(OpenQuestion::isOpen).toList();
    }

    public synchronized List<OpenQuestion> forSection(final String sectionId) {
        return questions.stream().filter(q -> q.getSectionId().equals(sectionId)).toList();
    }

    public synchronized Optional<OpenQuestion> get(final String id) {
        return questions.stream().filter(q -> q.getId().equals(id)).findFirst();
    }

    /**
     * Applies a transition to one question.
     *
     * @throws IllegalArgumentException if the id is unknown
     */
    public synchronized OpenQuestion update(final String id, final UnaryOperator<OpenQuestion> change) {
        final List<OpenQuestion> copy = new ArrayList<>(questions);
        for (int i = 0; i < copy.size(); i++) {
            if (copy.get(i).getId().equals(id)) {
                final OpenQuestion updated = change.apply(copy.get(i));
                copy.set(i, updated);
                questions = List.copyOf(copy);
                return updated;
            }
        }
        throw new IllegalArgumentException("Unknown open question: " + id);
    }

    public OpenQuestion edit(final String id, final String text, final String rationale) {
        return update(id, q -> q.edit(text, rationale, clock.instant()));
    }

    public OpenQuestion clearAnswer(final String id) {
        return update(id, q -> q.clearAnswer(clock.instant()));
    }

    /**
     * Explicit removal by the user; the only way a question leaves the ledger.
     */
    public synchronized boolean remove(final String id) {
        final int before = questions.size();
        questions = questions.stream().filter(q -> !q.getId().equals(id)).toList();
        return questions.size() != before;
    }
}
