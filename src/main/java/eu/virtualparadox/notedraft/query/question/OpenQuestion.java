package eu.virtualparadox.notedraft.query.question;

import eu.virtualparadox.notedraft.rag.generate.Citation;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * Entry of the open-question ledger. Instances are immutable; every transition returns a copy.
 *
 * <p>{@code key} is taken from the phrasing the question was first extracted with and never
 * changes, so a question keeps its identity after the user rewords it.</p>
 */
@Value
@Builder(toBuilder = true)
public class OpenQuestion {

    String id;
    String sectionId;
    String key;
    String text;
    String rationale;
    String answer;
    @Builder.Default
    List<Citation> answerCitations = List.of();
    EOpenQuestionStatus status;
    boolean edited;
    Instant createdAt;
    Instant updatedAt;

    public OpenQuestion answer(final String answerText, final List<Citation> citations, final Instant now) {
        return transition(EOpenQuestionStatus.ANSWERED, now)
                .answer(answerText)
                .answerCitations(List.copyOf(citations))
                .build();
    }

    public OpenQuestion resolve(final Instant now) {
        return transition(EOpenQuestionStatus.RESOLVED, now).build();
    }

    /**
     * Brings a resolved question back after it was extracted again.
     */
    public OpenQuestion reopen(final Instant now) {
        return transition(EOpenQuestionStatus.OPEN, now).build();
    }

    /**
     * Drops the answer; the question is open again.
     */
    public OpenQuestion clearAnswer(final Instant now) {
        if (status != EOpenQuestionStatus.ANSWERED) {
            throw new IllegalStateException("Question " + id + " has no answer to clear");
        }
        return transition(EOpenQuestionStatus.OPEN, now)
                .answer(null)
                .answerCitations(List.of())
                .build();
    }

    public OpenQuestion edit(final String newText, final String newRationale, final Instant now) {
        return toBuilder()
                .text(newText)
                .rationale(newRationale)
                .edited(true)
                .updatedAt(now)
                .build();
    }

    public boolean isOpen() {
        return status == EOpenQuestionStatus.OPEN;
    }

    private OpenQuestionBuilder transition(final EOpenQuestionStatus target, final Instant now) {
        if (!status.canTransitionTo(target)) {
            throw new IllegalStateException("Question " + id + " cannot move from " + status + " to " + target);
        }
        return toBuilder().status(target).updatedAt(now);
    }
}
