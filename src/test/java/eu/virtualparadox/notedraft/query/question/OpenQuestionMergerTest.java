package eu.virtualparadox.notedraft.query.question;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class OpenQuestionMergerTest {

    private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");
    private static final Instant T1 = Instant.parse("2024-05-01T11:00:00Z");
    private static final Instant T2 = Instant.parse("2024-05-01T12:00:00Z");

    private final OpenQuestionMerger merger = new OpenQuestionMerger();

    private static ExtractedQuestion extracted(String text) {
        return new ExtractedQuestion(text, null, OpenQuestionExtractor.normalizeKey(text));
    }

    @Test
    @DisplayName("Merging the same extraction twice changes nothing")
    void idempotent() {
        List<ExtractedQuestion> extraction = List.of(extracted("Any daytime naps?"));

        List<OpenQuestion> first = merger.merge(List.of(), "sleep", extraction, T0);
        List<OpenQuestion> second = merger.merge(first, "sleep", extraction, T1);

        assertThat(first).hasSize(1);
        assertThat(first.get(0).getStatus()).isEqualTo(EOpenQuestionStatus.OPEN);
        assertThat(second).isEqualTo(first);
    }

    @Test
    @DisplayName("An open question that disappears is resolved, and reopens when it comes back")
    void resolveAndReopen() {
        List<OpenQuestion> first = merger.merge(List.of(), "sleep", List.of(extracted("Any daytime naps?")), T0);

        List<OpenQuestion> resolved = merger.merge(first, "sleep", List.of(), T1);
        assertThat(resolved).singleElement()
                .satisfies(q -> assertThat(q.getStatus()).isEqualTo(EOpenQuestionStatus.RESOLVED));

        List<OpenQuestion> reopened = merger.merge(resolved, "sleep", List.of(extracted("any daytime naps")), T2);
        assertThat(reopened).singleElement().satisfies(q -> {
            assertThat(q.getStatus()).isEqualTo(EOpenQuestionStatus.OPEN);
            assertThat(q.getId()).isEqualTo(first.get(0).getId());
            assertThat(q.getUpdatedAt()).isEqualTo(T2);
        });
    }

    @Test
    @DisplayName("Answered questions survive whether or not they are extracted again")
    void answeredKept() {
        OpenQuestion answered = merger.merge(List.of(), "sleep", List.of(extracted("Any daytime naps?")), T0)
                .get(0).answer("Naps daily.", List.of(), T1);

        assertThat(merger.merge(List.of(answered), "sleep", List.of(), T2)).containsExactly(answered);
        assertThat(merger.merge(List.of(answered), "sleep", List.of(extracted("Any daytime naps?")), T2))
                .containsExactly(answered);
    }

    @Test
    @DisplayName("A reworded question keeps its identity")
    void editedKeepsIdentity() {
        OpenQuestion edited = merger.merge(List.of(), "sleep", List.of(extracted("Any daytime naps?")), T0)
                .get(0).edit("Does the patient nap during the day?", null, T1);

        List<OpenQuestion> merged = merger.merge(List.of(edited), "sleep", List.of(extracted("Any daytime naps?")), T2);

        assertThat(merged).containsExactly(edited);
    }

    @Test
    @DisplayName("Other sections pass through and new questions are appended")
    void otherSectionsUntouched() {
        List<OpenQuestion> existing = merger.merge(List.of(), "mood", List.of(extracted("Any mania?")), T0);

        List<OpenQuestion> merged = merger.merge(existing, "sleep", List.of(extracted("Any naps?")), T1);

        assertThat(merged).hasSize(2);
        assertThat(merged.get(0)).isEqualTo(existing.get(0));
        assertThat(merged.get(1).getSectionId()).isEqualTo("sleep");
        assertThat(merged.get(1).getCreatedAt()).isEqualTo(T1);
    }
}
