package eu.virtualparadox.notedraft.query.review;

import eu.virtualparadox.notedraft.application.config.ApplicationConfig;
import eu.virtualparadox.notedraft.rag.completion.CompletionService;
import eu.virtualparadox.notedraft.rag.generate.ModelPayloadParser;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class ConsistencyReviewServiceTest {

    private static final List<ReviewedSection> SECTIONS = List.of(
            new ReviewedSection("risk", "Risk", "Denies SI. Denies SI."),
            new ReviewedSection("plan", "Plan", "  "));

    private CompletionService completion;
    private ConsistencyReviewService service;

    @BeforeEach
    void setUp() {
        completion = mock(CompletionService.class);
        service = new ConsistencyReviewService(completion, new ModelPayloadParser(), new ApplicationConfig());
    }

    @Test
    @DisplayName("Changes for known sections are returned, others ignored")
    void parsesChanges() {
        when(completion.complete(any())).thenReturn("""
                ```json
                {"changes": [
                  {"sectionId": "risk", "revisedText": "Denies SI.", "issue": "Duplicate statement."},
                  {"sectionId": "plan", "revisedText": "Follow up in two weeks.", "rationale": "Empty section."},
                  {"sectionId": "mse", "revisedText": "Alert.", "issue": "x"},
                  {"sectionId": "risk"}
                ]}
                ```""");

        List<ReviewChange> changes = service.review(SECTIONS);

        assertThat(changes).containsExactly(
                new ReviewChange("risk", "Denies SI.", "Duplicate statement."),
                new ReviewChange("plan", "Follow up in two weeks.", "Empty section."));
    }

    @Test
    @DisplayName("Unparseable answers mean no changes")
    void unparseable() {
        when(completion.complete(any())).thenReturn("Looks fine to me.");

        assertThat(service.review(SECTIONS)).isEmpty();
    }

    @Test
    @DisplayName("Nothing to review, no model call")
    void empty() {
        assertThat(service.review(List.of())).isEmpty();
        verifyNoInteractions(completion);
    }

    @Test
    @DisplayName("The body lists every section and marks blank ones")
    void body() {
        String body = ConsistencyReviewService.body(SECTIONS);

        assertThat(body).isEqualTo("## risk | Risk\nDenies SI. Denies SI.\n\n## plan | Plan\n(empty)");
    }

    @Test
    @DisplayName("Long bodies are cut")
    void bodyIsBounded() {
        String body = ConsistencyReviewService.body(List.of(new ReviewedSection("a", "A", "x".repeat(20_000))));

        assertThat(body).hasSize(ConsistencyReviewService.MAX_BODY_CHARS + 2).endsWith("\n…");
    }
}
