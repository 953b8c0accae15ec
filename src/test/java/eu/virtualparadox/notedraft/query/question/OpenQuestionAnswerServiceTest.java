package eu.virtualparadox.notedraft.query.question;

import eu.virtualparadox.notedraft.application.config.ApplicationConfig;
import eu.virtualparadox.notedraft.ingest.model.Chunk;
import eu.virtualparadox.notedraft.ingest.model.EDocumentType;
import eu.virtualparadox.notedraft.rag.completion.CompletionRequest;
import eu.virtualparadox.notedraft.rag.completion.CompletionService;
import eu.virtualparadox.notedraft.rag.generate.CitationMapper;
import eu.virtualparadox.notedraft.rag.generate.ModelPayloadParser;
import eu.virtualparadox.notedraft.rag.generate.PromptBuilder;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class OpenQuestionAnswerServiceTest {

    private static final List<Chunk> EVIDENCE = List.of(
            new Chunk("intake_chunk_0", "intake", "intake.pdf", "Naps twice daily for an hour.", 0, 29,
                    EDocumentType.INTAKE, null, 1.0));

    private CompletionService completion;
    private OpenQuestionAnswerService service;

    @BeforeEach
    void setUp() {
        ApplicationConfig config = new ApplicationConfig();
        completion = mock(CompletionService.class);
        service = new OpenQuestionAnswerService(completion, new PromptBuilder(config), new ModelPayloadParser(),
                new CitationMapper(), config);
    }

    private static OpenQuestion question(String id, String text) {
        return OpenQuestion.builder().id(id).sectionId("sleep").key(id).text(text)
                .status(EOpenQuestionStatus.OPEN).createdAt(Instant.EPOCH).updatedAt(Instant.EPOCH).build();
    }

    @Test
    @DisplayName("Only cited, substantive answers are returned")
    void filtersAnswers() {
        when(completion.complete(any())).thenReturn("""
                {"answers": [
                  {"id": "q1", "text": "Naps twice daily.", "citations": [{"chunkId": "intake_chunk_0", "excerpt": "Naps twice daily"}]},
                  {"id": "q2", "text": "Insufficient evidence.", "citations": []},
                  {"id": "q3", "text": "Probably not.", "citations": ["unknown_chunk_9"]}
                ]}""");

        List<QuestionAnswer> answers = service.answer(
                List.of(question("q1", "Any naps?"), question("q2", "Caffeine?"), question("q3", "Alcohol?")), EVIDENCE);

        assertThat(answers).singleElement().satisfies(a -> {
            assertThat(a.questionId()).isEqualTo("q1");
            assertThat(a.citations()).extracting(c -> c.chunkId()).containsExactly("intake_chunk_0");
        });

        ArgumentCaptor<CompletionRequest> captor = ArgumentCaptor.forClass(CompletionRequest.class);
        verify(completion).complete(captor.capture());
        assertThat(captor.getValue().input()).contains("(q1) Any naps?").contains("[intake_chunk_0]");
        assertThat(captor.getValue().responseSchema()).isEqualTo(OpenQuestionAnswerService.ANSWERS_SCHEMA);
    }

    @Test
    @DisplayName("A payload without answers yields nothing")
    void noAnswers() {
        when(completion.complete(any())).thenReturn("I cannot help with that.");

        assertThat(service.answer(List.of(question("q1", "Any naps?")), EVIDENCE)).isEmpty();
    }

    @Test
    @DisplayName("No questions, no model call")
    void noQuestions() {
        assertThat(service.answer(List.of(), EVIDENCE)).isEmpty();
        verifyNoInteractions(completion);
    }
}
