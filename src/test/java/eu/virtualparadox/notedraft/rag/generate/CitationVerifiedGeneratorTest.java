package eu.virtualparadox.notedraft.rag.generate;

import eu.virtualparadox.notedraft.application.config.ApplicationConfig;
import eu.virtualparadox.notedraft.ingest.model.Chunk;
import eu.virtualparadox.notedraft.rag.completion.CompletionRequest;
import eu.virtualparadox.notedraft.rag.completion.CompletionService;
import eu.virtualparadox.notedraft.rag.completion.ModelCallException;
import eu.virtualparadox.notedraft.rag.rank.DiversityLexicalRanker;
import eu.virtualparadox.notedraft.rag.rank.EvidenceSelector;
import eu.virtualparadox.notedraft.rag.rank.WeightedLexicalRanker;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import reactor.core.publisher.Flux;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CancellationException;

import static eu.virtualparadox.notedraft.rag.generate.GenerationFixtures.chunk;
import static eu.virtualparadox.notedraft.rag.generate.GenerationFixtures.evidence;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class CitationVerifiedGeneratorTest {

    private static final SectionSpec SECTION = new SectionSpec("sleep", "Sleep", "Describe sleep pattern and insomnia.");

    private CompletionService completion;
    private CitationVerifiedGenerator generator;
    private final List<GenerationEvent> events = new ArrayList<>();
    private GenerationContext context;

    @BeforeEach
    void setUp() {
        ApplicationConfig config = new ApplicationConfig();
        completion = mock(CompletionService.class);
        EvidenceSelector selector = new EvidenceSelector(new WeightedLexicalRanker(), new DiversityLexicalRanker(),
                Optional.empty(), config);
        generator = new CitationVerifiedGenerator(completion, new PromptBuilder(config), new ModelPayloadParser(),
                new CitationMapper(), new InlineCitationScanner(), selector);
        context = new GenerationContext(SECTION.id(), new CancellationToken(), events::add);
    }

    // ---------- Helpers ----------

    private static GenerationOptions nonStreaming() {
        return GenerationOptions.defaults();
    }

    private static String payload(String text, String... chunkIds) {
        StringBuilder citations = new StringBuilder();
        for (String id : chunkIds) {
            if (citations.length() > 0) {
                citations.append(',');
            }
            citations.append("{\"chunkId\":\"").append(id).append("\",\"excerpt\":\"\"}");
        }
        return "{\"text\":\"" + text + "\",\"citations\":[" + citations + "]}";
    }

    private List<EGenerationState> states() {
        return events.stream()
                .filter(e -> e.type() == GenerationEvent.EGenerationEventType.STATE)
                .map(GenerationEvent::state)
                .toList();
    }

    private List<CompletionRequest> completeRequests(int times) {
        ArgumentCaptor<CompletionRequest> captor = ArgumentCaptor.forClass(CompletionRequest.class);
        verify(completion, times(times)).complete(captor.capture());
        return captor.getAllValues();
    }

    // ---------- Tests ----------

    @Test
    @DisplayName("A cited answer is accepted as is")
    void acceptedDirectly() {
        when(completion.complete(any())).thenReturn(payload("Sleeps four hours.", "intake_chunk_0"));

        GenerationResult result = generator.generate(SECTION, evidence(), nonStreaming(), context);

        assertThat(result.text()).isEqualTo("Sleeps four hours.");
        assertThat(result.repairStep()).isEqualTo(ERepairStep.NONE);
        assertThat(result.citations()).extracting(Citation::chunkId).containsExactly("intake_chunk_0");
        assertThat(states()).containsExactly(EGenerationState.IDLE, EGenerationState.REQUESTING,
                EGenerationState.VALIDATING, EGenerationState.ACCEPTED);
        assertThat(events.get(events.size() - 1).result()).isEqualTo(result);
    }

    @Test
    @DisplayName("Empty citations without inline markers go to the recovery call, not to rejection")
    void recoveryCallAfterInlineScan() {
        when(completion.complete(any())).thenReturn(
                "{\"text\":\"Patient reports insomnia.\",\"citations\":[]}",
                "{\"citations\":[{\"chunkId\":\"intake_chunk_0\",\"excerpt\":\"insomnia for three weeks\"}]}");

        GenerationResult result = generator.generate(SECTION, evidence(), nonStreaming(), context);

        assertThat(result.text()).isEqualTo("Patient reports insomnia.");
        assertThat(result.repairStep()).isEqualTo(ERepairStep.RECOVERY_CALL);
        assertThat(result.citations()).extracting(Citation::excerpt).containsExactly("insomnia for three weeks");

        List<CompletionRequest> requests = completeRequests(2);
        assertThat(requests.get(1).responseSchema()).isEqualTo(PromptBuilder.CITATIONS_SCHEMA);
        assertThat(requests.get(1).input()).contains("Patient reports insomnia.");
        assertThat(states()).contains(EGenerationState.REPAIRING);
    }

    @Test
    @DisplayName("Inline chunk markers are turned into citations and stripped from the text")
    void inlineMarkers() {
        when(completion.complete(any())).thenReturn(payload("Sleeps four hours [intake_chunk_0]."));

        GenerationResult result = generator.generate(SECTION, evidence(), nonStreaming(), context);

        assertThat(result.text()).isEqualTo("Sleeps four hours.");
        assertThat(result.repairStep()).isEqualTo(ERepairStep.INLINE_MARKERS);
        verify(completion, times(1)).complete(any());
    }

    @Test
    @DisplayName("Citations outside the evidence are dropped and trigger the repair ladder")
    void unknownCitationsDropped() {
        when(completion.complete(any())).thenReturn(
                payload("Sleeps well.", "other_chunk_3"),
                "{\"citations\":[\"discharge_chunk_0\"]}");

        GenerationResult result = generator.generate(SECTION, evidence(), nonStreaming(), context);

        assertThat(result.citations()).extracting(Citation::chunkId).containsExactly("discharge_chunk_0");
        assertThat(result.repairStep()).isEqualTo(ERepairStep.RECOVERY_CALL);
    }

    @Test
    @DisplayName("Strict regeneration follows a failed recovery")
    void strictRetry() {
        when(completion.complete(any())).thenReturn(
                payload("Sleeps poorly."),
                "{\"citations\":[]}",
                payload("Sleeps about four hours.", "intake_chunk_0"));

        GenerationResult result = generator.generate(SECTION, evidence(), nonStreaming(), context);

        assertThat(result.repairStep()).isEqualTo(ERepairStep.STRICT_RETRY);
        assertThat(result.text()).isEqualTo("Sleeps about four hours.");
        assertThat(completeRequests(3).get(2).instructions()).contains("Uncited claims are not allowed");
    }

    @Test
    @DisplayName("Widened evidence draws further chunks from the pool")
    void widenedEvidence() {
        Chunk extra = chunk("followup", 0, "Sleep improved with trazodone, insomnia resolved.");
        List<Chunk> pool = new ArrayList<>(evidence());
        pool.add(extra);
        GenerationOptions options = GenerationOptions.builder().evidencePool(pool).evidenceLimit(2).build();
        List<Chunk> narrow = evidence().subList(0, 2);

        when(completion.complete(any())).thenReturn(
                payload("Insomnia resolved."),
                "{\"citations\":[]}",
                payload("Insomnia resolved."),
                payload("Insomnia resolved on trazodone.", "followup_chunk_0"));

        GenerationResult result = generator.generate(SECTION, narrow, options, context);

        assertThat(result.repairStep()).isEqualTo(ERepairStep.WIDENED_EVIDENCE);
        assertThat(result.citations()).extracting(Citation::sourceId).containsExactly("followup");

        CompletionRequest widened = completeRequests(4).get(3);
        assertThat(widened.input()).contains("[followup_chunk_0]").contains("[intake_chunk_0]");
        assertThat(widened.instructions()).contains("leave it out");
    }

    @Test
    @DisplayName("Exhausted repairs reject the section")
    void rejected() {
        when(completion.complete(any())).thenReturn(payload("Uncited prose."));

        assertThatThrownBy(() -> generator.generate(SECTION, evidence(), nonStreaming(), context))
                .isInstanceOf(GenerationRejectedException.class)
                .satisfies(e -> assertThat(((GenerationRejectedException) e).getTargetId()).isEqualTo("sleep"));

        verify(completion, times(4)).complete(any());
        assertThat(states()).endsWith(EGenerationState.REJECTED);
    }

    @Test
    @DisplayName("Empty text is never accepted")
    void emptyText() {
        when(completion.complete(any())).thenReturn(payload("", "intake_chunk_0"));

        assertThatThrownBy(() -> generator.generate(SECTION, evidence(), nonStreaming(), context))
                .isInstanceOf(GenerationRejectedException.class);
        // no text means nothing to recover: initial, strict, widened
        verify(completion, times(3)).complete(any());
    }

    @Test
    @DisplayName("When the transport fails on every attempt, the transport error surfaces")
    void transportFailure() {
        when(completion.complete(any())).thenThrow(new ModelCallException("connection refused"));

        assertThatThrownBy(() -> generator.generate(SECTION, evidence(), nonStreaming(), context))
                .isInstanceOf(ModelCallException.class)
                .hasMessageContaining("connection refused");
    }

    @Test
    @DisplayName("A transport failure followed by a good answer is repaired")
    void transportThenSuccess() {
        when(completion.complete(any()))
                .thenThrow(new ModelCallException("timeout"))
                .thenReturn(payload("Sleeps four hours.", "intake_chunk_0"));

        GenerationResult result = generator.generate(SECTION, evidence(), nonStreaming(), context);

        assertThat(result.repairStep()).isEqualTo(ERepairStep.STRICT_RETRY);
    }

    @Test
    @DisplayName("Streaming publishes partial text before the result")
    void streaming() {
        when(completion.stream(any())).thenReturn(Flux.just(
                "{\"text\":\"Sleeps ", "four hours.\",", "\"citations\":[\"intake_chunk_0\"]}"));
        GenerationOptions options = GenerationOptions.builder().liveDisplay(true).build();

        GenerationResult result = generator.generate(SECTION, evidence(), options, context);

        assertThat(result.text()).isEqualTo("Sleeps four hours.");
        assertThat(events).filteredOn(e -> e.type() == GenerationEvent.EGenerationEventType.PARTIAL_TEXT)
                .extracting(GenerationEvent::partialText)
                .containsExactly("Sleeps ", "Sleeps four hours.");
        assertThat(states()).containsSubsequence(EGenerationState.REQUESTING, EGenerationState.STREAMING_PARTIAL,
                EGenerationState.VALIDATING, EGenerationState.ACCEPTED);
        verify(completion, never()).complete(any());
    }

    @Test
    @DisplayName("An unparseable stream is retried once without streaming")
    void malformedStreamFallsBack() {
        when(completion.stream(any())).thenReturn(Flux.just("Sorry, ", "something went wrong"));
        when(completion.complete(any())).thenReturn(payload("Sleeps four hours.", "intake_chunk_0"));
        GenerationOptions options = GenerationOptions.builder().liveDisplay(true).build();

        GenerationResult result = generator.generate(SECTION, evidence(), options, context);

        assertThat(result.repairStep()).isEqualTo(ERepairStep.NONE);
        assertThat(completeRequests(1).get(0).stream()).isFalse();
    }

    @Test
    @DisplayName("A cancelled token stops the generation")
    void cancelled() {
        context.token().cancel();

        assertThatThrownBy(() -> generator.generate(SECTION, evidence(), nonStreaming(), context))
                .isInstanceOf(CancellationException.class);
        verifyNoInteractions(completion);
    }

    @Test
    @DisplayName("Cancelling during a stream aborts it")
    void cancelledWhileStreaming() {
        when(completion.stream(any())).thenReturn(Flux.just("{\"text\":\"Sle", "eps")
                .doOnNext(delta -> context.token().cancel())
                .concatWith(Flux.never()));
        GenerationOptions options = GenerationOptions.builder().liveDisplay(true).build();

        assertThatThrownBy(() -> generator.generate(SECTION, evidence(), options, context))
                .isInstanceOf(CancellationException.class);
    }
}
