package eu.virtualparadox.notedraft.query;

import eu.virtualparadox.notedraft.application.config.ApplicationConfig;
import eu.virtualparadox.notedraft.ingest.episode.EpisodeClusterer;
import eu.virtualparadox.notedraft.ingest.model.Chunk;
import eu.virtualparadox.notedraft.ingest.model.SourceDocument;
import eu.virtualparadox.notedraft.query.edit.EUnmatchedPolicy;
import eu.virtualparadox.notedraft.query.edit.EditReconciler;
import eu.virtualparadox.notedraft.query.edit.ReconciliationResult;
import eu.virtualparadox.notedraft.query.question.OpenQuestion;
import eu.virtualparadox.notedraft.query.question.OpenQuestionAnswerService;
import eu.virtualparadox.notedraft.query.question.OpenQuestionExtractor;
import eu.virtualparadox.notedraft.query.question.OpenQuestionLedger;
import eu.virtualparadox.notedraft.query.question.QuestionAnswer;
import eu.virtualparadox.notedraft.query.review.ConsistencyReviewService;
import eu.virtualparadox.notedraft.query.review.ReviewChange;
import eu.virtualparadox.notedraft.query.review.ReviewedSection;
import eu.virtualparadox.notedraft.rag.completion.ModelCallException;
import eu.virtualparadox.notedraft.rag.completion.UsageSnapshot;
import eu.virtualparadox.notedraft.rag.completion.UsageTracker;
import eu.virtualparadox.notedraft.rag.generate.GenerationOptions;
import eu.virtualparadox.notedraft.rag.generate.SectionSpec;
import eu.virtualparadox.notedraft.rag.rank.EvidenceReordering;
import eu.virtualparadox.notedraft.rag.rank.EvidenceSelector;
import eu.virtualparadox.notedraft.rag.rank.RankOptions;
import eu.virtualparadox.notedraft.rag.schedule.BatchReport;
import eu.virtualparadox.notedraft.rag.schedule.EJobStatus;
import eu.virtualparadox.notedraft.rag.schedule.GenerationJob;
import eu.virtualparadox.notedraft.rag.schedule.GenerationScheduler;
import eu.virtualparadox.notedraft.rag.schedule.JobOutcome;
import eu.virtualparadox.notedraft.rag.schedule.SectionDraft;
import eu.virtualparadox.notedraft.rag.schedule.SectionResultStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Entry point of the drafting core: selects evidence per section, runs generation
 * batches and keeps the open-question ledger and section drafts up to date.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class NoteDraftService {

    static final String UPDATE_GUIDANCE =
            "Summarize only what is new in the update documents. Do not restate what the section already says.";

    private final EvidenceSelector evidenceSelector;
    private final GenerationScheduler scheduler;
    private final SectionResultStore store;
    private final OpenQuestionLedger ledger;
    private final OpenQuestionExtractor questionExtractor;
    private final OpenQuestionAnswerService answerService;
    private final ConsistencyReviewService reviewService;
    private final EditReconciler editReconciler;
    private final EpisodeClusterer episodeClusterer;
    private final UsageTracker usageTracker;
    private final ApplicationConfig config;
    private final Clock clock;

    /**
     * Drafts every section from scratch and waits for the whole batch.
     */
    public BatchReport generateAll(final List<SectionSpec> sections, final List<SourceDocument> documents) {
        final List<Chunk> pool = chunksOf(documents);
        final List<GenerationJob> jobs = new ArrayList<>();
        for (SectionSpec section : sections) {
            final List<Chunk> evidence = EvidenceReordering.bySourceCoverage(selectEvidence(section, pool));
            jobs.add(GenerationJob.full(section, evidence, options(pool, null, null)));
        }
        return afterBatch(sections, documents, scheduler.runAll(jobs));
    }

    /**
     * Adds an update note to every section the new documents have something to say about.
     * Sections whose evidence holds no chunk of an update document are skipped.
     *
     * @param updateDocumentIds documents added since the last full draft
     * @param label             prefix of the appended note, e.g. "Update 03/2024"
     */
    public BatchReport reviseForUpdates(final List<SectionSpec> sections,
                                        final List<SourceDocument> documents,
                                        final Collection<String> updateDocumentIds,
                                        final String label) {
        final List<Chunk> pool = chunksOf(documents);
        final Set<String> updates = new HashSet<>(updateDocumentIds);
        final List<GenerationJob> jobs = new ArrayList<>();
        for (SectionSpec section : sections) {
            final List<Chunk> evidence = EvidenceReordering.byPrioritySources(
                    EvidenceReordering.bySourceCoverage(selectEvidence(section, pool)), updates);
            if (evidence.stream().noneMatch(c -> updates.contains(c.sourceId()))) {
                log.debug("Section {} has no evidence from update documents, skipping", section.id());
                continue;
            }
            final String current = store.get(section.id())
                    .map(SectionDraft::text)
                    .map(questionExtractor::stripBlock)
                    .orElse(null);
            jobs.add(GenerationJob.update(section, evidence, options(pool, current, UPDATE_GUIDANCE), label));
        }
        log.info("Revising {} of {} sections for {} update documents", jobs.size(), sections.size(), updates.size());
        return afterBatch(sections, documents, scheduler.runAll(jobs));
    }

    /**
     * Starts drafting one section in the background. A draft already running for the same
     * section is cancelled and its result discarded.
     */
    public GenerationJob generateSection(final SectionSpec section, final List<SourceDocument> documents) {
        final List<Chunk> pool = chunksOf(documents);
        final List<Chunk> evidence = EvidenceReordering.bySourceCoverage(selectEvidence(section, pool));
        return scheduler.submit(GenerationJob.full(section, evidence, options(pool, otherSections(section.id()), null)));
    }

    public boolean cancel(final String sectionId) {
        return scheduler.cancel(sectionId);
    }

    public void cancelAll() {
        scheduler.cancelAll();
    }

    /**
     * Replaces {@code target} in the section with {@code replacement}. Citations are kept.
     */
    public ReconciliationResult applyEdit(final String sectionId,
                                          final String target,
                                          final String replacement,
                                          final EUnmatchedPolicy policy) {
        final SectionDraft draft = store.get(sectionId)
                .orElseThrow(() -> new IllegalArgumentException("No draft for section " + sectionId));
        final ReconciliationResult result = editReconciler.reconcile(draft.text(), target, replacement, policy);
        if (result.changed()) {
            store.put(sectionId, result.text(), draft.citations());
            log.info("Section {} edited ({})", sectionId, result.outcome());
        }
        return result;
    }

    /**
     * Applies a review proposal the user accepted.
     */
    public void acceptReviewChange(final ReviewChange change) {
        store.put(change.sectionId(), change.revisedText(),
                store.get(change.sectionId()).map(SectionDraft::citations).orElse(List.of()));
        log.info("Accepted review change for {}: {}", change.sectionId(), change.issue());
    }

    /**
     * Tries to answer every open question from the documents.
     *
     * @return the questions that received an answer
     */
    public List<OpenQuestion> answerOpenQuestions(final List<SourceDocument> documents) {
        final List<OpenQuestion> open = ledger.open();
        if (open.isEmpty()) {
            return List.of();
        }
        final String query = open.stream().map(OpenQuestion::getText).collect(Collectors.joining(" "));
        final List<Chunk> evidence = evidenceSelector.select(query, chunksOf(documents),
                evidenceSelector.defaultLimit(), RankOptions.coverAllSources());

        final List<QuestionAnswer> answers = answerService.answer(open, evidence);
        final Set<String> openIds = open.stream().map(OpenQuestion::getId).collect(Collectors.toSet());
        final List<OpenQuestion> answered = new ArrayList<>();
        for (QuestionAnswer answer : answers) {
            if (!openIds.remove(answer.questionId())) {
                continue;
            }
            answered.add(ledger.update(answer.questionId(),
                    q -> q.isOpen() ? q.answer(answer.text(), answer.citations(), clock.instant()) : q));
        }
        log.info("Answered {} of {} open questions", answered.size(), open.size());
        return answered;
    }

    public List<OpenQuestion> openQuestions() {
        return ledger.all();
    }

    public List<SourceDocument> indexEpisodes(final List<SourceDocument> documents) {
        return episodeClusterer.cluster(documents);
    }

    public Map<String, SectionDraft> drafts() {
        return store.snapshot();
    }

    public UsageSnapshot usage() {
        return usageTracker.snapshot();
    }

    private BatchReport afterBatch(final List<SectionSpec> sections,
                                   final List<SourceDocument> documents,
                                   final BatchReport batch) {
        final Map<String, String> sourceNames = new LinkedHashMap<>();
        documents.forEach(d -> sourceNames.put(d.id(), d.name()));
        BatchReport report = batch.withCoverage(sourceNames);
        if (!report.coverageGaps().isEmpty()) {
            log.info("Documents without citations: {}", report.coverageGaps());
        }

        if (config.getGeneration().isOpenQuestions()) {
            for (JobOutcome outcome : report.byStatus(EJobStatus.COMPLETED)) {
                store.get(outcome.targetId()).ifPresent(d -> ledger.refresh(d.sectionId(), d.text()));
            }
        }
        if (config.getGeneration().isReviewAfterBatch() && !report.byStatus(EJobStatus.COMPLETED).isEmpty()) {
            report = report.withReview(review(sections));
        }
        return report;
    }

    private List<ReviewChange> review(final List<SectionSpec> sections) {
        final List<ReviewedSection> drafted = new ArrayList<>();
        for (SectionSpec section : sections) {
            store.get(section.id())
                    .filter(d -> !d.text().isBlank())
                    .ifPresent(d -> drafted.add(new ReviewedSection(section.id(), section.title(), d.text())));
        }
        try {
            return reviewService.review(drafted);
        }
        catch (ModelCallException e) {
            log.warn("Consistency review failed: {}", e.getMessage());
            return List.of();
        }
    }

    private List<Chunk> selectEvidence(final SectionSpec section, final List<Chunk> pool) {
        final RankOptions options = new RankOptions(config.getRanking().isIncludeUnmatchedSources(),
                isHistorySection(section));
        return evidenceSelector.select(section.rankingQuery(), pool, evidenceSelector.defaultLimit(), options);
    }

    private GenerationOptions options(final List<Chunk> pool, final String context, final String extraGuidance) {
        return GenerationOptions.builder()
                .liveDisplay(config.getGeneration().isLiveDisplay())
                .context(context)
                .evidencePool(pool)
                .evidenceLimit(evidenceSelector.defaultLimit())
                .openQuestions(config.getGeneration().isOpenQuestions())
                .extraGuidance(extraGuidance)
                .build();
    }

    private String otherSections(final String sectionId) {
        return store.snapshot().values().stream()
                .filter(d -> !d.sectionId().equals(sectionId) && !d.text().isBlank())
                .map(d -> d.sectionId() + ": " + questionExtractor.stripBlock(d.text()))
                .collect(Collectors.joining("\n\n"));
    }

    private static boolean isHistorySection(final SectionSpec section) {
        return section.rankingQuery().toLowerCase(Locale.ROOT).contains("history");
    }

    private static List<Chunk> chunksOf(final List<SourceDocument> documents) {
        return documents.stream().flatMap(d -> d.chunks().stream()).toList();
    }
}
