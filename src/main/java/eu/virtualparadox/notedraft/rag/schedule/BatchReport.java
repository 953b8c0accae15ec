package eu.virtualparadox.notedraft.rag.schedule;

import eu.virtualparadox.notedraft.query.review.ReviewChange;
import eu.virtualparadox.notedraft.rag.generate.Citation;

import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Summary of a batch once every job has reached a terminal state.
 *
 * @param outcomes     one entry per job, in completion order
 * @param coverageGaps names of documents that no accepted section cites
 * @param review       consistency review proposals, empty when the review is off
 */
public record BatchReport(List<JobOutcome> outcomes, List<String> coverageGaps, List<ReviewChange> review) {

    public BatchReport {
        outcomes = List.copyOf(outcomes);
        coverageGaps = coverageGaps == null ? List.of() : List.copyOf(coverageGaps);
        review = review == null ? List.of() : List.copyOf(review);
    }

    public static BatchReport of(final List<JobOutcome> outcomes) {
        return new BatchReport(outcomes, List.of(), List.of());
    }

    public List<JobOutcome> byStatus(final EJobStatus status) {
        return outcomes.stream().filter(o -> o.status() == status).toList();
    }

    /**
     * Warnings for every job that did not complete.
     */
    public List<String> warnings() {
        return outcomes.stream()
                .filter(o -> o.status() != EJobStatus.COMPLETED && o.message() != null)
                .map(o -> o.targetId() + ": " + o.message())
                .toList();
    }

    /**
     * @param sourceNamesById every document of the batch, id to display name
     */
    public BatchReport withCoverage(final Map<String, String> sourceNamesById) {
        final Set<String> cited = new HashSet<>();
        for (JobOutcome outcome : outcomes) {
            if (outcome.status() == EJobStatus.COMPLETED && outcome.result() != null) {
                outcome.result().citations().stream().map(Citation::sourceId).forEach(cited::add);
            }
        }
        final List<String> gaps = sourceNamesById.entrySet().stream()
                .filter(e -> !cited.contains(e.getKey()))
                .map(Map.Entry::getValue)
                .sorted()
                .toList();
        return new BatchReport(outcomes, gaps, review);
    }

    public BatchReport withReview(final List<ReviewChange> changes) {
        return new BatchReport(outcomes, coverageGaps, changes);
    }
}
