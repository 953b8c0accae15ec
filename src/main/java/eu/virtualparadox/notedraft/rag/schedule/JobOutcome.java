package eu.virtualparadox.notedraft.rag.schedule;

import eu.virtualparadox.notedraft.rag.generate.GenerationResult;

/**
 * Terminal state of a job inside a batch.
 *
 * @param result  accepted result, only for {@link EJobStatus#COMPLETED}
 * @param message warning shown to the user for the other outcomes
 */
public record JobOutcome(String targetId, EJobKind kind, EJobStatus status, GenerationResult result, String message) {
}
