package eu.virtualparadox.notedraft.application.executor;

import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Worker pool running section generation jobs. Typed so it can be injected
 * without qualifiers next to other executors.
 */
public class GenerationExecutor extends ThreadPoolTaskExecutor {
}
