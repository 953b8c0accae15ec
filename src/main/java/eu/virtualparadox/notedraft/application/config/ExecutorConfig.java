package eu.virtualparadox.notedraft.application.config;

import eu.virtualparadox.notedraft.application.executor.GenerationExecutor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ExecutorConfig {

    @Bean
    public GenerationExecutor generationExecutor(final ApplicationConfig config) {
        final int workers = Math.max(1, config.getScheduler().getMaxWorkers());
        GenerationExecutor executor = new GenerationExecutor();
        executor.setCorePoolSize(workers);
        executor.setMaxPoolSize(workers);       // the scheduler never asks for more
        executor.setQueueCapacity(Integer.MAX_VALUE);
        executor.setThreadNamePrefix("generate-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(60);
        executor.initialize();
        return executor;
    }
}
