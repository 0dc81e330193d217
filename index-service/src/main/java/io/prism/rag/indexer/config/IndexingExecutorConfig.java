package io.prism.rag.indexer.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Duration;
import java.util.concurrent.Executor;

/**
 * Executor running asynchronous indexing jobs.
 *
 * <p>Writes for one document are serialized by {@code IndexManager}; this pool only bounds how
 * many different documents are indexed in parallel.</p>
 */
@Configuration
@EnableConfigurationProperties({
        IndexingExecutorConfig.IndexingExecutorProperties.class,
        IndexingExecutorConfig.IndexingJobProperties.class
})
public class IndexingExecutorConfig {

    @Bean(name = "indexingExecutor")
    public Executor indexingExecutor(IndexingExecutorProperties props) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(props.getCoreSize());
        executor.setMaxPoolSize(props.getMaxSize());
        executor.setQueueCapacity(props.getQueueCapacity());
        executor.setThreadNamePrefix("indexing-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(props.getAwaitTerminationSeconds());
        executor.initialize();
        return executor;
    }

    /**
     * Bound from {@code prism.index.executor.*} in {@code application.yml}.
     */
    @Data
    @ConfigurationProperties(prefix = "prism.index.executor")
    public static class IndexingExecutorProperties {

        private int coreSize = 2;

        private int maxSize = 4;

        /** Queued jobs beyond this are rejected. */
        private int queueCapacity = 200;

        private int awaitTerminationSeconds = 60;
    }

    /**
     * Bound from {@code prism.index.jobs.*}. Running jobs are always kept; finished ones are
     * dropped once older than {@code retention} or beyond the newest {@code maxFinished}.
     */
    @Data
    @ConfigurationProperties(prefix = "prism.index.jobs")
    public static class IndexingJobProperties {

        private Duration retention = Duration.ofHours(1);

        private int maxFinished = 1000;
    }
}
