package dev.shortlist.config;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

/**
 * Provides the bounded worker pool that runs semantic scoring and the reranker's relevance model
 * calls. Shut down with the application context.
 */
@Configuration
public class RetrievalExecutorConfig {

  @Bean(destroyMethod = "shutdownNow")
  public ExecutorService retrievalExecutor(
      @Value("${shortlist.retrieval.worker-threads:4}") int workerThreads) {
    if (workerThreads < 1) {
      throw new IllegalStateException(
          "shortlist.retrieval.worker-threads must be at least 1, got: " + workerThreads);
    }
    return Executors.newFixedThreadPool(workerThreads, new CustomizableThreadFactory("retrieval-"));
  }
}
