package com.flamingo.ai.scriptrag.config;

import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/** Thread pools for embedding sub-batches and asynchronous searches. */
@Configuration
public class AsyncConfig {

  @Bean(name = "embeddingBatchExecutor")
  public Executor embeddingBatchExecutor(ScriptragProperties properties) {
    int concurrency = Math.max(1, properties.getEmbedding().getMaxConcurrentBatches());
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(concurrency);
    executor.setMaxPoolSize(concurrency);
    executor.setQueueCapacity(100);
    executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
    executor.setThreadNamePrefix("embed-batch-");
    executor.initialize();
    return executor;
  }

  @Bean(name = "searchExecutor")
  public Executor searchExecutor() {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(2);
    executor.setMaxPoolSize(8);
    executor.setQueueCapacity(50);
    executor.setThreadNamePrefix("search-");
    executor.initialize();
    return executor;
  }
}
