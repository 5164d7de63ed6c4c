package com.flamingo.ai.researchcache.config;

import java.util.concurrent.Executor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Executor for collection pipelines. Different collections may run side by side; operations on a
 * single collection are serialized by the pipeline service itself.
 */
@Configuration
@EnableAsync
public class AsyncConfig {

  @Bean(name = "collectionPipelineExecutor")
  public Executor collectionPipelineExecutor(ResearchCacheProperties properties) {
    ResearchCacheProperties.Pipeline pipeline = properties.getPipeline();
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(pipeline.getCorePoolSize());
    executor.setMaxPoolSize(pipeline.getMaxPoolSize());
    executor.setQueueCapacity(pipeline.getQueueCapacity());
    executor.setThreadNamePrefix("collection-pipeline-");
    executor.initialize();
    return executor;
  }
}
