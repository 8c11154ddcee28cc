package io.b2mash.usagereport.config;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

@Configuration
@EnableConfigurationProperties(UsageReportProperties.class)
public class PipelineConfig {

  /**
   * Pool for per-member enrichment and the quota load. Its size caps the number of concurrent
   * directory and accounting queries.
   */
  @Bean(destroyMethod = "shutdownNow")
  ExecutorService reportWorkerPool(UsageReportProperties properties) {
    return Executors.newFixedThreadPool(
        properties.workerThreads(), new CustomizableThreadFactory("report-worker-"));
  }

  @Bean
  Clock reportClock() {
    return Clock.systemUTC();
  }
}
