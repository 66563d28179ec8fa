package io.b2mash.updatescheduler.config;

import io.b2mash.updatescheduler.execution.DispatcherProperties;
import java.time.Clock;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
@EnableConfigurationProperties(DispatcherProperties.class)
public class SchedulingConfig {

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }

  /** Runs schedule executions; sized by {@code updatescheduler.dispatcher.parallelism}. */
  @Bean(name = "scheduleExecutionExecutor")
  public ThreadPoolTaskExecutor scheduleExecutionExecutor(DispatcherProperties properties) {
    int threads = Math.max(1, properties.parallelism());
    var executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(threads);
    executor.setMaxPoolSize(threads);
    executor.setQueueCapacity(500);
    executor.setThreadNamePrefix("schedule-exec-");
    executor.setWaitForTasksToCompleteOnShutdown(true);
    executor.setAwaitTerminationSeconds(30);
    return executor;
  }
}
