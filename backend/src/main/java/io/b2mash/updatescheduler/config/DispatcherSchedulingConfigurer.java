package io.b2mash.updatescheduler.config;

import io.b2mash.updatescheduler.execution.DispatcherProperties;
import io.b2mash.updatescheduler.execution.ScheduleDispatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.SchedulingConfigurer;
import org.springframework.scheduling.config.ScheduledTaskRegistrar;

/**
 * Registers the dispatcher tick at the configured fixed rate. The first tick runs immediately at
 * start-up. Nothing is registered when {@code updatescheduler.dispatcher.enabled} is false.
 */
@Configuration
public class DispatcherSchedulingConfigurer implements SchedulingConfigurer {

  private static final Logger log = LoggerFactory.getLogger(DispatcherSchedulingConfigurer.class);

  private final ScheduleDispatcher dispatcher;
  private final DispatcherProperties properties;

  public DispatcherSchedulingConfigurer(
      ScheduleDispatcher dispatcher, DispatcherProperties properties) {
    this.dispatcher = dispatcher;
    this.properties = properties;
  }

  @Override
  public void configureTasks(ScheduledTaskRegistrar taskRegistrar) {
    if (!properties.enabled()) {
      log.info("Schedule dispatcher disabled");
      return;
    }
    taskRegistrar.addFixedRateTask(dispatcher::tick, properties.pollInterval());
    log.info("Schedule dispatcher registered, polling every {}", properties.pollInterval());
  }
}
