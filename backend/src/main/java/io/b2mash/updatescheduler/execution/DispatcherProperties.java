package io.b2mash.updatescheduler.execution;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Dispatcher settings.
 *
 * @param enabled whether the periodic tick is registered at all
 * @param pollInterval fixed rate of the tick; the first tick runs at start-up
 * @param executionTimeout how long a tick waits for one execution before moving on
 * @param parallelism executions that may run at the same time
 */
@ConfigurationProperties(prefix = "updatescheduler.dispatcher")
public record DispatcherProperties(
    @DefaultValue("true") boolean enabled,
    @DefaultValue("PT5M") Duration pollInterval,
    @DefaultValue("PT2M") Duration executionTimeout,
    @DefaultValue("1") int parallelism) {}
