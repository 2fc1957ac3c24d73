/*
 * Where: Lab jobs scheduler adapter
 * What: Registers the tick with Spring's scheduler and replays each TickOutcome as the next trigger
 * Why: The tick decides its own delay and when to stop; the scheduler only follows that answer
 */
package com.example.labjobs.worker;

import com.example.labjobs.service.LabJobTickService;
import com.example.labjobs.service.TickOutcome;
import com.google.common.annotations.VisibleForTesting;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.TriggerContext;
import org.springframework.scheduling.annotation.SchedulingConfigurer;
import org.springframework.scheduling.config.ScheduledTaskRegistrar;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(
    name = "labjobs.scheduler.enabled",
    havingValue = "true",
    matchIfMissing = true)
public class LabJobTickWorker implements SchedulingConfigurer {

  private static final Logger logger = LoggerFactory.getLogger(LabJobTickWorker.class);

  private final LabJobTickService tickService;
  private final AtomicReference<TickOutcome> lastOutcome =
      new AtomicReference<>(TickOutcome.runAgainAfter(Duration.ZERO));

  public LabJobTickWorker(LabJobTickService tickService) {
    this.tickService = tickService;
  }

  @Override
  public void configureTasks(ScheduledTaskRegistrar taskRegistrar) {
    taskRegistrar.addTriggerTask(this::run, this::nextExecution);
  }

  @VisibleForTesting
  void run() {
    final TickOutcome outcome = tickService.tick();
    lastOutcome.set(outcome);
    if (outcome.isStop()) {
      logger.info("labjobs tick worker received stop; no further runs scheduled");
    }
  }

  /** First run right away; afterwards last completion plus the delay the tick asked for. */
  @VisibleForTesting
  Instant nextExecution(TriggerContext triggerContext) {
    final TickOutcome outcome = lastOutcome.get();
    if (outcome.isStop()) {
      return null;
    }
    final Instant lastCompletion = triggerContext.lastCompletion();
    if (lastCompletion == null) {
      return triggerContext.getClock().instant();
    }
    return lastCompletion.plus(outcome.delay().orElse(Duration.ZERO));
  }
}
