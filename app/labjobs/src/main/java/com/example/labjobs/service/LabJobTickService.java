/*
 * Where: Lab jobs service layer
 * What: One tick of the engine: materialize, pick due instances, send reminders
 * Why: A single entry point the host scheduler can call repeatedly without overlapping runs
 */
package com.example.labjobs.service;

import com.example.common.TraceIds;
import com.example.labjobs.config.LabJobsSchedulerProperties;
import jakarta.annotation.PreDestroy;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class LabJobTickService {

  private static final Logger logger = LoggerFactory.getLogger(LabJobTickService.class);

  private final JobMaterializer materializer;
  private final ReminderCadenceEngine cadenceEngine;
  private final ReminderNotificationTracker notificationTracker;
  private final LabJobsSchedulerProperties properties;
  private final LabJobMetrics metrics;
  private final Clock clock;
  private final ReentrantLock tickLock = new ReentrantLock();
  private final AtomicBoolean stopped = new AtomicBoolean(false);

  /**
   * Runs one tick. Failures are logged and counted here and never reach the scheduler; a call
   * that arrives while another tick is still running returns without doing anything.
   */
  public TickOutcome tick() {
    if (stopped.get()) {
      return TickOutcome.stop();
    }
    if (!tickLock.tryLock()) {
      logger.debug("labjobs tick skipped because the previous tick is still running");
      return TickOutcome.runAgainAfter(properties.pollInterval());
    }
    final Instant startedAt = Instant.now(clock);
    MDC.put(TraceIds.MDC_KEY, TraceIds.newTraceId());
    try {
      runTick(startedAt);
    } catch (RuntimeException ex) {
      metrics.recordTickFailure();
      logger.error("labjobs tick failed", ex);
    } finally {
      metrics.recordTickDuration(Duration.between(startedAt, Instant.now(clock)));
      MDC.remove(TraceIds.MDC_KEY);
      tickLock.unlock();
    }
    return stopped.get() ? TickOutcome.stop() : TickOutcome.runAgainAfter(properties.pollInterval());
  }

  @PreDestroy
  public void shutdown() {
    stopped.set(true);
    logger.info("labjobs tick service stopped");
  }

  private void runTick(Instant now) {
    final List<Long> created = materializer.materialize(now);
    final List<Long> due = cadenceEngine.selectDue(now, created);
    final int sent = due.isEmpty() ? 0 : notificationTracker.sendReminders(due, now);
    if (!created.isEmpty() || sent > 0) {
      logger.info(
          "labjobs tick finished created={} due={} sent={}", created.size(), due.size(), sent);
    }
  }
}
