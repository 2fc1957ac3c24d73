/*
 * Where: Lab jobs service layer
 * What: Creates today's open job instances from templates whose recurrence falls on today
 * Why: Instance insert and watermark advance must land together so a day is never materialized twice
 */
package com.example.labjobs.service;

import com.example.labjobs.config.LabJobsSchedulerProperties;
import com.example.labjobs.model.JobTemplateRecord;
import com.example.labjobs.repository.JobInstanceRepository;
import com.example.labjobs.repository.JobTemplateRepository;
import com.google.common.annotations.VisibleForTesting;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

@Service
@RequiredArgsConstructor
public class JobMaterializer {

  private static final Logger logger = LoggerFactory.getLogger(JobMaterializer.class);

  private final JobTemplateRepository templateRepository;
  private final JobInstanceRepository instanceRepository;
  private final RecurrenceEvaluator recurrenceEvaluator;
  private final LabJobsSchedulerProperties properties;
  private final LabJobMetrics metrics;
  private final PlatformTransactionManager transactionManager;

  /**
   * Materializes today's instances.
   *
   * @return ids of the instances created by this call, in template order
   * @throws DataAccessException when the store fails; the current template's transaction is rolled back
   */
  public List<Long> materialize(Instant now) {
    final ZonedDateTime localNow = now.atZone(properties.zone());
    if (localNow.getHour() < properties.materializeAfterHour()) {
      return List.of();
    }
    final LocalDate today = localNow.toLocalDate();
    final List<JobTemplateRecord> candidates = templateRepository.findWithWatermarkBefore(today);
    final List<Long> created = new ArrayList<>();
    for (JobTemplateRecord template : candidates) {
      if (!template.hasAssignee()) {
        logger.debug("job template skipped without assignee templateId={}", template.templateId());
        continue;
      }
      try {
        materializeTemplate(template, today, now).ifPresent(created::add);
      } catch (DataAccessException ex) {
        throw ex;
      } catch (LabJobConfigurationException ex) {
        metrics.recordConfigurationError("recurrence");
        logger.warn(
            "job template skipped because of invalid configuration templateId={} name={}",
            template.templateId(),
            template.name(),
            ex);
      } catch (RuntimeException ex) {
        logger.error(
            "job template materialization failed templateId={} name={}",
            template.templateId(),
            template.name(),
            ex);
      }
    }
    return created;
  }

  @VisibleForTesting
  Optional<Long> materializeTemplate(JobTemplateRecord template, LocalDate today, Instant now) {
    final Optional<LocalDate> next = recurrenceEvaluator.nextOccurrence(template.recurrence(), today);
    logger.debug(
        "job template next occurrence templateId={} next={} watermark={}",
        template.templateId(),
        next.orElse(null),
        template.lastGeneratedOn());
    if (next.isEmpty() || !next.get().equals(today)) {
      return Optional.empty();
    }
    final TransactionTemplate transactionTemplate = new TransactionTemplate(transactionManager);
    final Long instanceId =
        transactionTemplate.execute(
            status -> {
              final long id =
                  instanceRepository.insert(
                      template.templateId(),
                      template.name(),
                      now,
                      now,
                      template.reminderScheduleId(),
                      template.assignee());
              // guarded update: zero rows means another tick already materialized today
              if (templateRepository.advanceWatermark(template.templateId(), today) == 0) {
                status.setRollbackOnly();
                return null;
              }
              return id;
            });
    if (instanceId == null) {
      logger.info(
          "job template already materialized today templateId={} today={}",
          template.templateId(),
          today);
      return Optional.empty();
    }
    metrics.recordMaterialized();
    logger.info(
        "job instance materialized templateId={} instanceId={} assignee={} today={}",
        template.templateId(),
        instanceId,
        template.assignee(),
        today);
    return Optional.of(instanceId);
  }
}
