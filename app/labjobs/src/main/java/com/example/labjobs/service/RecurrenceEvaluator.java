/*
 * Where: Lab jobs service layer
 * What: Evaluates RFC 5545 recurrence rules against a reference date
 * Why: The materializer only needs "is today an occurrence", answered as "next occurrence on or after today"
 */
package com.example.labjobs.service;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import net.fortuna.ical4j.model.Recur;
import org.springframework.stereotype.Component;

/**
 * Pure recurrence evaluation.
 *
 * <p>A rule is either a bare RRULE value ({@code FREQ=WEEKLY;BYDAY=MO}), an {@code RRULE:} line,
 * or a {@code DTSTART} line followed by an {@code RRULE} line. Without a DTSTART the rule is
 * anchored on the reference date itself.
 */
@Component
public class RecurrenceEvaluator {

  private static final String DTSTART = "DTSTART";
  private static final String RRULE_PREFIX = "RRULE:";
  private static final int SEARCH_HORIZON_YEARS = 10;

  public Optional<LocalDate> nextOccurrence(String rule, LocalDate reference) {
    final ParsedRule parsed = parse(rule);
    final LocalDate seed = parsed.anchor() == null ? reference : parsed.anchor();
    LocalDate windowStart = reference;
    for (int year = 0; year < SEARCH_HORIZON_YEARS; year++) {
      // period bounds are inclusive, so consecutive windows do not overlap
      final LocalDate windowEnd = windowStart.plusYears(1);
      final List<LocalDate> dates;
      try {
        dates = parsed.recur().getDates(seed, windowStart, windowEnd);
      } catch (RuntimeException ex) {
        throw new RecurrenceRuleException(rule, ex);
      }
      final Optional<LocalDate> first =
          dates.stream().filter(date -> !date.isBefore(reference)).min(LocalDate::compareTo);
      if (first.isPresent()) {
        return first;
      }
      windowStart = windowEnd.plusDays(1);
    }
    return Optional.empty();
  }

  /** Parses without evaluating; used to reject a bad rule at edit time. */
  public void validate(String rule) {
    parse(rule);
  }

  private ParsedRule parse(String rule) {
    if (rule == null || rule.isBlank()) {
      throw new RecurrenceRuleException(String.valueOf(rule), "empty rule");
    }
    LocalDate anchor = null;
    String rrule = null;
    for (String rawLine : rule.strip().split("\\R")) {
      final String line = rawLine.strip();
      if (line.isEmpty()) {
        continue;
      }
      final String upper = line.toUpperCase(Locale.ROOT);
      if (upper.startsWith(DTSTART)) {
        anchor = parseAnchor(rule, line);
      } else if (upper.startsWith(RRULE_PREFIX)) {
        rrule = line.substring(RRULE_PREFIX.length());
      } else {
        rrule = line;
      }
    }
    if (rrule == null) {
      throw new RecurrenceRuleException(rule, "missing RRULE");
    }
    return new ParsedRule(toRecur(rule, rrule), anchor);
  }

  // Recur reports bad input as ParseException, IllegalArgumentException or DateTimeException
  // depending on which part is wrong
  private Recur<LocalDate> toRecur(String rule, String rrule) {
    try {
      return new Recur<>(rrule);
    } catch (Exception ex) {
      throw new RecurrenceRuleException(rule, ex);
    }
  }

  // DTSTART;VALUE=DATE:20260105 or DTSTART:20260105T090000; only the calendar date matters
  private LocalDate parseAnchor(String rule, String line) {
    final int colon = line.indexOf(':');
    final String value = colon < 0 ? "" : line.substring(colon + 1).strip();
    if (value.length() < 8) {
      throw new RecurrenceRuleException(rule, "malformed DTSTART");
    }
    try {
      return LocalDate.parse(value.substring(0, 8), DateTimeFormatter.BASIC_ISO_DATE);
    } catch (DateTimeParseException ex) {
      throw new RecurrenceRuleException(rule, ex);
    }
  }

  private record ParsedRule(Recur<LocalDate> recur, LocalDate anchor) {}
}
