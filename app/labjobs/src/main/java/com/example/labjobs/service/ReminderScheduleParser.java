/*
 * Where: Lab jobs service layer
 * What: Parses the "threshold=interval; ..." reminder notation into escalation steps
 * Why: Schedules are edited as short text such as "0s=1d; 2d=12h; 4d=4h; 1w=1h"
 */
package com.example.labjobs.service;

import com.example.labjobs.model.ReminderStep;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import org.springframework.stereotype.Component;

@Component
public class ReminderScheduleParser {

  // longest units first so "ms" is not read as "m"
  private static final Pattern DURATION_PART =
      Pattern.compile("(\\d+)\\s*(ms|s|m|h|d|w)", Pattern.CASE_INSENSITIVE);

  public List<ReminderStep> parse(String text) {
    if (text == null || text.isBlank()) {
      return List.of();
    }
    final List<ReminderStep> steps = new ArrayList<>();
    final Set<Duration> thresholds = new HashSet<>();
    for (String entry : text.split(";")) {
      if (entry.isBlank()) {
        continue;
      }
      final String[] sides = entry.split("=");
      if (sides.length != 2) {
        throw new ReminderScheduleFormatException(
            "reminder entry must look like <threshold>=<interval>: '" + entry.strip() + "'");
      }
      final Duration threshold = parseDuration(sides[0]);
      final Duration interval = parseDuration(sides[1]);
      if (interval.isZero()) {
        throw new ReminderScheduleFormatException(
            "reminder interval must be positive: '" + entry.strip() + "'");
      }
      if (!thresholds.add(threshold)) {
        throw new ReminderScheduleFormatException(
            "duplicate reminder threshold: " + format(threshold));
      }
      steps.add(new ReminderStep(threshold, interval));
    }
    steps.sort((left, right) -> left.threshold().compareTo(right.threshold()));
    return List.copyOf(steps);
  }

  public String format(List<ReminderStep> steps) {
    return steps.stream()
        .map(step -> format(step.threshold()) + "=" + format(step.interval()))
        .collect(Collectors.joining("; "));
  }

  Duration parseDuration(String raw) {
    final String value = raw.strip().toLowerCase(Locale.ROOT);
    if (value.isEmpty()) {
      throw new ReminderScheduleFormatException("empty duration");
    }
    final Matcher matcher = DURATION_PART.matcher(value);
    Duration total = Duration.ZERO;
    int position = 0;
    try {
      while (matcher.find()) {
        if (!value.substring(position, matcher.start()).isBlank()) {
          throw new ReminderScheduleFormatException("malformed duration: '" + raw.strip() + "'");
        }
        total = total.plus(unit(Long.parseLong(matcher.group(1)), matcher.group(2)));
        position = matcher.end();
      }
      // steps are stored as milliseconds
      total.toMillis();
    } catch (NumberFormatException | ArithmeticException ex) {
      throw new ReminderScheduleFormatException("duration out of range: '" + raw.strip() + "'", ex);
    }
    if (position == 0 || !value.substring(position).isBlank()) {
      throw new ReminderScheduleFormatException("malformed duration: '" + raw.strip() + "'");
    }
    return total;
  }

  private Duration unit(long amount, String unit) {
    return switch (unit) {
      case "ms" -> Duration.ofMillis(amount);
      case "s" -> Duration.ofSeconds(amount);
      case "m" -> Duration.ofMinutes(amount);
      case "h" -> Duration.ofHours(amount);
      case "d" -> Duration.ofDays(amount);
      case "w" -> Duration.ofDays(Math.multiplyExact(amount, 7L));
      default -> throw new ReminderScheduleFormatException("unknown duration unit: " + unit);
    };
  }

  private String format(Duration duration) {
    final long millis = duration.toMillis();
    if (millis == 0) {
      return "0s";
    }
    if (millis % Duration.ofDays(7).toMillis() == 0) {
      return (millis / Duration.ofDays(7).toMillis()) + "w";
    }
    if (millis % Duration.ofDays(1).toMillis() == 0) {
      return duration.toDays() + "d";
    }
    if (millis % Duration.ofHours(1).toMillis() == 0) {
      return duration.toHours() + "h";
    }
    if (millis % Duration.ofMinutes(1).toMillis() == 0) {
      return duration.toMinutes() + "m";
    }
    if (millis % 1000 == 0) {
      return duration.toSeconds() + "s";
    }
    return millis + "ms";
  }
}
