package io.jobhive.beat.domain;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.scheduling.support.CronExpression;

/**
 * When a schedule is due.
 */
public interface Trigger {

  /**
   * Latest tick {@code t} with {@code after < t <= now}. Earlier missed ticks are coalesced into it.
   */
  Optional<Instant> latestDueTick(Instant after, Instant now);

  /**
   * Parses a trigger expression.
   *
   * @param anchor start of the interval grid for {@code every} triggers
   * @throws IllegalArgumentException when the expression is not understood
   */
  static Trigger parse(String expression, Instant anchor) {
    if (expression == null || expression.isBlank()) {
      throw new IllegalArgumentException("Trigger expression is empty");
    }
    String trimmed = expression.trim();
    Matcher every = IntervalTrigger.PATTERN.matcher(trimmed.toLowerCase(Locale.ROOT));
    if (every.matches()) {
      try {
        long amount = Long.parseLong(every.group(1));
        Duration period = switch (every.group(2)) {
          case "s" -> Duration.ofSeconds(amount);
          case "m" -> Duration.ofMinutes(amount);
          default -> Duration.ofHours(amount);
        };
        return new IntervalTrigger(period, anchor);
      } catch (NumberFormatException | ArithmeticException e) {
        throw new IllegalArgumentException("Interval '" + trimmed + "' is out of range", e);
      }
    }
    if (trimmed.toLowerCase(Locale.ROOT).startsWith("every")) {
      throw new IllegalArgumentException("Unsupported interval '" + trimmed + "'; expected every <n>s|m|h");
    }
    return new CronTrigger(trimmed);
  }

  /**
   * Fixed period anchored at a start instant.
   */
  record IntervalTrigger(Duration period, Instant anchor) implements Trigger {

    static final Pattern PATTERN = Pattern.compile("^every\\s+(\\d+)\\s*([smh])$");

    public IntervalTrigger {
      if (period.isZero() || period.isNegative()) {
        throw new IllegalArgumentException("Interval must be positive");
      }
      // tick arithmetic is done in millis
      period.toMillis();
    }

    @Override
    public Optional<Instant> latestDueTick(Instant after, Instant now) {
      if (!now.isAfter(anchor)) {
        return Optional.empty();
      }
      long periods = Duration.between(anchor, now).toMillis() / period.toMillis();
      if (periods < 1) {
        return Optional.empty();
      }
      Instant tick = anchor.plusMillis(periods * period.toMillis());
      return tick.isAfter(after) ? Optional.of(tick) : Optional.empty();
    }
  }

  /**
   * Six-field Spring cron expression evaluated in UTC.
   */
  final class CronTrigger implements Trigger {

    // search windows, widest last; each scan stays short even for per-second expressions
    private static final List<Duration> LOOKBACK = List.of(
        Duration.ofMinutes(1), Duration.ofHours(1), Duration.ofDays(1), Duration.ofDays(32), Duration.ofDays(366));

    private final String expression;
    private final CronExpression cron;

    CronTrigger(String expression) {
      this.expression = expression;
      this.cron = CronExpression.parse(expression);
    }

    public String expression() {
      return expression;
    }

    @Override
    public Optional<Instant> latestDueTick(Instant after, Instant now) {
      if (!now.isAfter(after)) {
        return Optional.empty();
      }
      for (Duration window : LOOKBACK) {
        Instant start = now.minus(window);
        boolean reachesAfter = !start.isAfter(after);
        Optional<Instant> latest = scan(reachesAfter ? after : start, now);
        if (latest.isPresent() || reachesAfter) {
          return latest;
        }
      }
      return scan(after, now);
    }

    private Optional<Instant> scan(Instant from, Instant now) {
      ZonedDateTime cursor = from.atZone(ZoneOffset.UTC);
      Instant latest = null;
      while (true) {
        ZonedDateTime next = cron.next(cursor);
        if (next == null || next.toInstant().isAfter(now)) {
          return Optional.ofNullable(latest);
        }
        latest = next.toInstant();
        cursor = next;
      }
    }
  }
}
