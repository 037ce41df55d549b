package io.jobhive.core.notify;

import io.jobhive.job.error.InvalidRequestException;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Text form of per-channel resume positions: {@code jobs:41;schedules:7}.
 */
public final class SubscriptionCursor {

  private SubscriptionCursor() {
  }

  public static Map<String, Long> parse(String text) {
    Map<String, Long> positions = new TreeMap<>();
    if (text == null || text.isBlank()) {
      return positions;
    }
    for (String part : text.split(";")) {
      String entry = part.trim();
      if (entry.isEmpty()) {
        continue;
      }
      int colon = entry.lastIndexOf(':');
      if (colon <= 0 || colon == entry.length() - 1) {
        throw new InvalidRequestException("Malformed cursor entry '" + entry + "'");
      }
      String channel = entry.substring(0, colon);
      long sequence;
      try {
        sequence = Long.parseLong(entry.substring(colon + 1));
      } catch (NumberFormatException e) {
        throw new InvalidRequestException("Malformed cursor sequence in '" + entry + "'");
      }
      if (sequence < 0) {
        throw new InvalidRequestException("Cursor sequence must not be negative: '" + entry + "'");
      }
      positions.put(channel, sequence);
    }
    return positions;
  }

  public static String format(Map<String, Long> positions) {
    return new TreeMap<>(positions).entrySet().stream()
        .map(e -> e.getKey() + ":" + e.getValue())
        .collect(Collectors.joining(";"));
  }
}
