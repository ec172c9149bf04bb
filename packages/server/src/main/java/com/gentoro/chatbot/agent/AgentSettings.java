package com.gentoro.chatbot.agent;

import com.gentoro.chatbot.exception.ConfigException;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.apache.commons.configuration2.Configuration;

/**
 * Typed view over the {@code agent.*} configuration keys.
 *
 * <p>Durations accept ISO-8601 ({@code PT60M}) or a number with one of the units {@code ms},
 * {@code s}, {@code m}, {@code h}, {@code d} ({@code 60m}, {@code 30s}).
 */
public record AgentSettings(
    Duration ttl,
    boolean refreshEnabled,
    Duration refreshInterval,
    Duration createTimeout,
    Duration closeTimeout) {

  public static final Duration DEFAULT_TTL = Duration.ofMinutes(60);

  private static final Pattern SIMPLE_DURATION =
      Pattern.compile("^(\\d+)\\s*(ms|s|m|h|d)$", Pattern.CASE_INSENSITIVE);

  public static AgentSettings from(Configuration cfg) {
    Duration ttl = duration(cfg, "agent.cache.ttl", DEFAULT_TTL);
    boolean refreshEnabled = cfg.getBoolean("agent.cache.refresh-enabled", false);
    Duration refreshInterval = duration(cfg, "agent.cache.refresh-interval", ttl.dividedBy(2));
    Duration createTimeout =
        duration(cfg, "agent.cache.create-timeout", Agent.DEFAULT_CREATE_TIMEOUT);
    Duration closeTimeout = duration(cfg, "agent.close-timeout", Agent.DEFAULT_CLOSE_TIMEOUT);
    return new AgentSettings(ttl, refreshEnabled, refreshInterval, createTimeout, closeTimeout);
  }

  /** Applies the maintenance settings to {@code builder}. The TTL is passed when building. */
  public Agent.Builder applyTo(Agent.Builder builder) {
    return builder
        .refreshInterval(refreshEnabled ? refreshInterval : null)
        .createTimeout(createTimeout)
        .closeTimeout(closeTimeout);
  }

  /** Reads a positive duration, falling back to {@code defaultValue} when the key is absent. */
  public static Duration duration(Configuration cfg, String key, Duration defaultValue) {
    String raw = cfg.getString(key, null);
    Duration value = raw == null || raw.isBlank() ? defaultValue : parseDuration(key, raw);
    if (value.isZero() || value.isNegative()) {
      throw new ConfigException("%s must be a positive duration, got '%s'".formatted(key, raw));
    }
    return value;
  }

  static Duration parseDuration(String key, String raw) {
    String value = raw.trim();
    Matcher m = SIMPLE_DURATION.matcher(value);
    if (m.matches()) {
      long amount;
      try {
        amount = Long.parseLong(m.group(1));
      } catch (NumberFormatException e) {
        throw new ConfigException("Invalid duration for %s: '%s'".formatted(key, raw), e);
      }
      switch (m.group(2).toLowerCase(Locale.ROOT)) {
        case "ms":
          return Duration.ofMillis(amount);
        case "s":
          return Duration.ofSeconds(amount);
        case "m":
          return Duration.ofMinutes(amount);
        case "h":
          return Duration.ofHours(amount);
        default:
          return Duration.ofDays(amount);
      }
    }
    try {
      return Duration.parse(value.toUpperCase(Locale.ROOT));
    } catch (DateTimeParseException e) {
      throw new ConfigException("Invalid duration for %s: '%s'".formatted(key, raw), e);
    }
  }
}
