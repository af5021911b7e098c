package io.estatekeeper.backend.activity;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Configuration for the activity log.
 *
 * @param appendTimeout transaction timeout for a single append; a timed-out append is dropped
 * @param feed read-side settings
 */
@ConfigurationProperties(prefix = "activity")
public record ActivityProperties(
    @DefaultValue("5s") Duration appendTimeout, @DefaultValue Feed feed) {

  /** Append timeout in whole seconds, rounded up and never below one. */
  public int appendTimeoutSeconds() {
    return toTimeoutSeconds(appendTimeout);
  }

  /**
   * Transaction timeouts are whole seconds and zero means "expire immediately", so a sub-second
   * duration has to round up.
   */
  static int toTimeoutSeconds(Duration timeout) {
    long millis = timeout.toMillis();
    return Math.max(1, Math.toIntExact((millis + 999) / 1000));
  }

  /**
   * @param defaultLimit page size when the caller does not ask for one
   * @param maxLimit upper bound applied to any requested page size
   * @param queryTimeout transaction timeout for a single page read
   */
  public record Feed(
      @DefaultValue("25") int defaultLimit,
      @DefaultValue("100") int maxLimit,
      @DefaultValue("10s") Duration queryTimeout) {

    /** Query timeout in whole seconds, rounded up and never below one. */
    public int queryTimeoutSeconds() {
      return toTimeoutSeconds(queryTimeout);
    }

    /** Applies the default to a missing limit and clamps the result to {@code [1, maxLimit]}. */
    public int clampLimit(Integer requested) {
      int limit = requested != null ? requested : defaultLimit;
      return Math.max(1, Math.min(limit, maxLimit));
    }
  }
}
