package io.calx.engine.memory;

import java.time.Duration;
import java.util.Objects;
import java.util.Properties;

/**
 * Settings of the expression pool.
 *
 * @param enableSharing whether structurally equal expressions resolve to one pooled node
 * @param maxPoolSize entries beyond this are not pooled (construction still succeeds)
 * @param internCapacity number of variables the builder keeps interned
 * @param cleanupThresholdBytes estimated footprint that triggers an automatic cleanup
 * @param cleanupInterval time after which statistics collection triggers an automatic cleanup
 */
public record MemoryConfig(
    boolean enableSharing,
    int maxPoolSize,
    int internCapacity,
    long cleanupThresholdBytes,
    Duration cleanupInterval) {

  static final String PREFIX = "calx.memory.";

  public MemoryConfig {
    Objects.requireNonNull(cleanupInterval, "cleanupInterval");
    if (maxPoolSize < 0) {
      throw new IllegalArgumentException("maxPoolSize must be >= 0: " + maxPoolSize);
    }
    if (internCapacity < 0) {
      throw new IllegalArgumentException("internCapacity must be >= 0: " + internCapacity);
    }
    if (cleanupThresholdBytes <= 0) {
      throw new IllegalArgumentException(
          "cleanupThresholdBytes must be > 0: " + cleanupThresholdBytes);
    }
    if (cleanupInterval.isNegative()) {
      throw new IllegalArgumentException("cleanupInterval must not be negative");
    }
  }

  /**
   * Creates the default configuration.
   *
   * @return default configuration
   */
  public static MemoryConfig defaults() {
    return new MemoryConfig(
        true,
        10_000,
        5_000,
        100L * 1024 * 1024, // 100 MB
        Duration.ofSeconds(60));
  }

  /**
   * Reads {@code calx.memory.*} keys; missing keys keep their default.
   *
   * @param props properties to read
   * @return configuration object
   */
  public static MemoryConfig fromProperties(Properties props) {
    MemoryConfig d = defaults();
    boolean enableSharing =
        Boolean.parseBoolean(
            props.getProperty(PREFIX + "enableSharing", String.valueOf(d.enableSharing)));
    int maxPoolSize =
        Integer.parseInt(props.getProperty(PREFIX + "maxPoolSize", String.valueOf(d.maxPoolSize)));
    int internCapacity =
        Integer.parseInt(
            props.getProperty(PREFIX + "internCapacity", String.valueOf(d.internCapacity)));
    long cleanupThresholdBytes =
        Long.parseLong(
            props.getProperty(
                PREFIX + "cleanupThresholdBytes", String.valueOf(d.cleanupThresholdBytes)));
    long cleanupIntervalSeconds =
        Long.parseLong(
            props.getProperty(
                PREFIX + "cleanupIntervalSeconds", String.valueOf(d.cleanupInterval.getSeconds())));
    return new MemoryConfig(
        enableSharing,
        maxPoolSize,
        internCapacity,
        cleanupThresholdBytes,
        Duration.ofSeconds(cleanupIntervalSeconds));
  }

  public Properties toProperties() {
    Properties props = new Properties();
    props.setProperty(PREFIX + "enableSharing", String.valueOf(enableSharing));
    props.setProperty(PREFIX + "maxPoolSize", String.valueOf(maxPoolSize));
    props.setProperty(PREFIX + "internCapacity", String.valueOf(internCapacity));
    props.setProperty(PREFIX + "cleanupThresholdBytes", String.valueOf(cleanupThresholdBytes));
    props.setProperty(PREFIX + "cleanupIntervalSeconds", String.valueOf(cleanupInterval.getSeconds()));
    return props;
  }

  public MemoryConfig withSharing(boolean enabled) {
    return new MemoryConfig(
        enabled, maxPoolSize, internCapacity, cleanupThresholdBytes, cleanupInterval);
  }

  public MemoryConfig withMaxPoolSize(int size) {
    return new MemoryConfig(
        enableSharing, size, internCapacity, cleanupThresholdBytes, cleanupInterval);
  }

  public MemoryConfig withCleanupInterval(Duration interval) {
    return new MemoryConfig(
        enableSharing, maxPoolSize, internCapacity, cleanupThresholdBytes, interval);
  }
}
