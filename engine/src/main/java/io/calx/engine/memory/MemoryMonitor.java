package io.calx.engine.memory;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.function.LongSupplier;

/**
 * Polling facade over a {@link MemoryManager} for monitoring callers.
 *
 * <p>{@link #check()} returns fresh statistics at most once per interval; callers drive it from
 * their own timer. The monitor never schedules work itself.
 */
public final class MemoryMonitor {
  public static final Duration DEFAULT_INTERVAL = Duration.ofSeconds(30);

  private final MemoryManager manager;
  private final LongSupplier clock;
  private Duration interval = DEFAULT_INTERVAL;
  private boolean enabled = true;
  private long lastCheck;

  public MemoryMonitor(MemoryManager manager) {
    this(manager, System::nanoTime);
  }

  MemoryMonitor(MemoryManager manager, LongSupplier clock) {
    this.manager = Objects.requireNonNull(manager, "manager");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.lastCheck = clock.getAsLong();
  }

  public void enable() {
    enabled = true;
  }

  public void disable() {
    enabled = false;
  }

  public boolean isEnabled() {
    return enabled;
  }

  public void setInterval(Duration interval) {
    if (interval.isNegative()) {
      throw new IllegalArgumentException("Interval must not be negative: " + interval);
    }
    this.interval = interval;
  }

  public Duration interval() {
    return interval;
  }

  /**
   * @return statistics when the monitor is enabled and the interval has elapsed since the last
   *     reported check, empty otherwise
   */
  public Optional<MemoryStats> check() {
    if (!enabled) {
      return Optional.empty();
    }
    long now = clock.getAsLong();
    if (now - lastCheck < interval.toNanos()) {
      return Optional.empty();
    }
    lastCheck = now;
    return Optional.of(manager.getStats());
  }

  public MemoryStats stats() {
    return manager.getStats();
  }

  public int cleanup() {
    return manager.cleanup();
  }
}
