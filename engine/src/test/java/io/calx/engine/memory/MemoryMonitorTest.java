package io.calx.engine.memory;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

import java.time.Duration;
import java.util.Optional;
import java.util.function.LongSupplier;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class MemoryMonitorTest {
  private static final MemoryStats STATS = new MemoryStats(3, 1, 4, 10, 5, 0, 512, 0);

  @Mock MemoryManager manager;
  @Mock LongSupplier clock;

  @Test
  void testCheckWaitsForInterval() {
    when(clock.getAsLong())
        .thenReturn(0L, Duration.ofSeconds(10).toNanos(), Duration.ofSeconds(31).toNanos());
    when(manager.getStats()).thenReturn(STATS);
    MemoryMonitor monitor = new MemoryMonitor(manager, clock);

    assertEquals(Optional.empty(), monitor.check());
    assertEquals(Optional.of(STATS), monitor.check());
    verify(manager, times(1)).getStats();
  }

  @Test
  void testIntervalRestartsAfterReport() {
    when(clock.getAsLong()).thenReturn(0L, 100L, 150L, 200L);
    when(manager.getStats()).thenReturn(STATS);
    MemoryMonitor monitor = new MemoryMonitor(manager, clock);
    monitor.setInterval(Duration.ofNanos(100));

    assertTrue(monitor.check().isPresent());
    assertFalse(monitor.check().isPresent());
    assertTrue(monitor.check().isPresent());
  }

  @Test
  void testDisabledMonitorReportsNothing() {
    when(clock.getAsLong()).thenReturn(0L);
    MemoryMonitor monitor = new MemoryMonitor(manager, clock);
    monitor.setInterval(Duration.ZERO);
    monitor.disable();

    assertFalse(monitor.isEnabled());
    assertEquals(Optional.empty(), monitor.check());
    verifyNoInteractions(manager);

    monitor.enable();
    when(manager.getStats()).thenReturn(STATS);
    assertEquals(Optional.of(STATS), monitor.check());
  }

  @Test
  void testStatsAndCleanupDelegate() {
    when(clock.getAsLong()).thenReturn(0L);
    when(manager.getStats()).thenReturn(STATS);
    when(manager.cleanup()).thenReturn(7);
    MemoryMonitor monitor = new MemoryMonitor(manager, clock);

    assertSame(STATS, monitor.stats());
    assertEquals(7, monitor.cleanup());
  }

  @Test
  void testRejectsNegativeInterval() {
    when(clock.getAsLong()).thenReturn(0L);
    MemoryMonitor monitor = new MemoryMonitor(manager, clock);
    assertEquals(MemoryMonitor.DEFAULT_INTERVAL, monitor.interval());
    assertThrows(IllegalArgumentException.class, () -> monitor.setInterval(Duration.ofSeconds(-1)));
  }
}
