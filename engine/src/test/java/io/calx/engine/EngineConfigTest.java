package io.calx.engine;

import static org.junit.jupiter.api.Assertions.*;

import io.calx.engine.memory.MemoryConfig;
import io.calx.engine.simplify.RuleFamily;
import java.time.Duration;
import java.util.EnumSet;
import java.util.Properties;
import java.util.Set;
import org.junit.jupiter.api.Test;

class EngineConfigTest {

  @Test
  void testDefaults() {
    EngineConfig config = EngineConfig.defaults();
    assertEquals(64, config.maxRewritePasses());
    assertEquals(1024, config.simplificationCacheSize());
    assertEquals(RuleFamily.all(), config.enabledFamilies());
    assertFalse(config.allowComplexResults());
    assertEquals(MemoryConfig.defaults(), config.memory());

    MemoryConfig memory = config.memory();
    assertTrue(memory.enableSharing());
    assertEquals(10_000, memory.maxPoolSize());
    assertEquals(5_000, memory.internCapacity());
    assertEquals(100L * 1024 * 1024, memory.cleanupThresholdBytes());
    assertEquals(Duration.ofSeconds(60), memory.cleanupInterval());
  }

  @Test
  void testFromPropertiesKeepsDefaultsForMissingKeys() {
    Properties props = new Properties();
    props.setProperty("calx.rewrite.maxPasses", "16");
    props.setProperty("calx.rewrite.families", "identity, radical");
    props.setProperty("calx.memory.enableSharing", "false");
    props.setProperty("calx.memory.cleanupIntervalSeconds", "5");

    EngineConfig config = EngineConfig.fromProperties(props);
    assertEquals(16, config.maxRewritePasses());
    assertEquals(1024, config.simplificationCacheSize());
    assertEquals(EnumSet.of(RuleFamily.IDENTITY, RuleFamily.RADICAL), config.enabledFamilies());
    assertFalse(config.memory().enableSharing());
    assertEquals(Duration.ofSeconds(5), config.memory().cleanupInterval());
    assertEquals(10_000, config.memory().maxPoolSize());
  }

  @Test
  void testPropertiesRoundTrip() {
    EngineConfig config =
        EngineConfig.defaults()
            .withMaxRewritePasses(10)
            .withFamilies(EnumSet.of(RuleFamily.PYTHAGOREAN))
            .withMemory(MemoryConfig.defaults().withMaxPoolSize(7));
    assertEquals(config, EngineConfig.fromProperties(config.toProperties()));

    EngineConfig none = EngineConfig.defaults().withFamilies(Set.of());
    assertEquals("NONE", none.toProperties().getProperty("calx.rewrite.families"));
    assertEquals(none, EngineConfig.fromProperties(none.toProperties()));
  }

  @Test
  void testFamilyParsing() {
    assertEquals(RuleFamily.all(), RuleFamily.parse(""));
    assertEquals(RuleFamily.all(), RuleFamily.parse(null));
    assertTrue(RuleFamily.parse("none").isEmpty());
    assertEquals(
        EnumSet.of(RuleFamily.SPECIAL_ANGLE, RuleFamily.PERIODICITY),
        RuleFamily.parse("Special_Angle,,periodicity"));
    assertThrows(IllegalArgumentException.class, () -> RuleFamily.parse("identity,calculus"));
  }

  @Test
  void testInvalidValuesAreRejected() {
    EngineConfig d = EngineConfig.defaults();
    assertThrows(IllegalArgumentException.class, () -> d.withMaxRewritePasses(0));
    assertThrows(
        IllegalArgumentException.class,
        () -> new EngineConfig(8, -1, RuleFamily.all(), false, d.memory()));
    assertThrows(NullPointerException.class, () -> d.withFamilies(null));
    assertThrows(NullPointerException.class, () -> d.withMemory(null));
    assertThrows(IllegalArgumentException.class, () -> d.memory().withMaxPoolSize(-1));
    assertThrows(
        IllegalArgumentException.class,
        () -> d.memory().withCleanupInterval(Duration.ofSeconds(-1)));

    Properties props = new Properties();
    props.setProperty("calx.rewrite.cacheSize", "lots");
    assertThrows(NumberFormatException.class, () -> EngineConfig.fromProperties(props));
  }

  @Test
  void testEnabledFamiliesAreImmutable() {
    Set<RuleFamily> families = EnumSet.of(RuleFamily.IDENTITY);
    EngineConfig config = EngineConfig.defaults().withFamilies(families);
    families.add(RuleFamily.RADICAL);
    assertEquals(Set.of(RuleFamily.IDENTITY), config.enabledFamilies());
    assertThrows(
        UnsupportedOperationException.class,
        () -> config.enabledFamilies().add(RuleFamily.INDUCTION));
  }

  @Test
  void testLoadAppliesSystemProperties() throws Exception {
    assertEquals(EngineConfig.defaults(), EngineConfig.load());

    System.setProperty("calx.rewrite.maxPasses", "12");
    try {
      assertEquals(12, EngineConfig.load().maxRewritePasses());
    } finally {
      System.clearProperty("calx.rewrite.maxPasses");
    }
  }
}
