package io.calx.engine;

import io.calx.engine.memory.MemoryConfig;
import io.calx.engine.simplify.RuleFamily;
import java.io.IOException;
import java.io.InputStream;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Properties;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Configuration of a {@link CalxSession}. Loads from the {@code calx.properties} classpath
 * resource, overridden by {@code calx.*} system properties.
 *
 * @param maxRewritePasses pass budget of a simplification
 * @param simplificationCacheSize entries kept by the simplifier's LRU cache, 0 disables it
 * @param enabledFamilies rule families the simplifier applies
 * @param allowComplexResults whether evaluation may leave the real line, e.g. for {@code sqrt(-1)}
 * @param memory pool settings
 */
public record EngineConfig(
    int maxRewritePasses,
    int simplificationCacheSize,
    Set<RuleFamily> enabledFamilies,
    boolean allowComplexResults,
    MemoryConfig memory) {

  public static final String RESOURCE = "calx.properties";
  static final String PREFIX = "calx.";

  public EngineConfig {
    Objects.requireNonNull(enabledFamilies, "enabledFamilies");
    Objects.requireNonNull(memory, "memory");
    if (maxRewritePasses < 1) {
      throw new IllegalArgumentException("maxRewritePasses must be >= 1: " + maxRewritePasses);
    }
    if (simplificationCacheSize < 0) {
      throw new IllegalArgumentException(
          "simplificationCacheSize must be >= 0: " + simplificationCacheSize);
    }
    enabledFamilies =
        enabledFamilies.isEmpty()
            ? Collections.emptySet()
            : Collections.unmodifiableSet(EnumSet.copyOf(enabledFamilies));
  }

  /**
   * Creates the default configuration: 64 passes, 1024 cached results, every rule family, real
   * results only.
   *
   * @return default configuration
   */
  public static EngineConfig defaults() {
    return new EngineConfig(64, 1024, RuleFamily.all(), false, MemoryConfig.defaults());
  }

  /**
   * Loads {@value #RESOURCE} from the classpath, if present, and applies {@code calx.*} system
   * properties on top.
   *
   * @return loaded configuration, or defaults if nothing is configured
   * @throws IOException if the resource exists but cannot be read
   */
  public static EngineConfig load() throws IOException {
    Properties props = new Properties();
    ClassLoader loader = EngineConfig.class.getClassLoader();
    try (InputStream in = loader.getResourceAsStream(RESOURCE)) {
      if (in != null) {
        props.load(in);
      }
    }
    for (String name : System.getProperties().stringPropertyNames()) {
      if (name.startsWith(PREFIX)) {
        props.setProperty(name, System.getProperty(name));
      }
    }
    return fromProperties(props);
  }

  /**
   * Converts properties to a configuration object; missing keys keep their default.
   *
   * @param props properties to convert
   * @return configuration object
   */
  public static EngineConfig fromProperties(Properties props) {
    EngineConfig d = defaults();
    int maxPasses =
        Integer.parseInt(
            props.getProperty(PREFIX + "rewrite.maxPasses", String.valueOf(d.maxRewritePasses)));
    int cacheSize =
        Integer.parseInt(
            props.getProperty(
                PREFIX + "rewrite.cacheSize", String.valueOf(d.simplificationCacheSize)));
    Set<RuleFamily> families = RuleFamily.parse(props.getProperty(PREFIX + "rewrite.families"));
    boolean allowComplex =
        Boolean.parseBoolean(
            props.getProperty(
                PREFIX + "evaluate.allowComplex", String.valueOf(d.allowComplexResults)));
    return new EngineConfig(
        maxPasses, cacheSize, families, allowComplex, MemoryConfig.fromProperties(props));
  }

  public Properties toProperties() {
    Properties props = memory.toProperties();
    props.setProperty(PREFIX + "rewrite.maxPasses", String.valueOf(maxRewritePasses));
    props.setProperty(PREFIX + "rewrite.cacheSize", String.valueOf(simplificationCacheSize));
    props.setProperty(
        PREFIX + "rewrite.families",
        enabledFamilies.isEmpty()
            ? RuleFamily.NONE
            : enabledFamilies.stream().map(RuleFamily::name).collect(Collectors.joining(",")));
    props.setProperty(PREFIX + "evaluate.allowComplex", String.valueOf(allowComplexResults));
    return props;
  }

  public EngineConfig withMaxRewritePasses(int passes) {
    return new EngineConfig(
        passes, simplificationCacheSize, enabledFamilies, allowComplexResults, memory);
  }

  public EngineConfig withFamilies(Set<RuleFamily> families) {
    return new EngineConfig(
        maxRewritePasses, simplificationCacheSize, families, allowComplexResults, memory);
  }

  public EngineConfig withMemory(MemoryConfig memoryConfig) {
    return new EngineConfig(
        maxRewritePasses, simplificationCacheSize, enabledFamilies, allowComplexResults,
        memoryConfig);
  }
}
