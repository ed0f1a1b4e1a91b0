package io.calx.engine.simplify;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;
import java.util.function.Supplier;

/** Rule families in the order the engine tries them at each node. */
public enum RuleFamily {
  IDENTITY(IdentityRules::new),
  INDUCTION(InductionRules::new),
  SPECIAL_ANGLE(SpecialAngleRules::new),
  PYTHAGOREAN(PythagoreanRules::new),
  PERIODICITY(PeriodicityRules::new),
  RADICAL(RadicalRules::new);

  /** Property value for an empty family set. */
  public static final String NONE = "NONE";

  private final Supplier<RewriteRule> factory;

  RuleFamily(Supplier<RewriteRule> factory) {
    this.factory = factory;
  }

  RewriteRule newRule() {
    return factory.get();
  }

  public static Set<RuleFamily> all() {
    return EnumSet.allOf(RuleFamily.class);
  }

  /**
   * Parses a comma separated list of family names, case-insensitive. Blank input means all
   * families, {@code NONE} means none.
   *
   * @throws IllegalArgumentException for an unknown name
   */
  public static Set<RuleFamily> parse(String names) {
    if (names == null || names.isBlank()) {
      return all();
    }
    if (names.trim().equalsIgnoreCase(NONE)) {
      return EnumSet.noneOf(RuleFamily.class);
    }
    Set<RuleFamily> result = EnumSet.noneOf(RuleFamily.class);
    for (String name : names.split(",")) {
      String trimmed = name.trim();
      if (!trimmed.isEmpty()) {
        result.add(valueOf(trimmed.toUpperCase(Locale.ROOT)));
      }
    }
    return result;
  }
}
