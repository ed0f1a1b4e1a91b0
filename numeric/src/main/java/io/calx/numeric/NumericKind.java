package io.calx.numeric;

/**
 * Tag of a {@link NumberValue} variant.
 *
 * <p>The exact kinds are ordered by promotion rank: an operation on two exact values of different
 * kinds lifts the lower one to the higher kind first. {@link #FLOAT} and {@link #SYMBOLIC} sit
 * outside of the tower.
 */
public enum NumericKind {
  INTEGER(0),
  RATIONAL(1),
  REAL(2),
  COMPLEX(3),
  FLOAT(-1),
  SYMBOLIC(-1);

  private final int rank;

  NumericKind(int rank) {
    this.rank = rank;
  }

  /** @return promotion rank, or -1 for kinds that do not take part in promotion */
  public int rank() {
    return rank;
  }
}
