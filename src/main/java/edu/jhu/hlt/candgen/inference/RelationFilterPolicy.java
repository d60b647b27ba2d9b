package edu.jhu.hlt.candgen.inference;

import edu.jhu.hlt.candgen.datatypes.Mention;
import edu.jhu.hlt.candgen.datatypes.Span;
import edu.jhu.hlt.candgen.util.ExperimentProperties;

/**
 * Switches for pruning binary candidates: self relations (both arguments have
 * the same span), nested relations (one argument's span strictly contains the
 * other's) and symmetric duplicates (keep rel(A,B), drop rel(B,A)).
 *
 * Relations of any other arity are never filtered by this policy.
 */
public final class RelationFilterPolicy {

  public enum Verdict {
    KEEP, SELF, NESTED, SYMMETRIC;
  }

  private final boolean selfRelations;
  private final boolean nestedRelations;
  private final boolean symmetricRelations;

  public RelationFilterPolicy(boolean selfRelations, boolean nestedRelations, boolean symmetricRelations) {
    this.selfRelations = selfRelations;
    this.nestedRelations = nestedRelations;
    this.symmetricRelations = symmetricRelations;
  }

  /** No self or nested relations, both orders of symmetric pairs. */
  public static RelationFilterPolicy defaults() {
    return new RelationFilterPolicy(false, false, true);
  }

  /** Lets every tuple through. */
  public static RelationFilterPolicy allowAll() {
    return new RelationFilterPolicy(true, true, true);
  }

  public static RelationFilterPolicy fromConfig(ExperimentProperties config) {
    return new RelationFilterPolicy(
        config.getBoolean("relations.self", false),
        config.getBoolean("relations.nested", false),
        config.getBoolean("relations.symmetric", true));
  }

  /**
   * Checks, in order, self, nested and symmetric, returning the first rule
   * that rejects the pair.
   *
   * @param ai position of a in the (id-ordered) mention list of the first role
   * @param bi position of b in the mention list of the second role
   */
  public Verdict check(int ai, Mention a, int bi, Mention b) {
    Span sa = a.getSpan();
    Span sb = b.getSpan();
    if (!selfRelations && sa.equals(sb))
      return Verdict.SELF;
    if (!nestedRelations && (sa.strictlyCovers(sb) || sb.strictlyCovers(sa)))
      return Verdict.NESTED;
    if (!symmetricRelations && ai > bi)
      return Verdict.SYMMETRIC;
    return Verdict.KEEP;
  }

  public boolean allowsSelfRelations() { return selfRelations; }
  public boolean allowsNestedRelations() { return nestedRelations; }
  public boolean allowsSymmetricRelations() { return symmetricRelations; }

  @Override
  public String toString() {
    return "(RelationFilterPolicy self=" + selfRelations + " nested=" + nestedRelations
        + " symmetric=" + symmetricRelations + ")";
  }
}
