package edu.jhu.hlt.candgen.throttle;

import java.util.List;

import edu.jhu.hlt.candgen.datatypes.Mention;

/**
 * Decides whether a tuple of mentions (one per role, in role order) may become
 * a candidate. Must be pure: no side effects and no store access, since it is
 * called concurrently from every worker, exactly once per tuple.
 */
@FunctionalInterface
public interface Throttler {

  boolean test(List<Mention> args);

  default Throttler and(Throttler other) {
    return args -> test(args) && other.test(args);
  }

  default Throttler negate() {
    return args -> !test(args);
  }
}
