package edu.jhu.hlt.candgen.throttle;

import java.util.List;

import edu.jhu.hlt.candgen.datatypes.Mention;
import edu.jhu.hlt.candgen.datatypes.Span;

/**
 * Common throttlers built from mention positions.
 */
public final class Throttlers {

  private Throttlers() {}

  public static final Throttler ALWAYS = args -> true;
  public static final Throttler NEVER = args -> false;

  /** All arguments come from the same sentence. */
  public static Throttler sameSentence() {
    return args -> {
      for (int i = 1; i < args.size(); i++)
        if (args.get(i).getSentenceId() != args.get(0).getSentenceId())
          return false;
      return true;
    };
  }

  /** No two arguments overlap. */
  public static Throttler noOverlap() {
    return args -> {
      for (int i = 0; i < args.size(); i++)
        for (int j = i + 1; j < args.size(); j++)
          if (args.get(i).getSpan().overlaps(args.get(j).getSpan()))
            return false;
      return true;
    };
  }

  /**
   * The gap between the leftmost end and the rightmost start of the
   * arguments is at most maxChars characters.
   */
  public static Throttler maxCharDistance(final int maxChars) {
    if (maxChars < 0)
      throw new IllegalArgumentException("maxChars=" + maxChars);
    return args -> charDistance(args) <= maxChars;
  }

  static int charDistance(List<Mention> args) {
    int minEnd = Integer.MAX_VALUE;
    int maxStart = Integer.MIN_VALUE;
    for (Mention m : args) {
      Span s = m.getSpan();
      minEnd = Math.min(minEnd, s.end);
      maxStart = Math.max(maxStart, s.start);
    }
    return Math.max(0, maxStart - minEnd);
  }
}
