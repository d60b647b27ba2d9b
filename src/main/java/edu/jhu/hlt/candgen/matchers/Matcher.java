package edu.jhu.hlt.candgen.matchers;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

import com.google.common.collect.AbstractIterator;

import edu.jhu.hlt.candgen.spans.TemporarySpan;

/**
 * Decides which proposed spans become mentions. Subclasses implement
 * {@link #matches(TemporarySpan)}, which must be a pure function of the span:
 * one matcher instance is shared by all workers.
 *
 * With longestMatchOnly (the default), {@link #apply(Iterator)} drops a
 * matching span if it lies inside a span that already matched, which makes
 * sense with extractors like {@link edu.jhu.hlt.candgen.spans.NgramSpanExtractor}
 * that propose longer spans first.
 */
public abstract class Matcher {

  private boolean longestMatchOnly = true;

  public abstract boolean matches(TemporarySpan span);

  public boolean isLongestMatchOnly() {
    return longestMatchOnly;
  }

  public Matcher setLongestMatchOnly(boolean longestMatchOnly) {
    this.longestMatchOnly = longestMatchOnly;
    return this;
  }

  /**
   * Lazily filters spans. The matcher is called exactly once per span. State
   * for longestMatchOnly lives in the returned iterator, so concurrent calls
   * don't interfere.
   */
  public Iterator<TemporarySpan> apply(final Iterator<TemporarySpan> spans) {
    return new AbstractIterator<TemporarySpan>() {
      private final List<TemporarySpan> matched = new ArrayList<>();

      @Override
      protected TemporarySpan computeNext() {
        while (spans.hasNext()) {
          TemporarySpan s = spans.next();
          if (!matches(s))
            continue;
          if (longestMatchOnly) {
            if (insideEarlierMatch(s))
              continue;
            matched.add(s);
          }
          return s;
        }
        return endOfData();
      }

      private boolean insideEarlierMatch(TemporarySpan s) {
        for (TemporarySpan m : matched)
          if (m.contains(s))
            return true;
        return false;
      }
    };
  }

  public static Matcher union(Matcher... matchers) {
    return new Union(matchers);
  }

  public static Matcher intersect(Matcher... matchers) {
    return new Intersect(matchers);
  }

  public static Matcher inverse(Matcher matcher) {
    return new Inverse(matcher);
  }
}
