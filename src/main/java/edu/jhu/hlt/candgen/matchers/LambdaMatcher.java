package edu.jhu.hlt.candgen.matchers;

import java.util.function.Predicate;

import edu.jhu.hlt.candgen.spans.TemporarySpan;

/** Adapts an arbitrary (pure) predicate. */
public class LambdaMatcher extends Matcher {

  private final Predicate<TemporarySpan> f;

  public LambdaMatcher(Predicate<TemporarySpan> f) {
    this.f = f;
  }

  @Override
  public boolean matches(TemporarySpan span) {
    return f.test(span);
  }
}
