package edu.jhu.hlt.candgen.matchers;

import edu.jhu.hlt.candgen.spans.TemporarySpan;

/** Matches exactly the spans the wrapped matcher rejects. */
public class Inverse extends Matcher {

  private final Matcher child;

  public Inverse(Matcher child) {
    this.child = child;
  }

  @Override
  public boolean matches(TemporarySpan span) {
    return !child.matches(span);
  }
}
