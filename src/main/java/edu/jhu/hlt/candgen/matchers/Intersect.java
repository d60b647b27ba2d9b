package edu.jhu.hlt.candgen.matchers;

import java.util.Arrays;
import java.util.List;

import edu.jhu.hlt.candgen.spans.TemporarySpan;

/** Matches if every child matches. */
public class Intersect extends Matcher {

  private final List<Matcher> children;

  public Intersect(Matcher... children) {
    if (children.length == 0)
      throw new IllegalArgumentException("need at least one matcher");
    this.children = Arrays.asList(children);
  }

  @Override
  public boolean matches(TemporarySpan span) {
    for (Matcher m : children)
      if (!m.matches(span))
        return false;
    return true;
  }
}
