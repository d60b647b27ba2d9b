package edu.jhu.hlt.candgen.spans;

import java.util.ArrayList;
import java.util.List;

import edu.jhu.hlt.candgen.datatypes.Sentence;

/**
 * Proposes the spans of a sentence that could become mentions (the "mention
 * space"). Implementations must be stateless: one instance is shared by all
 * workers.
 */
public abstract class SpanExtractor {

  public abstract String getName();

  public List<TemporarySpan> computeSpans(Sentence s) {
    List<TemporarySpan> spans = new ArrayList<>();
    computeSpans(s, spans);
    return spans;
  }

  /**
   * Compute spans and add them to addTo, in the order they should be offered
   * to a matcher. Must not add the same span twice.
   */
  public abstract void computeSpans(Sentence s, List<TemporarySpan> addTo);

  @Override
  public String toString() {
    return "(SpanExtractor " + getName() + ")";
  }
}
