package edu.jhu.hlt.candgen.throttle;

import static org.junit.Assert.*;

import java.util.Arrays;

import org.junit.Test;

import edu.jhu.hlt.candgen.datatypes.Mention;
import edu.jhu.hlt.candgen.datatypes.MentionType;
import edu.jhu.hlt.candgen.datatypes.Span;

public class ThrottlersTest {

  private static final MentionType T = new MentionType("T");

  private static Mention m(long id, long sentenceId, int start, int end) {
    return new Mention(id, T, 1, sentenceId, (int) sentenceId, Span.getSpan(start, end), "x");
  }

  @Test
  public void sameSentence() {
    Throttler t = Throttlers.sameSentence();
    assertTrue(t.test(Arrays.asList(m(1, 10, 0, 2), m(2, 10, 3, 5))));
    assertFalse(t.test(Arrays.asList(m(1, 10, 0, 2), m(2, 11, 30, 35))));
    assertFalse(t.test(Arrays.asList(m(1, 10, 0, 2), m(2, 10, 3, 5), m(3, 12, 50, 52))));
  }

  @Test
  public void noOverlap() {
    Throttler t = Throttlers.noOverlap();
    assertTrue(t.test(Arrays.asList(m(1, 1, 0, 2), m(2, 1, 2, 5))));
    assertFalse(t.test(Arrays.asList(m(1, 1, 0, 3), m(2, 1, 2, 5))));
  }

  @Test
  public void charDistance() {
    assertEquals(0, Throttlers.charDistance(Arrays.asList(m(1, 1, 0, 3), m(2, 1, 2, 5))));
    assertEquals(7, Throttlers.charDistance(Arrays.asList(m(1, 1, 0, 3), m(2, 1, 10, 12))));
    Throttler near = Throttlers.maxCharDistance(5);
    assertFalse(near.test(Arrays.asList(m(1, 1, 0, 3), m(2, 1, 10, 12))));
    assertTrue(near.test(Arrays.asList(m(1, 1, 0, 3), m(2, 1, 5, 12))));
  }

  @Test
  public void combining() {
    Throttler both = Throttlers.sameSentence().and(Throttlers.noOverlap());
    assertTrue(both.test(Arrays.asList(m(1, 1, 0, 2), m(2, 1, 3, 5))));
    assertFalse(both.test(Arrays.asList(m(1, 1, 0, 4), m(2, 1, 3, 5))));
    assertFalse(Throttlers.ALWAYS.negate().test(Arrays.asList(m(1, 1, 0, 2))));
    assertFalse(Throttlers.NEVER.test(Arrays.asList(m(1, 1, 0, 2))));
  }
}
