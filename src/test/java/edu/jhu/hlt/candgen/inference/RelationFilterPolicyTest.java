package edu.jhu.hlt.candgen.inference;

import static org.junit.Assert.*;

import org.junit.Test;

import edu.jhu.hlt.candgen.datatypes.Mention;
import edu.jhu.hlt.candgen.datatypes.MentionType;
import edu.jhu.hlt.candgen.datatypes.Span;
import edu.jhu.hlt.candgen.inference.RelationFilterPolicy.Verdict;
import edu.jhu.hlt.candgen.util.ExperimentProperties;

public class RelationFilterPolicyTest {

  private static final MentionType T = new MentionType("T");

  private static Mention m(long id, int start, int end) {
    return new Mention(id, T, 1, 1, 0, Span.getSpan(start, end), "x");
  }

  @Test
  public void defaults() {
    RelationFilterPolicy p = RelationFilterPolicy.defaults();
    assertFalse(p.allowsSelfRelations());
    assertFalse(p.allowsNestedRelations());
    assertTrue(p.allowsSymmetricRelations());

    Mention a = m(1, 0, 5);
    Mention b = m(2, 6, 9);
    assertEquals(Verdict.SELF, p.check(0, a, 0, a));
    // two mentions with the same span are a self relation too
    assertEquals(Verdict.SELF, p.check(0, a, 1, m(3, 0, 5)));
    assertEquals(Verdict.NESTED, p.check(0, a, 1, m(4, 1, 3)));
    assertEquals(Verdict.NESTED, p.check(1, m(4, 1, 3), 0, a));
    assertEquals(Verdict.KEEP, p.check(0, a, 1, b));
    assertEquals(Verdict.KEEP, p.check(1, b, 0, a));
  }

  @Test
  public void nestedIsStrict() {
    RelationFilterPolicy p = new RelationFilterPolicy(true, false, true);
    Mention a = m(1, 0, 5);
    assertEquals(Verdict.KEEP, p.check(0, a, 0, a));
    assertEquals(Verdict.NESTED, p.check(0, a, 1, m(2, 0, 4)));
  }

  @Test
  public void symmetric() {
    RelationFilterPolicy p = new RelationFilterPolicy(false, false, false);
    Mention a = m(1, 0, 5);
    Mention b = m(2, 6, 9);
    assertEquals(Verdict.KEEP, p.check(0, a, 1, b));
    assertEquals(Verdict.SYMMETRIC, p.check(1, b, 0, a));
    // overlapping but not nested
    assertEquals(Verdict.KEEP, p.check(0, a, 1, m(3, 3, 8)));
  }

  @Test
  public void allowAll() {
    RelationFilterPolicy p = RelationFilterPolicy.allowAll();
    Mention a = m(1, 0, 5);
    assertEquals(Verdict.KEEP, p.check(0, a, 0, a));
    assertEquals(Verdict.KEEP, p.check(1, m(2, 1, 2), 0, a));
  }

  @Test
  public void fromConfig() {
    ExperimentProperties config = new ExperimentProperties();
    config.putAll(new String[] {"relations.self", "true", "relations.symmetric", "false"});
    RelationFilterPolicy p = RelationFilterPolicy.fromConfig(config);
    assertTrue(p.allowsSelfRelations());
    assertFalse(p.allowsNestedRelations());
    assertFalse(p.allowsSymmetricRelations());
  }
}
