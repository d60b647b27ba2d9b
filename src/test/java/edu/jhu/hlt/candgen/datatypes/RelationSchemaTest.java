package edu.jhu.hlt.candgen.datatypes;

import static org.junit.Assert.*;

import java.util.Arrays;

import org.junit.Test;

import edu.jhu.hlt.candgen.ConfigurationException;

public class RelationSchemaTest {

  @Test
  public void rolesFromMentionTypes() {
    MentionType part = new MentionType("Part");
    MentionType temp = new MentionType("Temp");
    RelationSchema pt = RelationSchema.forMentionTypes("PartTemp", Arrays.asList(part, temp));
    assertEquals(Arrays.asList("part", "temp"), pt.getRoles());
    assertEquals(2, pt.getArity());
    assertEquals("def PartTemp <part> <temp>", pt.getDefinitionString());

    RelationSchema pp = RelationSchema.forMentionTypes("PartPart", Arrays.asList(part, part, temp));
    assertEquals(Arrays.asList("part1", "part2", "temp"), pp.getRoles());
  }

  @Test(expected = ConfigurationException.class)
  public void duplicateRoles() {
    new RelationSchema("R", "a", "A");
  }

  @Test(expected = ConfigurationException.class)
  public void noRoles() {
    new RelationSchema("R");
  }

  @Test(expected = ConfigurationException.class)
  public void badName() {
    new RelationSchema("drop table;", "a");
  }
}
