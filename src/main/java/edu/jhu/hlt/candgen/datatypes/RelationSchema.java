package edu.jhu.hlt.candgen.datatypes;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

import edu.jhu.hlt.candgen.ConfigurationException;

/**
 * A relation type: a name and an ordered list of argument roles. The arity is
 * the number of roles. Which {@link MentionType} fills each role is decided by
 * whoever extracts candidates for this schema, not by the schema itself.
 *
 * Names and roles end up as table and column names in the store, so they are
 * restricted to identifiers.
 */
public class RelationSchema {

  private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z][A-Za-z0-9_]*");

  private final String name;
  private final List<String> roles;

  public RelationSchema(String name, List<String> roles) {
    checkIdentifier(name, "relation name");
    if (roles == null || roles.isEmpty())
      throw new ConfigurationException("relation " + name + " needs at least one role");
    Set<String> seen = new HashSet<>();
    for (String role : roles) {
      checkIdentifier(role, "role of " + name);
      // stored as <role>_id next to the candidate's own document_id
      if (role.equalsIgnoreCase("document"))
        throw new ConfigurationException("relation " + name + " can't have a role named " + role);
      if (!seen.add(role.toLowerCase()))
        throw new ConfigurationException("relation " + name + " has role " + role + " twice");
    }
    this.name = name;
    this.roles = Collections.unmodifiableList(new ArrayList<>(roles));
  }

  public RelationSchema(String name, String... roles) {
    this(name, Arrays.asList(roles));
  }

  /**
   * Builds a schema whose roles are named after (lower-cased) mention types,
   * e.g. PartTemp(Part, Temp) gets roles "part" and "temp". A type used more
   * than once gets numbered roles: PartPart(Part, Part) has "part1", "part2".
   */
  public static RelationSchema forMentionTypes(String name, List<MentionType> argTypes) {
    List<String> roles = new ArrayList<>();
    for (int i = 0; i < argTypes.size(); i++) {
      MentionType t = argTypes.get(i);
      int occurrences = Collections.frequency(argTypes, t);
      String role = t.getName().toLowerCase();
      if (occurrences > 1)
        role += (1 + Collections.frequency(argTypes.subList(0, i), t));
      roles.add(role);
    }
    return new RelationSchema(name, roles);
  }

  private static void checkIdentifier(String s, String what) {
    if (s == null || !IDENTIFIER.matcher(s).matches())
      throw new ConfigurationException(what + " is not an identifier: " + s);
  }

  public String getName() {
    return name;
  }

  public List<String> getRoles() {
    return roles;
  }

  public String getRole(int i) {
    return roles.get(i);
  }

  public int getArity() {
    return roles.size();
  }

  /**
   * Returns the definition string for this relation, e.g.
   * "def PartTemp <part> <temp>".
   */
  public String getDefinitionString() {
    StringBuilder sb = new StringBuilder("def ");
    sb.append(name);
    for (String role : roles) {
      sb.append(' ');
      sb.append('<');
      sb.append(role);
      sb.append('>');
    }
    return sb.toString();
  }

  @Override
  public String toString() {
    return "(Relation " + name + ")";
  }

  @Override
  public int hashCode() {
    return 31 * name.hashCode() + roles.hashCode();
  }

  @Override
  public boolean equals(Object other) {
    if (other instanceof RelationSchema) {
      RelationSchema r = (RelationSchema) other;
      return name.equals(r.name) && roles.equals(r.roles);
    }
    return false;
  }

  public static final Comparator<RelationSchema> BY_NAME = new Comparator<RelationSchema>() {
    @Override
    public int compare(RelationSchema o1, RelationSchema o2) {
      return o1.getName().compareTo(o2.getName());
    }
  };
}
