package edu.jhu.hlt.candgen.datatypes;

/**
 * The type of a {@link Mention}, e.g. "Part" or "Temp". Every mention has
 * exactly one type, and a type doubles as the argument type of a
 * {@link RelationSchema} role.
 */
public class MentionType {
  private final String name;

  public MentionType(String name) {
    if (name == null || name.isEmpty())
      throw new IllegalArgumentException("mention types need a name");
    this.name = name.intern();
  }

  public String getName() {
    return name;
  }

  @Override
  public int hashCode() {
    return name.hashCode();
  }

  @Override
  public boolean equals(Object other) {
    if (other instanceof MentionType)
      return name == ((MentionType) other).name;
    return false;
  }

  @Override
  public String toString() {
    return name;
  }
}
