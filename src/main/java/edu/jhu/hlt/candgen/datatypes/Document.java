package edu.jhu.hlt.candgen.datatypes;

/**
 * A unit of work. The extraction code only ever looks at the id (to scope
 * reads, writes and deletes) and the name (for reporting).
 */
public final class Document {

  private final long id;
  private final String name;

  public Document(long id, String name) {
    if (name == null)
      throw new IllegalArgumentException("document " + id + " has no name");
    this.id = id;
    this.name = name;
  }

  public long getId() {
    return id;
  }

  public String getName() {
    return name;
  }

  @Override
  public int hashCode() {
    return Long.hashCode(id);
  }

  @Override
  public boolean equals(Object other) {
    if (other instanceof Document)
      return id == ((Document) other).id;
    return false;
  }

  @Override
  public String toString() {
    return "(Document " + id + " " + name + ")";
  }
}
