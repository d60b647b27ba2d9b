package edu.jhu.hlt.candgen.datatypes;

import java.util.Arrays;

/**
 * An n-ary relation instance: one mention id per role of a
 * {@link RelationSchema}, tagged with the split it belongs to. Candidates
 * point at mentions but never own them.
 */
public final class Candidate {

  /** Assigned by the store, -1 for a candidate that has not been persisted. */
  private final long id;
  private final String relation;
  private final int split;
  private final long documentId;
  private final long[] argIds;

  public Candidate(long id, String relation, int split, long documentId, long[] argIds) {
    this.id = id;
    this.relation = relation;
    this.split = split;
    this.documentId = documentId;
    this.argIds = Arrays.copyOf(argIds, argIds.length);
  }

  public long getId() { return id; }
  public String getRelation() { return relation; }
  public int getSplit() { return split; }
  public long getDocumentId() { return documentId; }
  public int getArity() { return argIds.length; }

  public long getArgId(int i) {
    return argIds[i];
  }

  public long[] getArgIds() {
    return Arrays.copyOf(argIds, argIds.length);
  }

  /**
   * Identity of this candidate's content, ignoring the store id:
   * (relation, split, argument ids).
   */
  public String contentKey() {
    StringBuilder sb = new StringBuilder();
    sb.append(relation).append('/').append(split);
    for (long a : argIds)
      sb.append('/').append(a);
    return sb.toString();
  }

  @Override
  public int hashCode() {
    return 31 * (31 * relation.hashCode() + split) + Arrays.hashCode(argIds);
  }

  /** Compares content, not store ids, see {@link #contentKey()}. */
  @Override
  public boolean equals(Object other) {
    if (other instanceof Candidate) {
      Candidate c = (Candidate) other;
      return split == c.split && relation.equals(c.relation) && Arrays.equals(argIds, c.argIds);
    }
    return false;
  }

  @Override
  public String toString() {
    return "(" + relation + " " + id + " split=" + split + " doc=" + documentId
        + " args=" + Arrays.toString(argIds) + ")";
  }
}
