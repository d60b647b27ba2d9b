package edu.jhu.hlt.candgen.datatypes;

/**
 * A typed, arity-1 entity: a span of one document. Immutable. Mentions are
 * referenced by {@link Candidate}s through their id.
 */
public final class Mention {

  /** Assigned by the store, -1 for a mention that has not been persisted. */
  private final long id;
  private final MentionType type;
  private final long documentId;
  private final long sentenceId;
  private final int sentencePosition;
  private final Span span;
  private final String text;

  public Mention(long id, MentionType type, long documentId, long sentenceId,
      int sentencePosition, Span span, String text) {
    if (type == null || span == null || text == null)
      throw new IllegalArgumentException("type, span and text are required");
    this.id = id;
    this.type = type;
    this.documentId = documentId;
    this.sentenceId = sentenceId;
    this.sentencePosition = sentencePosition;
    this.span = span;
    this.text = text;
  }

  public Mention withId(long id) {
    return new Mention(id, type, documentId, sentenceId, sentencePosition, span, text);
  }

  public boolean isPersisted() {
    return id >= 0;
  }

  public long getId() { return id; }
  public MentionType getType() { return type; }
  public long getDocumentId() { return documentId; }
  public long getSentenceId() { return sentenceId; }
  public int getSentencePosition() { return sentencePosition; }
  public Span getSpan() { return span; }
  public String getText() { return text; }

  @Override
  public int hashCode() {
    return Long.hashCode(id);
  }

  /** Persisted mentions are equal iff their ids are. */
  @Override
  public boolean equals(Object other) {
    if (other instanceof Mention) {
      Mention m = (Mention) other;
      if (id >= 0 || m.id >= 0)
        return id == m.id;
      return type.equals(m.type) && documentId == m.documentId && span.equals(m.span);
    }
    return false;
  }

  @Override
  public String toString() {
    return "(" + type + " " + id + " doc=" + documentId + " " + span.shortString() + " \"" + text + "\")";
  }
}
