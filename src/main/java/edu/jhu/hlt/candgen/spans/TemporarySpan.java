package edu.jhu.hlt.candgen.spans;

import edu.jhu.hlt.candgen.datatypes.Mention;
import edu.jhu.hlt.candgen.datatypes.MentionType;
import edu.jhu.hlt.candgen.datatypes.Sentence;
import edu.jhu.hlt.candgen.datatypes.Span;

/**
 * A span of a sentence that has been proposed by a {@link SpanExtractor} but
 * not (yet) turned into a {@link Mention}. Matchers look at these.
 */
public final class TemporarySpan {

  private final Sentence sentence;
  private final Span chars;

  public TemporarySpan(Sentence sentence, Span chars) {
    if (chars.start < sentence.getCharStart() || chars.end > sentence.getCharEnd())
      throw new IllegalArgumentException(chars + " is not inside " + sentence);
    this.sentence = sentence;
    this.chars = chars;
  }

  public Sentence getSentence() {
    return sentence;
  }

  /** Absolute character span, [start, end). */
  public Span getCharSpan() {
    return chars;
  }

  public int getCharStart() {
    return chars.start;
  }

  /** Exclusive. */
  public int getCharEnd() {
    return chars.end;
  }

  public String getText() {
    return sentence.getText(chars);
  }

  /** True if other lies inside this span (and in the same sentence). */
  public boolean contains(TemporarySpan other) {
    return sentence.getPosition() == other.sentence.getPosition()
        && sentence.getDocumentId() == other.sentence.getDocumentId()
        && chars.covers(other.chars);
  }

  public Mention toMention(MentionType type) {
    return new Mention(-1, type, sentence.getDocumentId(), sentence.getId(),
        sentence.getPosition(), chars, getText());
  }

  @Override
  public int hashCode() {
    return 31 * sentence.getPosition() + chars.hashCode();
  }

  @Override
  public boolean equals(Object other) {
    if (other instanceof TemporarySpan) {
      TemporarySpan t = (TemporarySpan) other;
      return chars.equals(t.chars)
          && sentence.getPosition() == t.sentence.getPosition()
          && sentence.getDocumentId() == t.sentence.getDocumentId();
    }
    return false;
  }

  @Override
  public String toString() {
    return "(TemporarySpan " + chars.shortString() + " \"" + getText() + "\")";
  }
}
