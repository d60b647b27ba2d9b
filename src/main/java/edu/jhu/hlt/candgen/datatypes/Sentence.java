package edu.jhu.hlt.candgen.datatypes;

import java.util.Arrays;

/**
 * A tokenized sentence as handed over by the preprocessing step. Word offsets
 * are absolute (relative to the start of the document), which is what lets
 * mention spans from different sentences be compared directly.
 */
public class Sentence {

  /** Assigned by the store, -1 until the sentence has been persisted. */
  private final long id;
  private final long documentId;
  private final int position;

  private final String text;
  private final int charStart;     // absolute offset of text.charAt(0)
  private final String[] words;
  private final int[] charOffsets; // absolute offset of each word

  public Sentence(long id, long documentId, int position, String text,
      int charStart, String[] words, int[] charOffsets) {
    if (words.length != charOffsets.length) {
      throw new IllegalArgumentException("words.length=" + words.length
          + " but charOffsets.length=" + charOffsets.length);
    }
    for (int i = 0; i < words.length; i++) {
      int rel = charOffsets[i] - charStart;
      if (rel < 0 || rel + words[i].length() > text.length()
          || !text.regionMatches(rel, words[i], 0, words[i].length())) {
        throw new IllegalArgumentException("word " + i + " \"" + words[i]
            + "\" is not at offset " + charOffsets[i] + " of \"" + text + "\"");
      }
    }
    this.id = id;
    this.documentId = documentId;
    this.position = position;
    this.text = text;
    this.charStart = charStart;
    this.words = Arrays.copyOf(words, words.length);
    this.charOffsets = Arrays.copyOf(charOffsets, charOffsets.length);
  }

  /**
   * Splits text on whitespace. Convenient for tests and for documents whose
   * tokenization doesn't matter.
   */
  public static Sentence whitespaceTokenized(long documentId, int position, String text, int charStart) {
    String[] words = text.trim().isEmpty() ? new String[0] : text.trim().split("\\s+");
    int[] offsets = new int[words.length];
    int from = 0;
    for (int i = 0; i < words.length; i++) {
      int rel = text.indexOf(words[i], from);
      offsets[i] = charStart + rel;
      from = rel + words[i].length();
    }
    return new Sentence(-1, documentId, position, text, charStart, words, offsets);
  }

  /** Returns a copy of this sentence carrying the id the store gave it. */
  public Sentence withId(long id) {
    return new Sentence(id, documentId, position, text, charStart, words, charOffsets);
  }

  public long getId() { return id; }
  public long getDocumentId() { return documentId; }
  public int getPosition() { return position; }
  public String getText() { return text; }
  public int getCharStart() { return charStart; }
  public int getCharEnd() { return charStart + text.length(); }
  public int size() { return words.length; }

  public String getWord(int i) {
    return words[i];
  }

  public int getCharOffset(int i) {
    return charOffsets[i];
  }

  public String[] getWords() {
    return Arrays.copyOf(words, words.length);
  }

  public int[] getCharOffsets() {
    return Arrays.copyOf(charOffsets, charOffsets.length);
  }

  /** Character span of the words in [firstWord, lastWord]. */
  public Span getCharSpan(int firstWord, int lastWord) {
    int start = charOffsets[firstWord];
    int end = charOffsets[lastWord] + words[lastWord].length();
    return Span.getSpan(start, end);
  }

  /** Surface text of an absolute character span inside this sentence. */
  public String getText(Span chars) {
    if (chars.start < charStart || chars.end > getCharEnd()) {
      throw new IllegalArgumentException(chars + " is outside of sentence "
          + position + " [" + charStart + ", " + getCharEnd() + ")");
    }
    return text.substring(chars.start - charStart, chars.end - charStart);
  }

  @Override
  public String toString() {
    return "(Sentence doc=" + documentId + " pos=" + position + " " + text + ")";
  }
}
