package edu.jhu.hlt.candgen.datatypes;

import java.io.Serializable;

/**
 * A half-open range of absolute character offsets into a document,
 * [start, end). Spans are values: two spans with the same endpoints are equal
 * regardless of which mention or sentence they came from.
 */
public final class Span implements Comparable<Span>, Serializable {
  private static final long serialVersionUID = 2207716450983213317L;

  public static final Span nullSpan = new Span(0, 0);

  public final int start;  // inclusive
  public final int end;    // non-inclusive

  public static Span getSpan(int start, int end) {
    if (start == 0 && end == 0)
      return nullSpan;
    if (start < 0)
      throw new IllegalArgumentException("negative start: " + start);
    if (start >= end) {
      throw new IllegalArgumentException(
          "start must be less than end: " + start + " >= " + end);
    }
    return new Span(start, end);
  }

  private Span(int start, int end) {
    this.start = start;
    this.end = end;
  }

  public int width() { return end - start; }

  /**
   * return true if this span is to the left of
   * other with no overlap.
   */
  public boolean before(Span other) {
    return this.end <= other.start;
  }

  /**
   * return true if this span is to the right of
   * other with no overlap.
   */
  public boolean after(Span other) {
    return this.start >= other.end;
  }

  /** Non-strict containment: a span covers itself. */
  public boolean covers(Span other) {
    return this.start <= other.start && other.end <= this.end;
  }

  /** True if this span covers other and they are not equal. */
  public boolean strictlyCovers(Span other) {
    return covers(other) && !equals(other);
  }

  public boolean crosses(Span other) {
    Span a = this;
    Span b = other;
    if (a.start < b.start && b.start < a.end && a.end < b.end)
      return true;
    a = other;
    b = this;
    if (a.start < b.start && b.start < a.end && a.end < b.end)
      return true;
    return false;
  }

  public boolean overlaps(Span other) {
    if (end <= other.start) return false;
    if (start >= other.end) return false;
    return true;
  }

  public boolean includes(int charIdx) {
    return start <= charIdx && charIdx < end;
  }

  /** Returns a span moved right by delta characters. */
  public Span shift(int delta) {
    return getSpan(start + delta, end + delta);
  }

  @Override
  public String toString() {
    return String.format("<Span %d-%d>", start, end);
  }

  public String shortString() {
    return start + "-" + end;
  }

  @Override
  public int hashCode() {
    return 31 * start + (end - start);
  }

  public boolean equals(int start, int end) {
    return start == this.start && end == this.end;
  }

  @Override
  public boolean equals(Object other) {
    if (other instanceof Span) {
      Span s = (Span) other;
      return start == s.start && end == s.end;
    }
    return false;
  }

  /** Orders by start, then by end. */
  @Override
  public int compareTo(Span o) {
    int c = Integer.compare(start, o.start);
    if (c != 0) return c;
    return Integer.compare(end, o.end);
  }
}
