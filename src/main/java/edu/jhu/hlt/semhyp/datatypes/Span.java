package edu.jhu.hlt.semhyp.datatypes;

/**
 * A contiguous range of tokens in a {@link Document}, start inclusive and end
 * exclusive. Indices are document-global. Compare with equals, not ==.
 */
public final class Span {

  public final int start;  // inclusive
  public final int end;    // non-inclusive

  public static final Span nullSpan = new Span(0, 0);

  public static Span getSpan(int start, int end) {
    if (start == 0 && end == 0)
      return nullSpan;
    if (start < 0 || start >= end) {
      throw new IllegalArgumentException(
          "start must be non-negative and less than end: " + start + " >= " + end);
    }
    return new Span(start, end);
  }

  private Span(int start, int end) {
    this.start = start;
    this.end = end;
  }

  public int width() { return end - start; }

  public boolean covers(Span other) {
    return this.start <= other.start && other.end <= this.end;
  }

  public boolean overlaps(Span other) {
    if (end <= other.start) return false;
    if (start >= other.end) return false;
    return true;
  }

  public boolean includes(int wordIdx) {
    return start <= wordIdx && wordIdx < end;
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
    int w = end - start;
    return (w << 16) ^ start;
  }

  @Override
  public boolean equals(Object other) {
    if (this == other)
      return true;
    if (other instanceof Span) {
      Span s = (Span) other;
      return start == s.start && end == s.end;
    }
    return false;
  }
}
