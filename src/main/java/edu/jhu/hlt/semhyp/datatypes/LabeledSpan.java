package edu.jhu.hlt.semhyp.datatypes;

/**
 * A {@link Span} with a string label, e.g. an entity ("PERSON"), a semantic
 * role argument ("ARGM-TMP", or "V" for the predicate itself) or a coreference
 * mention ("MAIN3", "REF3").
 */
public class LabeledSpan {

  private final Span span;
  private final String label;

  public LabeledSpan(int start, int end, String label) {
    this(Span.getSpan(start, end), label);
  }

  public LabeledSpan(Span span, String label) {
    if (span == null || span.width() == 0)
      throw new IllegalArgumentException("span=" + span);
    this.span = span;
    this.label = label == null ? "" : label;
  }

  public Span getSpan() {
    return span;
  }

  public int getStart() {
    return span.start;
  }

  public int getEnd() {
    return span.end;
  }

  public String getLabel() {
    return label;
  }

  public boolean includes(int token) {
    return span.includes(token);
  }

  @Override
  public int hashCode() {
    return span.hashCode() * 31 + label.hashCode();
  }

  @Override
  public boolean equals(Object other) {
    if (other instanceof LabeledSpan) {
      LabeledSpan ls = (LabeledSpan) other;
      return span.equals(ls.span) && label.equals(ls.label);
    }
    return false;
  }

  @Override
  public String toString() {
    return label + "@" + span.shortString();
  }
}
