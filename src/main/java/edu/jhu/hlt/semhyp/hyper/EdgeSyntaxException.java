package edu.jhu.hlt.semhyp.hyper;

/**
 * Thrown when the textual form of a hyperedge cannot be parsed.
 */
public class EdgeSyntaxException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  private final String source;

  public EdgeSyntaxException(String message, String source) {
    super(message + " in \"" + source + "\"");
    this.source = source;
  }

  public String getSource() {
    return source;
  }
}
