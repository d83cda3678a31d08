package edu.jhu.hlt.semhyp.util;

/**
 * A recoverable problem noticed while building or rendering hyperedges.
 * Processing continues with a best-effort result; diagnostics are handed back
 * to the caller alongside that result.
 */
public class Diagnostic {

  public static enum Kind {
    HEAD_WITHOUT_EDGE,          // e.g. a token attached to punctuation
    PREDICATE_WITHOUT_ATOM,
    ARGUMENT_WITHOUT_HISTORY,
    PREDICATE_EDGE_IS_ATOM,
    MENTION_WITHOUT_EDGE,
    UNRECOGNIZED_CONNECTOR,
    SENTENCE_FAILED,
  }

  private final Kind kind;
  private final int token;    // -1 if not about a particular token
  private final String message;

  public Diagnostic(Kind kind, int token, String message) {
    this.kind = kind;
    this.token = token;
    this.message = message;
  }

  public Diagnostic(Kind kind, String message) {
    this(kind, -1, message);
  }

  public Kind getKind() {
    return kind;
  }

  public int getToken() {
    return token;
  }

  public String getMessage() {
    return message;
  }

  @Override
  public String toString() {
    if (token < 0)
      return kind + ": " + message;
    return kind + "@" + token + ": " + message;
  }
}
