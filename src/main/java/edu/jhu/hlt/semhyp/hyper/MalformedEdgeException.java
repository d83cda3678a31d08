package edu.jhu.hlt.semhyp.hyper;

/**
 * Thrown when type inference reaches a connector whose major type is not one
 * of C, P, M, T, B, J (or which has no type at all).
 */
public class MalformedEdgeException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  private final transient Node edge;

  public MalformedEdgeException(String message, Node edge) {
    super(message + ": " + edge);
    this.edge = edge;
  }

  /** The node whose type could not be inferred. */
  public Node getEdge() {
    return edge;
  }
}
