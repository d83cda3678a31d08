package edu.jhu.hlt.semhyp.hyper;

/**
 * An atom standing for one token of a parsed document. Equality is identity,
 * so two tokens with the same text (and even the same features) are
 * different nodes. The token index (document-global) lets coverage be
 * computed for any edge built from these atoms.
 */
public final class TokenAtom extends Atom {

  private final int token;

  public TokenAtom(int token, String label, String type, String roles, String morph, String entity) {
    super(label, type, roles, morph, entity);
    this.token = token;
  }

  /**
   * A synthetic atom (connector inserted by the parser) which does not belong
   * to any token.
   */
  public static TokenAtom synthetic(String label, String type, String roles, String morph, String entity) {
    return new TokenAtom(-1, label, type, roles, morph, entity);
  }

  /** The token index, or -1 for synthetic atoms. */
  public int getToken() {
    return token;
  }

  public boolean isSynthetic() {
    return token < 0;
  }

  @Override
  public int hashCode() {
    return System.identityHashCode(this);
  }

  @Override
  public boolean equals(Object other) {
    return this == other;
  }
}
