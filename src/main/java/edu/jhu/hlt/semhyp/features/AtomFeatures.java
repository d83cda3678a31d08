package edu.jhu.hlt.semhyp.features;

import edu.jhu.hlt.semhyp.hyper.TokenAtom;

/**
 * Everything in an atom except its label, as extracted for one token.
 */
public class AtomFeatures {
  private final String type;
  private final String roles;
  private final String morph;
  private final String entity;

  public AtomFeatures(String type, String roles, String morph, String entity) {
    if (type == null || type.isEmpty())
      throw new IllegalArgumentException("tokens always get a type");
    this.type = type;
    this.roles = roles == null ? "" : roles;
    this.morph = morph == null ? "" : morph;
    this.entity = entity == null ? "" : entity;
  }

  public String getType() {
    return type;
  }

  public char getMajorType() {
    return type.charAt(0);
  }

  public String getRoles() {
    return roles;
  }

  public String getMorph() {
    return morph;
  }

  public String getEntity() {
    return entity;
  }

  public TokenAtom toAtom(int token, String label) {
    return new TokenAtom(token, label, type, roles, morph, entity);
  }

  @Override
  public String toString() {
    return type + "." + roles + "." + morph + "." + entity;
  }
}
