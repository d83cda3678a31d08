package edu.jhu.hlt.semhyp.hyper;

/**
 * An atom which is equal to any other content atom with the same fields.
 * This is what {@link Hyperedges#parse(String)} and all canonicalizing
 * operations produce.
 */
public final class ContentAtom extends Atom {

  private int hashCode = 0;

  public ContentAtom(String label) {
    this(label, "", "", "", "");
  }

  public ContentAtom(String label, String type) {
    this(label, type, "", "", "");
  }

  public ContentAtom(String label, String type, String roles) {
    this(label, type, roles, "", "");
  }

  public ContentAtom(String label, String type, String roles, String morph, String entity) {
    super(label, type, roles, morph, entity);
  }

  @Override
  public int hashCode() {
    if (hashCode == 0) {
      int h = label.hashCode();
      h = h * 31 + type.hashCode();
      h = h * 31 + roles.hashCode();
      h = h * 31 + morph.hashCode();
      h = h * 31 + entity.hashCode();
      hashCode = h;
    }
    return hashCode;
  }

  @Override
  public boolean equals(Object other) {
    if (this == other)
      return true;
    if (other instanceof ContentAtom) {
      ContentAtom a = (ContentAtom) other;
      return label.equals(a.label)
          && type.equals(a.type)
          && roles.equals(a.roles)
          && morph.equals(a.morph)
          && entity.equals(a.entity);
    }
    return false;
  }
}
