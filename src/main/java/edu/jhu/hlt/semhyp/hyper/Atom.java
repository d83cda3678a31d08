package edu.jhu.hlt.semhyp.hyper;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import com.google.common.collect.ImmutableList;

/**
 * Leaf of a hyperedge. Absent fields are represented by the empty string.
 *
 * There are two kinds of atoms which differ only in what equality means:
 * {@link ContentAtom}s are equal when their fields are, {@link TokenAtom}s are
 * only equal to themselves (two occurrences of "the" in a sentence must stay
 * distinct nodes while a sentence is being parsed).
 */
public abstract class Atom implements Node {

  protected final String label;
  protected final String type;
  protected final String roles;
  protected final String morph;
  protected final String entity;

  protected Atom(String label, String type, String roles, String morph, String entity) {
    if (label == null)
      throw new IllegalArgumentException("atoms need a label");
    this.label = label;
    this.type = type == null ? "" : type;
    this.roles = roles == null ? "" : roles;
    this.morph = morph == null ? "" : morph;
    this.entity = entity == null ? "" : entity;
  }

  @Override
  public boolean isAtom() {
    return true;
  }

  public String getLabel() {
    return label;
  }

  /** The raw type code, possibly empty. */
  public String getTypeCode() {
    return type;
  }

  /** Colon separated role fields, possibly empty. */
  public String getRoles() {
    return roles;
  }

  public List<String> getRoleFields() {
    if (roles.isEmpty())
      return Collections.emptyList();
    return ImmutableList.copyOf(Arrays.asList(roles.split(":", -1)));
  }

  public String getMorph() {
    return morph;
  }

  public String getEntity() {
    return entity;
  }

  public boolean hasType() {
    return !type.isEmpty();
  }

  @Override
  public String type() {
    if (type.isEmpty())
      throw new MalformedEdgeException("atom has no type", this);
    return type;
  }

  @Override
  public List<String> argroleFields() {
    if (roles.isEmpty())
      return null;
    return getRoleFields();
  }

  @Override
  public Set<Atom> atoms() {
    Set<Atom> s = new LinkedHashSet<>();
    s.add(this);
    return s;
  }

  @Override
  public Set<Node> subedges() {
    Set<Node> s = new LinkedHashSet<>();
    s.add(this);
    return s;
  }

  @Override
  public Node roots() {
    return new ContentAtom(label);
  }

  @Override
  public Node simplify(boolean keepSubtype, boolean keepRoles, boolean keepMorph, boolean keepEntity) {
    String t = keepSubtype || type.isEmpty() ? type : type.substring(0, 1);
    return new ContentAtom(label, t,
        keepRoles ? roles : "",
        keepMorph ? morph : "",
        keepEntity ? entity : "");
  }

  @Override
  public Node reduce(boolean keepSrl, boolean keepCoref, boolean keepNer) {
    String e = entity;
    String r = roles;
    if (!keepNer)
      e = "";
    if (!keepSrl && !type.isEmpty() && type.charAt(0) == 'P' && !roles.isEmpty())
      r = getRoleFields().get(0).replace("-", "");
    if (e.equals(entity) && r.equals(roles))
      return this;
    return new ContentAtom(label, type, r, morph, e);
  }

  @Override
  public String toString() {
    return AtomCodec.toString(this);
  }
}
