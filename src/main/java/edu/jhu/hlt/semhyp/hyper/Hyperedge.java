package edu.jhu.hlt.semhyp.hyper;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import com.google.common.collect.ImmutableList;

/**
 * An ordered, non-empty sequence of nodes. The first element is the
 * connector: its major type determines the type of the whole edge and how
 * the remaining elements (the arguments) are to be read.
 *
 * Equality is element-wise, so it is structural over {@link ContentAtom}s and
 * identity-sensitive wherever {@link TokenAtom}s are involved.
 */
public final class Hyperedge implements Node, Iterable<Node> {

  private final ImmutableList<Node> children;
  private int hashCode = 0;

  public Hyperedge(List<? extends Node> children) {
    if (children == null || children.isEmpty())
      throw new IllegalArgumentException("hyperedges must have at least a connector");
    this.children = ImmutableList.copyOf(children);
  }

  public static Hyperedge of(Node... children) {
    return new Hyperedge(ImmutableList.copyOf(children));
  }

  @Override
  public boolean isAtom() {
    return false;
  }

  public int size() {
    return children.size();
  }

  public Node get(int i) {
    return children.get(i);
  }

  public Node getConnector() {
    return children.get(0);
  }

  /** Every element after the connector. */
  public List<Node> getArgs() {
    return children.subList(1, children.size());
  }

  public List<Node> getChildren() {
    return children;
  }

  /** True if n is one of the elements of this edge (not a recursive search). */
  public boolean hasMember(Node n) {
    return children.contains(n);
  }

  @Override
  public Iterator<Node> iterator() {
    return children.iterator();
  }

  @Override
  public String type() {
    String ct = getConnector().type();
    if (ct.isEmpty())
      throw new MalformedEdgeException("connector has no type", this);
    String subtype = ct.substring(1);
    switch (ct.charAt(0)) {
    case 'P':
      return "R" + subtype;
    case 'T':
      return "S" + subtype;
    case 'B':
      return "C" + subtype;
    case 'M':
      // modifiers are transparent
      if (size() < 2)
        throw new MalformedEdgeException("modifier without argument", this);
      return get(1).type();
    case 'J':
      if (size() < 2)
        throw new MalformedEdgeException("conjunction without argument", this);
      return String.valueOf(get(1).mtype());
    default:
      throw new MalformedEdgeException("Edge is malformed, type cannot be determined", this);
    }
  }

  /**
   * Defined for relations and concepts built by a predicate or builder
   * connector, e.g. ((not/M is/P.sc) bob/C sad/C) has "sc" and
   * (of/B.ma city/C berlin/C) has "ma", and for predicate/builder edges like
   * (not/M is/P.sc) itself.
   */
  @Override
  public List<String> argroleFields() {
    char et = mtype();
    if (et == 'R' || et == 'C') {
      char ct = getConnector().mtype();
      if (ct == 'B' || ct == 'P')
        return getConnector().argroleFields();
    }
    if (et != 'B' && et != 'P')
      return null;
    return children.get(children.size() - 1).argroleFields();
  }

  @Override
  public Set<Atom> atoms() {
    Set<Atom> atoms = new LinkedHashSet<>();
    for (Node n : children)
      atoms.addAll(n.atoms());
    return atoms;
  }

  @Override
  public Set<Node> subedges() {
    Set<Node> edges = new LinkedHashSet<>();
    edges.add(this);
    for (Node n : children)
      edges.addAll(n.subedges());
    return edges;
  }

  @Override
  public Node roots() {
    List<Node> r = new ArrayList<>(size());
    for (Node n : children)
      r.add(n.roots());
    return new Hyperedge(r);
  }

  @Override
  public Node simplify(boolean keepSubtype, boolean keepRoles, boolean keepMorph, boolean keepEntity) {
    List<Node> s = new ArrayList<>(size());
    for (Node n : children)
      s.add(n.simplify(keepSubtype, keepRoles, keepMorph, keepEntity));
    return new Hyperedge(s);
  }

  @Override
  public Node reduce(boolean keepSrl, boolean keepCoref, boolean keepNer) {
    Node conn = getConnector();
    if (!keepCoref && size() > 1 && "Jc".equals(conn.type()))
      return get(1).reduce(keepSrl, keepCoref, keepNer);

    List<Node> r = new ArrayList<>(size());
    r.add(conn.reduce(keepSrl, keepCoref, keepNer));
    String depRoles = conn.mtype() == 'P' ? conn.argroles() : null;
    boolean dropImplicit = !keepSrl && depRoles != null && depRoles.indexOf('-') >= 0;
    for (int i = 1; i < size(); i++) {
      // '-' marks an argument which only semantic roles know about
      if (dropImplicit && i - 1 < depRoles.length() && depRoles.charAt(i - 1) == '-')
        continue;
      r.add(get(i).reduce(keepSrl, keepCoref, keepNer));
    }
    return new Hyperedge(r);
  }

  @Override
  public int hashCode() {
    if (hashCode == 0)
      hashCode = children.hashCode();
    return hashCode;
  }

  @Override
  public boolean equals(Object other) {
    if (this == other)
      return true;
    if (other instanceof Hyperedge) {
      Hyperedge e = (Hyperedge) other;
      if (hashCode() != e.hashCode())
        return false;
      return children.equals(e.children);
    }
    return false;
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder("(");
    for (int i = 0; i < children.size(); i++) {
      if (i > 0)
        sb.append(' ');
      sb.append(children.get(i).toString());
    }
    sb.append(')');
    return sb.toString();
  }
}
