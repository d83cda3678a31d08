package edu.jhu.hlt.semhyp.hyper;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.apache.commons.lang3.StringUtils;
import org.apache.log4j.Logger;

import edu.jhu.hlt.semhyp.util.Diagnostic;

/**
 * Renders a hyperedge back into an approximate sentence, e.g.
 * ((not/M is/P.sc) bob/Cp sad/Ca) becomes "bob not is sad". Useful for
 * eyeballing parser output; this is not a surface realizer.
 */
public class EdgeLinearizer {
  public static final Logger LOG = Logger.getLogger(EdgeLinearizer.class);

  /** Text plus anything that could not be rendered properly. */
  public static class Linearization {
    private final String text;
    private final List<Diagnostic> diagnostics;

    public Linearization(String text, List<Diagnostic> diagnostics) {
      this.text = text;
      this.diagnostics = Collections.unmodifiableList(diagnostics);
    }

    public String getText() {
      return text;
    }

    public List<Diagnostic> getDiagnostics() {
      return diagnostics;
    }

    @Override
    public String toString() {
      return text;
    }
  }

  /**
   * Never fails: connectors which cannot be read are reported as
   * {@link Diagnostic.Kind#UNRECOGNIZED_CONNECTOR} and rendered as a plain join.
   */
  public static Linearization linearize(Node edge) {
    List<Diagnostic> diags = new ArrayList<>();
    String text = render(edge, null, diags);
    return new Linearization(text, diags);
  }

  /**
   * @param subedge an argument which must be kept even if its dependency role
   * marks it as implicit (used for relative clauses whose head noun was
   * spliced into the clause).
   */
  private static String render(Node edge, Node subedge, List<Diagnostic> diags) {
    if (edge.isAtom())
      return ((Atom) edge).getLabel();

    Hyperedge e = (Hyperedge) edge;
    Node conn = e.getConnector();
    List<Node> args = e.getArgs();
    String txtConn = render(conn, null, diags);
    List<String> txtArgs = new ArrayList<>(args.size());
    for (Node a : args)
      txtArgs.add(render(a, null, diags));
    String ct;
    try {
      ct = conn.type();
    } catch (MalformedEdgeException ex) {
      return unrecognized(conn, "untyped", txtConn, txtArgs, diags);
    }

    if (ct.equals("J")) {
      if (txtArgs.isEmpty())
        return txtConn;
      String init = StringUtils.join(txtArgs.subList(0, txtArgs.size() - 1), ",");
      return join(init, txtConn, txtArgs.get(txtArgs.size() - 1));
    }

    if (ct.equals("Ml")) {
      List<String> t = new ArrayList<>(txtArgs);
      t.add(txtConn);
      return join(t);
    }

    if (ct.charAt(0) == 'T' || ct.charAt(0) == 'M')
      return join(prepend(txtConn, txtArgs));

    if (ct.equals("Bp")) {
      if (txtArgs.isEmpty())
        return txtConn;
      txtArgs.set(0, txtArgs.get(0) + txtConn);
      return join(txtArgs);
    }

    // coreference: say the reference, not what it refers to
    if (ct.equals("Jc"))
      return txtArgs.isEmpty() ? "" : txtArgs.get(0);

    if (ct.equals("B") || ct.equals("Br") || ct.equals("Ba"))
      return join(txtArgs);

    if (ct.charAt(0) == 'P')
      return renderRelation(conn, txtConn, args, txtArgs, subedge);

    if (ct.equals("Jr")) {
      if (args.size() < 2)
        return join(txtArgs);
      Node head = args.get(0);
      Node clause = args.get(1);
      if (clause.isAtom() || !((Hyperedge) clause).hasMember(head))
        return join(txtArgs);
      return render(clause, head, diags);
    }

    if (ct.equals("C"))
      return join(prepend(txtConn, txtArgs));

    return unrecognized(conn, ct, txtConn, txtArgs, diags);
  }

  private static String unrecognized(Node conn, String ct, String txtConn, List<String> txtArgs,
      List<Diagnostic> diags) {
    Diagnostic d = new Diagnostic(Diagnostic.Kind.UNRECOGNIZED_CONNECTOR,
        "don't know how to linearize connector " + conn + " of type " + ct);
    LOG.warn("[linearize] " + d.getMessage());
    diags.add(d);
    return join(prepend(txtConn, txtArgs));
  }

  /**
   * Arguments go left or right of the predicate. When fewer than four role
   * fields are available, the side is guessed from the dependency roles:
   * subjects ("s"), "_" and the lowest numbered semantic role go left.
   */
  private static String renderRelation(Node conn, String txtConn,
      List<Node> args, List<String> txtArgs, Node subedge) {
    List<String> roles = conn.argroleFields();
    if (roles == null || roles.isEmpty())
      roles = Collections.singletonList(StringUtils.repeat('r', args.size()));

    String depRoles = roles.get(0);
    String lrRoles;
    if (roles.size() > 1)
      lrRoles = roles.get(roles.size() - 1);
    else
      lrRoles = StringUtils.repeat('r', depRoles.length());

    if (roles.size() < 4) {
      int min = 9;
      for (char c : roles.get(roles.size() - 1).toCharArray())
        if (Character.isDigit(c))
          min = Math.min(min, c - '0');
      String leftRoles = "_s" + min;
      StringBuilder lr = new StringBuilder();
      for (char r : depRoles.toCharArray())
        lr.append(leftRoles.indexOf(r) >= 0 ? 'l' : 'r');
      lrRoles = lr.toString();
    }

    List<String> lefts = new ArrayList<>();
    List<String> rights = new ArrayList<>();
    int n = Math.min(Math.min(depRoles.length(), lrRoles.length()), args.size());
    for (int i = 0; i < n; i++) {
      // implicit arguments are not said, unless they are what a relative clause is about
      if (depRoles.charAt(i) == '-' && (subedge == null || !subedge.equals(args.get(i))))
        continue;
      char lr = lrRoles.charAt(i);
      if (lr == 'l')
        lefts.add(txtArgs.get(i));
      else if (lr == 'r')
        rights.add(txtArgs.get(i));
    }
    List<String> all = new ArrayList<>(lefts);
    all.add(txtConn);
    all.addAll(rights);
    return join(all);
  }

  private static List<String> prepend(String first, List<String> rest) {
    List<String> l = new ArrayList<>(rest.size() + 1);
    l.add(first);
    l.addAll(rest);
    return l;
  }

  private static String join(String... parts) {
    List<String> l = new ArrayList<>(parts.length);
    Collections.addAll(l, parts);
    return join(l);
  }

  /** Space separated, skipping empty pieces. */
  private static String join(List<String> parts) {
    List<String> nonEmpty = new ArrayList<>(parts.size());
    for (String p : parts)
      if (StringUtils.isNotEmpty(p))
        nonEmpty.add(p);
    return StringUtils.join(nonEmpty, ' ');
  }
}
