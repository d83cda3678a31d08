package edu.jhu.hlt.semhyp.hyper;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Parsing and whole-tree operations on {@link Node}s.
 */
public class Hyperedges {

  private static final Object OPEN = new Object();

  /**
   * Parses the parenthesized form, e.g. "((not/M is/P.sc) bob/Cp sad/Ca)".
   * A single atom without parentheses is also accepted.
   * @throws EdgeSyntaxException
   */
  public static Node parse(String source) {
    if (source == null)
      throw new IllegalArgumentException();
    String[] toks = source.replace("(", " ( ").replace(")", " ) ").trim().split("\\s+");
    if (toks.length == 1 && toks[0].isEmpty())
      throw new EdgeSyntaxException("nothing to parse", source);

    // contains OPEN markers and Nodes
    Deque<Object> stack = new ArrayDeque<>();
    for (String t : toks) {
      if ("(".equals(t)) {
        stack.push(OPEN);
      } else if (")".equals(t)) {
        List<Node> items = new ArrayList<>();
        while (!stack.isEmpty() && stack.peek() != OPEN)
          items.add(0, (Node) stack.pop());
        if (stack.isEmpty())
          throw new EdgeSyntaxException("unbalanced ')'", source);
        stack.pop();
        if (items.isEmpty())
          throw new EdgeSyntaxException("empty edge", source);
        stack.push(new Hyperedge(items));
      } else {
        try {
          stack.push(AtomCodec.parse(t));
        } catch (EdgeSyntaxException e) {
          throw new EdgeSyntaxException(e.getMessage(), source);
        }
      }
    }
    if (stack.size() != 1)
      throw new EdgeSyntaxException(stack.contains(OPEN) ? "unbalanced '('" : "more than one top-level node", source);
    Object top = stack.pop();
    if (top == OPEN)
      throw new EdgeSyntaxException("unbalanced '('", source);
    return (Node) top;
  }

  /** True if atom occurs anywhere under (or is) n. */
  public static boolean containsAtom(Node n, Atom atom) {
    if (n.isAtom())
      return n.equals(atom);
    for (Node c : (Hyperedge) n)
      if (containsAtom(c, atom))
        return true;
    return false;
  }

  /**
   * Rebuilds edge with every occurrence of src replaced by tgt. Nodes which do
   * not contain src are returned as-is.
   */
  public static Node replace(Node edge, Node src, Node tgt) {
    if (edge.equals(src))
      return tgt;
    if (edge.isAtom())
      return edge;
    Hyperedge e = (Hyperedge) edge;
    List<Node> children = new ArrayList<>(e.size());
    boolean changed = false;
    for (Node c : e) {
      Node r = replace(c, src, tgt);
      changed |= r != c;
      children.add(r);
    }
    return changed ? new Hyperedge(children) : edge;
  }

  /**
   * Indices of the tokens which the {@link TokenAtom}s under n stand for.
   * Synthetic and content atoms do not cover any token.
   */
  public static Set<Integer> coveredTokens(Node n) {
    Set<Integer> toks = new TreeSet<>();
    for (Atom a : n.atoms()) {
      if (a instanceof TokenAtom) {
        TokenAtom ta = (TokenAtom) a;
        if (!ta.isSynthetic())
          toks.add(ta.getToken());
      }
    }
    return toks;
  }
}
