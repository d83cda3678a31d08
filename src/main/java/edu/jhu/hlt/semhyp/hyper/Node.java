package edu.jhu.hlt.semhyp.hyper;

import java.util.List;
import java.util.Set;

/**
 * Either an {@link Atom} or a {@link Hyperedge}. Nodes are immutable.
 */
public interface Node {

  boolean isAtom();

  /**
   * The (inferred) type code of this node, e.g. "Cc", "P", "Rd".
   * @throws MalformedEdgeException if the type cannot be determined.
   */
  String type();

  /** The major type, the first character of {@link #type()}. */
  default char mtype() {
    return type().charAt(0);
  }

  /**
   * Colon separated role fields governing the arguments of this node, or null
   * if not defined. The first field holds dependency roles, a second one (if
   * present) semantic roles.
   */
  List<String> argroleFields();

  /**
   * The first (dependency) role field of {@link #argroleFields()}, or null.
   */
  default String argroles() {
    List<String> f = argroleFields();
    return f == null ? null : f.get(0);
  }

  /** All atoms under this node (including itself if it is an atom). */
  Set<Atom> atoms();

  /** This node and every node under it. */
  Set<Node> subedges();

  /** Same structure with every atom reduced to its label. */
  Node roots();

  /**
   * Strips optional atom fields. The major type is always kept. Produces
   * {@link ContentAtom}s.
   */
  Node simplify(boolean keepSubtype, boolean keepRoles, boolean keepMorph, boolean keepEntity);

  /**
   * Removes annotation layers: named entity tags, semantic role information
   * (including arguments only present because of semantic roles) and
   * coreference edges.
   */
  Node reduce(boolean keepSrl, boolean keepCoref, boolean keepNer);
}
