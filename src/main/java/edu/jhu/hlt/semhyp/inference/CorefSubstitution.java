package edu.jhu.hlt.semhyp.inference;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

import org.apache.log4j.Logger;

import com.google.common.collect.ImmutableSet;

import edu.jhu.hlt.semhyp.datatypes.CorefCluster;
import edu.jhu.hlt.semhyp.datatypes.Document;
import edu.jhu.hlt.semhyp.datatypes.LabeledSpan;
import edu.jhu.hlt.semhyp.datatypes.Span;
import edu.jhu.hlt.semhyp.features.RoleTables;
import edu.jhu.hlt.semhyp.hyper.Atom;
import edu.jhu.hlt.semhyp.hyper.Hyperedge;
import edu.jhu.hlt.semhyp.hyper.Hyperedges;
import edu.jhu.hlt.semhyp.hyper.Node;
import edu.jhu.hlt.semhyp.hyper.TokenAtom;
import edu.jhu.hlt.semhyp.util.Diagnostic;

/**
 * Replaces each reference mention of a coreference cluster (e.g. "he") with
 * (+/Jc.rm.&lt;ref&gt;&lt;main&gt; ref main) in the edge of the sentence the
 * reference is in. Runs after every sentence of a document has been
 * transduced, so main mentions may come from other sentences.
 */
public class CorefSubstitution {
  public static final Logger LOG = Logger.getLogger(CorefSubstitution.class);

  /** Connector types of edges which may cover more than a mention. */
  private static final Set<String> NARROWED = ImmutableSet.of("J", "Br", "Bp", "Jr");

  private final Document doc;
  private final Map<Integer, Node> tokenEdges = new HashMap<>();
  private final Set<Integer> tokensWithAtoms = new HashSet<>();
  private final Map<Integer, Integer> sentenceToPosition = new HashMap<>();
  private final List<Node> sentenceEdges = new ArrayList<>();
  private final List<Diagnostic> diagnostics = new ArrayList<>();

  private CorefSubstitution(Document doc, List<SentenceParse> parses) {
    this.doc = doc;
    for (SentenceParse p : parses) {
      tokenEdges.putAll(p.getTokenEdges());
      tokensWithAtoms.addAll(p.getAtoms().keySet());
      sentenceToPosition.put(p.getSentence().getIndex(), sentenceEdges.size());
      sentenceEdges.add(p.getEdge());
    }
  }

  /**
   * @param parses sentences of one document (failed ones included).
   * @param diagnostics receives problems with mentions.
   * @return the edges of the given sentences, in the same order, with
   * references substituted.
   */
  public static List<Node> apply(List<SentenceParse> parses, List<CorefCluster> clusters,
      List<Diagnostic> diagnostics) {
    if (parses.isEmpty())
      return new ArrayList<>();
    CorefSubstitution cs = new CorefSubstitution(parses.get(0).getSentence().getDocument(), parses);
    for (CorefCluster c : clusters)
      cs.substitute(c);
    diagnostics.addAll(cs.diagnostics);
    return cs.sentenceEdges;
  }

  private void substitute(CorefCluster c) {
    LabeledSpan main = c.getMain();
    int mainRoot = findMentionRoot(main.getSpan());
    if (mainRoot < 0) {
      warn(main, c);
      return;
    }
    Node mainEdge = narrow(tokenEdges.get(mainRoot), main.getSpan());
    String mainText = doc.getText(main.getSpan());

    for (LabeledSpan ref : c.getRefs()) {
      if (doc.getText(ref.getSpan()).equalsIgnoreCase(mainText))
        continue;
      int refRoot = findMentionRoot(ref.getSpan());
      if (refRoot < 0) {
        warn(ref, c);
        continue;
      }
      Node refEdge = narrow(tokenEdges.get(refRoot), ref.getSpan());

      String roles = RoleTables.corefRole(doc.getPos(refRoot)) + RoleTables.corefRole(doc.getPos(mainRoot));
      TokenAtom connector = TokenAtom.synthetic("+", "Jc", "rm", roles, "");
      Node corefEdge = Hyperedge.of(connector, refEdge, mainEdge);

      Integer pos = sentenceToPosition.get(doc.getSentenceOf(refRoot).getIndex());
      if (pos == null || sentenceEdges.get(pos) == null)
        continue;
      sentenceEdges.set(pos, Hyperedges.replace(sentenceEdges.get(pos), refEdge, corefEdge));
    }
  }

  private void warn(LabeledSpan mention, CorefCluster c) {
    Diagnostic d = new Diagnostic(Diagnostic.Kind.MENTION_WITHOUT_EDGE, mention.getStart(),
        "no token of mention \"" + doc.getText(mention.getSpan()) + "\" in cluster " + c.getId() + " has an edge");
    LOG.warn("[coref] " + d);
    diagnostics.add(d);
  }

  /**
   * The syntactic root of the mention if it has an edge, else the first token
   * with an edge whose head is outside of the mention, else the first token
   * with an edge, else -1.
   */
  int findMentionRoot(Span mention) {
    int root = doc.getSentenceOf(mention.start).getRoot(mention);
    if (tokenEdges.containsKey(root))
      return root;
    for (int i = mention.start; i < mention.end; i++) {
      int h = doc.getHead(i);
      boolean headInside = h < 0 || mention.includes(h);
      if (tokenEdges.containsKey(i) && !headInside)
        return i;
    }
    for (int i = mention.start; i < mention.end; i++)
      if (tokenEdges.containsKey(i))
        return i;
    return -1;
  }

  /**
   * For edges which can cover more than the mention (coordinations,
   * prepositional and relative constructions): the first subedge, in
   * depth-first order, covering exactly the mention's tokens. The edge itself
   * if there is none.
   */
  Node narrow(Node edge, Span mention) {
    if (edge.isAtom() || !NARROWED.contains(connectorType((Hyperedge) edge)))
      return edge;
    Set<Integer> mentionTokens = new TreeSet<>();
    for (int i = mention.start; i < mention.end; i++)
      if (tokensWithAtoms.contains(i))
        mentionTokens.add(i);
    Deque<Node> stack = new ArrayDeque<>();
    stack.push(edge);
    while (!stack.isEmpty()) {
      Node e = stack.pop();
      if (Hyperedges.coveredTokens(e).equals(mentionTokens))
        return e;
      if (!e.isAtom()) {
        Hyperedge he = (Hyperedge) e;
        for (int i = he.size() - 1; i >= 0; i--)
          stack.push(he.get(i));
      }
    }
    return edge;
  }

  private static String connectorType(Hyperedge e) {
    Node conn = e.getConnector();
    if (conn.isAtom() && !((Atom) conn).hasType())
      return "";
    return conn.type();
  }
}
