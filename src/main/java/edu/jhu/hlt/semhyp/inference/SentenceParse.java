package edu.jhu.hlt.semhyp.inference;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import edu.jhu.hlt.semhyp.datatypes.Sentence;
import edu.jhu.hlt.semhyp.hyper.Node;
import edu.jhu.hlt.semhyp.hyper.TokenAtom;
import edu.jhu.hlt.semhyp.util.Diagnostic;

/**
 * The hyperedge built for one sentence, plus the edge every token ended up
 * heading and the atom every token became.
 */
public class SentenceParse {
  private final Sentence sentence;
  private final Node edge;
  private final Map<Integer, Node> tokenEdges;
  private final Map<Integer, TokenAtom> atoms;
  private final List<Diagnostic> diagnostics;

  public SentenceParse(Sentence sentence, Node edge, Map<Integer, Node> tokenEdges,
      Map<Integer, TokenAtom> atoms, List<Diagnostic> diagnostics) {
    this.sentence = sentence;
    this.edge = edge;
    this.tokenEdges = Collections.unmodifiableMap(tokenEdges);
    this.atoms = Collections.unmodifiableMap(atoms);
    this.diagnostics = Collections.unmodifiableList(new ArrayList<>(diagnostics));
  }

  /** A sentence which could not be parsed. */
  public static SentenceParse failed(Sentence sentence, Diagnostic why) {
    return new SentenceParse(sentence, null,
        Collections.<Integer, Node>emptyMap(),
        Collections.<Integer, TokenAtom>emptyMap(),
        Collections.singletonList(why));
  }

  /** Same parse with a different sentence edge and some more diagnostics. */
  public SentenceParse withEdge(Node newEdge, List<Diagnostic> moreDiagnostics) {
    List<Diagnostic> d = new ArrayList<>(diagnostics);
    d.addAll(moreDiagnostics);
    return new SentenceParse(sentence, newEdge, tokenEdges, atoms, d);
  }

  public Sentence getSentence() {
    return sentence;
  }

  /** Null if the sentence failed. */
  public Node getEdge() {
    return edge;
  }

  public boolean failed() {
    return edge == null;
  }

  public Map<Integer, Node> getTokenEdges() {
    return tokenEdges;
  }

  public Map<Integer, TokenAtom> getAtoms() {
    return atoms;
  }

  public List<Diagnostic> getDiagnostics() {
    return diagnostics;
  }

  @Override
  public String toString() {
    return "(SentenceParse " + sentence.getIndex() + " " + edge + ")";
  }
}
