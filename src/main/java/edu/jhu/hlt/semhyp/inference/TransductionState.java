package edu.jhu.hlt.semhyp.inference;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.apache.log4j.Logger;

import edu.jhu.hlt.semhyp.datatypes.Sentence;
import edu.jhu.hlt.semhyp.hyper.TokenAtom;
import edu.jhu.hlt.semhyp.util.Diagnostic;

/**
 * Everything the transducer knows about one sentence while it folds tokens
 * into their heads. Keyed by (document-global) token index.
 */
public class TransductionState {
  public static final Logger LOG = Logger.getLogger(TransductionState.class);

  private final Sentence sentence;

  // token -> partial edge headed by that token
  private final Map<Integer, Fragment> edges = new LinkedHashMap<>();
  private final Map<Integer, TokenAtom> atoms = new LinkedHashMap<>();
  private final Map<Integer, Character> majorTypes = new HashMap<>();

  // insertion ordered: hidden arguments are resolved in this order
  private final Map<Integer, Fragment> predicates = new LinkedHashMap<>();
  private final Set<Integer> conjuncts = new HashSet<>();
  private final Set<Integer> caseMarked = new HashSet<>();

  // every partial edge a token has headed, oldest first
  private final Map<Integer, List<Fragment>> history = new HashMap<>();

  private final List<Diagnostic> diagnostics = new ArrayList<>();

  public TransductionState(Sentence sentence) {
    this.sentence = sentence;
  }

  public Sentence getSentence() {
    return sentence;
  }

  public void addToken(int token, TokenAtom atom) {
    if (atoms.containsKey(token))
      throw new IllegalStateException("token " + token + " already has an atom");
    Fragment leaf = Fragment.leaf(atom);
    atoms.put(token, atom);
    edges.put(token, leaf);
    majorTypes.put(token, atom.type().charAt(0));
    List<Fragment> h = new ArrayList<>();
    h.add(leaf);
    history.put(token, h);
  }

  public TokenAtom getAtom(int token) {
    return atoms.get(token);
  }

  public Map<Integer, TokenAtom> getAtoms() {
    return Collections.unmodifiableMap(atoms);
  }

  /** The major type of token's atom, or 0 if it has none (punctuation). */
  public char getMajorType(int token) {
    Character c = majorTypes.get(token);
    return c == null ? 0 : c;
  }

  /** May be null for punctuation. */
  public Fragment getEdge(int token) {
    return edges.get(token);
  }

  public void setEdge(int token, Fragment edge) {
    edges.put(token, edge);
  }

  public Map<Integer, Fragment> getEdges() {
    return Collections.unmodifiableMap(edges);
  }

  public boolean isPredicate(int token) {
    return predicates.containsKey(token);
  }

  public void setPredicate(int token, Fragment relation) {
    predicates.put(token, relation);
  }

  public Map<Integer, Fragment> getPredicates() {
    return Collections.unmodifiableMap(predicates);
  }

  public boolean isConjunct(int token) {
    return conjuncts.contains(token);
  }

  public void addConjunct(int token) {
    conjuncts.add(token);
  }

  public boolean isCaseMarked(int token) {
    return caseMarked.contains(token);
  }

  public void markCase(int token) {
    caseMarked.add(token);
  }

  /** Remembers the current edge of token, if it is a token with an atom. */
  public void recordHistory(int token) {
    List<Fragment> h = history.get(token);
    Fragment e = edges.get(token);
    if (h != null && e != null)
      h.add(e);
  }

  /** Null if the token never had an atom. */
  public List<Fragment> getHistory(int token) {
    List<Fragment> h = history.get(token);
    return h == null ? null : Collections.unmodifiableList(h);
  }

  public void addDiagnostic(Diagnostic.Kind kind, int token, String message) {
    Diagnostic d = new Diagnostic(kind, token, message);
    LOG.warn("[" + sentence.getDocument().getId() + "#" + sentence.getIndex() + "] " + d);
    diagnostics.add(d);
  }

  public List<Diagnostic> getDiagnostics() {
    return Collections.unmodifiableList(diagnostics);
  }
}
