package edu.jhu.hlt.semhyp.datatypes;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A view of one sentence in a {@link Document}. Token indices passed to and
 * returned from this class are document-global, which lets maps built for
 * different sentences be merged (see coreference).
 */
public class Sentence {

  private final Document doc;
  private final int index;
  private final Span span;

  private transient Map<Integer, List<LabeledSpan>> srl;

  public Sentence(Document doc, int index, Span span) {
    if (span.end > doc.size())
      throw new IllegalArgumentException("span=" + span + " doc.size=" + doc.size());
    this.doc = doc;
    this.index = index;
    this.span = span;
  }

  public Document getDocument() {
    return doc;
  }

  /** Index of this sentence in its document. */
  public int getIndex() {
    return index;
  }

  public Span getSpan() {
    return span;
  }

  public int start() {
    return span.start;
  }

  public int end() {
    return span.end;
  }

  public int size() {
    return span.width();
  }

  public boolean contains(int token) {
    return span.includes(token);
  }

  public String getWord(int i) { return doc.getWord(i); }
  public String getLemma(int i) { return doc.getLemma(i); }
  public String getPos(int i) { return doc.getPos(i); }
  public String getTag(int i) { return doc.getTag(i); }
  public String getDep(int i) { return doc.getDep(i); }
  public String getSynset(int i) { return doc.getSynset(i); }

  /** The head of i, or -1 for a root. */
  public int getHead(int i) {
    return doc.getHead(i);
  }

  /** Like {@link #getHead(int)}, but a root is its own head. */
  public int getHeadOrSelf(int i) {
    int h = doc.getHead(i);
    return h < 0 ? i : h;
  }

  public int[] getChildren(int i) {
    return doc.getDependencyParse().getChildren(i);
  }

  public List<Integer> getLefts(int i) {
    List<Integer> l = new ArrayList<>();
    for (int c : getChildren(i))
      if (c < i) l.add(c);
    return l;
  }

  public List<Integer> getRights(int i) {
    List<Integer> r = new ArrayList<>();
    for (int c : getChildren(i))
      if (c > i) r.add(c);
    return r;
  }

  public int getDepth(int i) {
    return doc.getDependencyParse().getDepth(i);
  }

  /** First token of this sentence whose head is outside of it (or is a root). */
  public int getRoot() {
    return getRoot(span);
  }

  /**
   * First token in s whose head is not in s, or s.start if there is no such
   * token (only possible with a cyclic parse).
   */
  public int getRoot(Span s) {
    for (int i = s.start; i < s.end; i++) {
      int h = doc.getHead(i);
      if (h < 0 || !s.includes(h))
        return i;
    }
    return s.start;
  }

  /**
   * Other members of the coordination which i is part of: walk up "conj"
   * links to the first conjunct, then collect right "conj" children
   * breadth-first. Does not include i.
   */
  public List<Integer> getConjuncts(int i) {
    int start = i;
    while (doc.getHead(start) >= 0 && "conj".equals(doc.getDep(start)))
      start = doc.getHead(start);
    List<Integer> queue = new ArrayList<>();
    queue.add(start);
    for (int k = 0; k < queue.size(); k++) {
      int word = queue.get(k);
      for (int c : getRights(word))
        if ("conj".equals(doc.getDep(c)))
          queue.add(c);
    }
    List<Integer> conjs = new ArrayList<>();
    for (int w : queue)
      if (w != i)
        conjs.add(w);
    return conjs;
  }

  /** Label of the first entity covering i, or the empty string. */
  public String getEntityLabel(int i) {
    for (LabeledSpan e : doc.getEntities())
      if (span.covers(e.getSpan()) && e.includes(i))
        return e.getLabel();
    return "";
  }

  /**
   * SRL frames whose predicate and arguments all fall inside this sentence.
   */
  public Map<Integer, List<LabeledSpan>> getSrl() {
    if (srl == null) {
      Map<Integer, List<LabeledSpan>> m = new LinkedHashMap<>();
      for (Map.Entry<Integer, List<LabeledSpan>> e : doc.getSrl().entrySet()) {
        if (!contains(e.getKey()))
          continue;
        boolean inside = true;
        for (LabeledSpan a : e.getValue())
          inside &= span.covers(a.getSpan());
        if (inside)
          m.put(e.getKey(), e.getValue());
      }
      srl = Collections.unmodifiableMap(m);
    }
    return srl;
  }

  public List<LabeledSpan> getSrlArgs(int predicate) {
    List<LabeledSpan> args = getSrl().get(predicate);
    return args == null ? Collections.<LabeledSpan>emptyList() : args;
  }

  /**
   * Role label of token with respect to a predicate: "V" for the predicate
   * itself, the label of the first argument covering token, or the empty
   * string.
   */
  public String getSrlLabel(int token, int predicate) {
    if (!getSrl().containsKey(predicate))
      return "";
    if (token == predicate)
      return "V";
    for (LabeledSpan a : getSrl().get(predicate))
      if (a.includes(token))
        return a.getLabel();
    return "";
  }

  /**
   * Coreference clusters restricted to this sentence: those whose main mention
   * lies inside it, keeping only the references which also do. Clusters left
   * without a reference are dropped.
   */
  public List<CorefCluster> getCorefClusters() {
    List<CorefCluster> cs = new ArrayList<>();
    for (CorefCluster c : doc.getCorefClusters()) {
      if (!span.covers(c.getMain().getSpan()))
        continue;
      List<LabeledSpan> refs = new ArrayList<>();
      for (LabeledSpan r : c.getRefs())
        if (span.covers(r.getSpan()))
          refs.add(r);
      if (!refs.isEmpty())
        cs.add(new CorefCluster(c.getId(), c.getMain(), refs));
    }
    return cs;
  }

  public String getText() {
    return doc.getText(span);
  }

  @Override
  public String toString() {
    return "(Sentence " + doc.getId() + "#" + index + " " + getText() + ")";
  }
}
