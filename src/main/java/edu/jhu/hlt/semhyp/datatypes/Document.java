package edu.jhu.hlt.semhyp.datatypes;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A tokenized, tagged and dependency parsed document, plus the optional span
 * annotations the hyperedge parser consumes: named entities, semantic role
 * labels (grouped by predicate token) and coreference clusters.
 *
 * All token indices are document-global. Sentences are contiguous and given
 * by their first token.
 */
public class Document {

  private String id;

  private String[] words;
  private boolean[] spaces;
  private String[] lemmas;
  private String[] pos;
  private String[] tags;
  private DependencyParse deps;

  // sorted, first is always 0
  private int[] sentenceStarts;

  // may contain nulls
  private String[] rolesets;
  private String[] synsets;

  private List<LabeledSpan> entities;
  private Map<Integer, List<LabeledSpan>> srl;
  private List<CorefCluster> coref;

  private transient List<Sentence> sentences;

  public Document(
      String id,
      String[] words,
      boolean[] spaces,
      String[] lemmas,
      String[] pos,
      String[] tags,
      DependencyParse deps,
      int[] sentenceStarts) {
    if (id == null || words == null || deps == null || sentenceStarts == null)
      throw new IllegalArgumentException();
    final int n = words.length;
    if (spaces != null && spaces.length != n)
      throw new IllegalArgumentException("spaces.length=" + spaces.length + " n=" + n);
    if (lemmas != null && lemmas.length != n)
      throw new IllegalArgumentException("lemmas.length=" + lemmas.length + " n=" + n);
    if (pos.length != n || tags.length != n || deps.size() != n)
      throw new IllegalArgumentException("pos/tag/dependency arrays do not match " + n + " words");
    if (n > 0 && (sentenceStarts.length == 0 || sentenceStarts[0] != 0))
      throw new IllegalArgumentException("first sentence must start at 0: " + Arrays.toString(sentenceStarts));
    for (int i = 1; i < sentenceStarts.length; i++) {
      if (sentenceStarts[i] <= sentenceStarts[i - 1] || sentenceStarts[i] >= n)
        throw new IllegalArgumentException("bad sentence starts: " + Arrays.toString(sentenceStarts));
    }

    this.id = id;
    this.words = words;
    if (spaces == null) {
      spaces = new boolean[n];
      Arrays.fill(spaces, true);
    }
    this.spaces = spaces;
    this.lemmas = lemmas;
    this.pos = pos;
    this.tags = tags;
    this.deps = deps;
    this.sentenceStarts = sentenceStarts;
    this.rolesets = new String[n];
    this.synsets = new String[n];
    this.entities = new ArrayList<>();
    this.srl = new LinkedHashMap<>();
    this.coref = new ArrayList<>();
  }

  public String getId() {
    return id;
  }

  public int size() {
    return words.length;
  }

  public String getWord(int i) {
    return words[i];
  }

  public boolean hasSpaceAfter(int i) {
    return spaces[i];
  }

  /** Falls back on the word if there are no lemmas. */
  public String getLemma(int i) {
    if (lemmas == null || lemmas[i] == null)
      return words[i];
    return lemmas[i];
  }

  public String getPos(int i) {
    return pos[i];
  }

  public String getTag(int i) {
    return tags[i];
  }

  public String getDep(int i) {
    return deps.getLabel(i);
  }

  public int getHead(int i) {
    return deps.getHead(i);
  }

  public DependencyParse getDependencyParse() {
    return deps;
  }

  public String getRoleset(int i) {
    return rolesets[i];
  }

  public void setRoleset(int i, String roleset) {
    rolesets[i] = roleset;
  }

  public String getSynset(int i) {
    return synsets[i];
  }

  public void setSynset(int i, String synset) {
    synsets[i] = synset;
  }

  public void addEntity(LabeledSpan entity) {
    entities.add(entity);
  }

  public List<LabeledSpan> getEntities() {
    return Collections.unmodifiableList(entities);
  }

  /**
   * @param args the argument spans of this predicate, optionally including the
   * predicate's own span labeled "V".
   */
  public void addSrl(int predicate, List<LabeledSpan> args) {
    if (predicate < 0 || predicate >= size())
      throw new IllegalArgumentException("predicate=" + predicate);
    List<LabeledSpan> old = srl.put(predicate, Collections.unmodifiableList(new ArrayList<>(args)));
    if (old != null)
      throw new IllegalArgumentException("two SRL frames for predicate " + predicate);
  }

  /** predicate token to argument spans, in the order they were added */
  public Map<Integer, List<LabeledSpan>> getSrl() {
    return Collections.unmodifiableMap(srl);
  }

  public boolean hasSrl() {
    return !srl.isEmpty();
  }

  public void addCorefCluster(CorefCluster c) {
    coref.add(c);
  }

  public List<CorefCluster> getCorefClusters() {
    return Collections.unmodifiableList(coref);
  }

  public int getNumSentences() {
    return sentenceStarts.length;
  }

  public List<Sentence> getSentences() {
    if (sentences == null) {
      List<Sentence> ss = new ArrayList<>();
      for (int i = 0; i < sentenceStarts.length; i++) {
        int s = sentenceStarts[i];
        int e = i + 1 < sentenceStarts.length ? sentenceStarts[i + 1] : size();
        ss.add(new Sentence(this, i, Span.getSpan(s, e)));
      }
      sentences = Collections.unmodifiableList(ss);
    }
    return sentences;
  }

  public Sentence getSentence(int sentenceIndex) {
    return getSentences().get(sentenceIndex);
  }

  /** The sentence which contains the given token. */
  public Sentence getSentenceOf(int token) {
    if (token < 0 || token >= size())
      throw new IllegalArgumentException("token=" + token);
    int k = Arrays.binarySearch(sentenceStarts, token);
    if (k < 0)
      k = -(k + 1) - 1;
    return getSentence(k);
  }

  /** Words joined by their trailing whitespace, trimmed. */
  public String getText(Span s) {
    StringBuilder sb = new StringBuilder();
    for (int i = s.start; i < s.end; i++) {
      sb.append(words[i]);
      if (spaces[i])
        sb.append(' ');
    }
    return sb.toString().trim();
  }

  @Override
  public String toString() {
    return "(Document " + id + " tokens=" + size() + " sentences=" + getNumSentences() + ")";
  }
}
