package edu.jhu.hlt.semhyp.inference;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import edu.jhu.hlt.semhyp.datatypes.Document;
import edu.jhu.hlt.semhyp.hyper.Node;
import edu.jhu.hlt.semhyp.util.Diagnostic;

/**
 * One hyperedge per sentence of a document, after coreference substitution.
 * Sentences which failed have a null edge and a
 * {@link Diagnostic.Kind#SENTENCE_FAILED} diagnostic.
 */
public class DocumentParse {
  private final Document document;
  private final List<SentenceParse> sentences;
  private final List<Node> edges;
  private final List<Diagnostic> corefDiagnostics;

  public DocumentParse(Document document, List<SentenceParse> sentences, List<Node> edges,
      List<Diagnostic> corefDiagnostics) {
    if (sentences.size() != edges.size())
      throw new IllegalArgumentException("sentences=" + sentences.size() + " edges=" + edges.size());
    this.document = document;
    this.sentences = Collections.unmodifiableList(new ArrayList<>(sentences));
    this.edges = Collections.unmodifiableList(new ArrayList<>(edges));
    this.corefDiagnostics = Collections.unmodifiableList(new ArrayList<>(corefDiagnostics));
  }

  public Document getDocument() {
    return document;
  }

  /** Per sentence results, edges before coreference substitution. */
  public List<SentenceParse> getSentenceParses() {
    return sentences;
  }

  /** Final edges, in sentence order. */
  public List<Node> getEdges() {
    return edges;
  }

  public Node getEdge(int sentenceIndex) {
    return edges.get(sentenceIndex);
  }

  /** Everything that went wrong, per sentence first and then coreference. */
  public List<Diagnostic> getDiagnostics() {
    List<Diagnostic> all = new ArrayList<>();
    for (SentenceParse p : sentences)
      all.addAll(p.getDiagnostics());
    all.addAll(corefDiagnostics);
    return all;
  }

  @Override
  public String toString() {
    return "(DocumentParse " + document.getId() + " sentences=" + sentences.size() + ")";
  }
}
