package edu.jhu.hlt.semhyp.inference;

import java.util.ArrayList;
import java.util.List;

import org.apache.log4j.Level;
import org.apache.log4j.Logger;

import edu.jhu.hlt.semhyp.datatypes.CorefCluster;
import edu.jhu.hlt.semhyp.datatypes.DependencyParse;
import edu.jhu.hlt.semhyp.datatypes.Document;
import edu.jhu.hlt.semhyp.datatypes.LabeledSpan;

/**
 * Hand built documents for tests. Heads are document-global token indices,
 * -1 for a root.
 */
public class TestingUtil {

  public static void silenceLogs() {
    Logger.getLogger(TransductionState.class).setLevel(Level.ERROR);
    Logger.getLogger(HyperedgeParser.class).setLevel(Level.ERROR);
    Logger.getLogger(CorefSubstitution.class).setLevel(Level.ERROR);
  }

  public static class DocBuilder {
    private final String id;
    private final List<String> words = new ArrayList<>();
    private final List<String> lemmas = new ArrayList<>();
    private final List<String> pos = new ArrayList<>();
    private final List<String> tags = new ArrayList<>();
    private final List<String> deps = new ArrayList<>();
    private final List<Integer> heads = new ArrayList<>();
    private final List<Integer> starts = new ArrayList<>();
    private final List<LabeledSpan> entities = new ArrayList<>();
    private final List<Integer> srlPredicates = new ArrayList<>();
    private final List<List<LabeledSpan>> srlArgs = new ArrayList<>();
    private final List<CorefCluster> clusters = new ArrayList<>();

    public DocBuilder(String id) {
      this.id = id;
      starts.add(0);
    }

    /** Lemma is the lower-cased word. */
    public DocBuilder tok(String word, String pos, String tag, String dep, int head) {
      return tok(word, word.toLowerCase(), pos, tag, dep, head);
    }

    public DocBuilder tok(String word, String lemma, String pos, String tag, String dep, int head) {
      words.add(word);
      lemmas.add(lemma);
      this.pos.add(pos);
      tags.add(tag);
      deps.add(dep);
      heads.add(head);
      return this;
    }

    /** The next token starts a new sentence. */
    public DocBuilder newSentence() {
      starts.add(words.size());
      return this;
    }

    public DocBuilder entity(int start, int end, String label) {
      entities.add(new LabeledSpan(start, end, label));
      return this;
    }

    /** args alternate start, end, label; a "V" span for the predicate is added. */
    public DocBuilder srl(int predicate, Object... args) {
      List<LabeledSpan> l = new ArrayList<>();
      for (int i = 0; i < args.length; i += 3)
        l.add(new LabeledSpan((Integer) args[i], (Integer) args[i + 1], (String) args[i + 2]));
      l.add(new LabeledSpan(predicate, predicate + 1, "V"));
      srlPredicates.add(predicate);
      srlArgs.add(l);
      return this;
    }

    public DocBuilder coref(int id, LabeledSpan main, LabeledSpan... refs) {
      List<LabeledSpan> r = new ArrayList<>();
      for (LabeledSpan s : refs)
        r.add(s);
      clusters.add(new CorefCluster(id, main, r));
      return this;
    }

    public Document build() {
      int n = words.size();
      int[] h = new int[n];
      for (int i = 0; i < n; i++)
        h[i] = heads.get(i);
      int[] st = new int[starts.size()];
      for (int i = 0; i < st.length; i++)
        st[i] = starts.get(i);
      Document d = new Document(id,
          words.toArray(new String[n]), null,
          lemmas.toArray(new String[n]),
          pos.toArray(new String[n]),
          tags.toArray(new String[n]),
          new DependencyParse(h, deps.toArray(new String[n])),
          st);
      for (LabeledSpan e : entities)
        d.addEntity(e);
      for (int i = 0; i < srlPredicates.size(); i++)
        d.addSrl(srlPredicates.get(i), srlArgs.get(i));
      for (CorefCluster c : clusters)
        d.addCorefCluster(c);
      return d;
    }
  }

  /** John runs */
  public static Document johnRuns() {
    return new DocBuilder("johnRuns")
        .tok("John", "PROPN", "NNP", "nsubj", 1)
        .tok("runs", "run", "VERB", "VBZ", "ROOT", -1)
        .build();
  }

  /** John and Mary run */
  public static Document johnAndMaryRun() {
    return new DocBuilder("johnAndMaryRun")
        .tok("John", "PROPN", "NNP", "nsubj", 3)
        .tok("and", "CCONJ", "CC", "cc", 0)
        .tok("Mary", "PROPN", "NNP", "conj", 0)
        .tok("run", "VERB", "VBP", "ROOT", -1)
        .entity(0, 1, "PERSON")
        .entity(2, 3, "PERSON")
        .build();
  }

  /** Bob is not sad */
  public static Document bobIsNotSad() {
    return new DocBuilder("bobIsNotSad")
        .tok("Bob", "PROPN", "NNP", "nsubj", 1)
        .tok("is", "be", "AUX", "VBZ", "ROOT", -1)
        .tok("not", "PART", "RB", "neg", 1)
        .tok("sad", "ADJ", "JJ", "acomp", 1)
        .build();
  }

  /** John wants to eat, with SRL for both verbs */
  public static Document johnWantsToEat() {
    return new DocBuilder("johnWantsToEat")
        .tok("John", "PROPN", "NNP", "nsubj", 1)
        .tok("wants", "want", "VERB", "VBZ", "ROOT", -1)
        .tok("to", "PART", "TO", "aux", 3)
        .tok("eat", "VERB", "VB", "xcomp", 1)
        .srl(1, 0, 1, "ARG0", 2, 4, "ARG1")
        .srl(3, 0, 1, "ARG0")
        .build();
  }

  /** John said he won, "he" refers to "John" */
  public static Document johnSaidHeWon() {
    return new DocBuilder("johnSaidHeWon")
        .tok("John", "PROPN", "NNP", "nsubj", 1)
        .tok("said", "say", "VERB", "VBD", "ROOT", -1)
        .tok("he", "PRON", "PRP", "nsubj", 3)
        .tok("won", "win", "VERB", "VBD", "ccomp", 1)
        .coref(1, new LabeledSpan(0, 1, "MAIN1"), new LabeledSpan(2, 3, "REF1"))
        .build();
  }

  /** John arrived. He sat. */
  public static Document twoSentences() {
    return new DocBuilder("twoSentences")
        .tok("John", "PROPN", "NNP", "nsubj", 1)
        .tok("arrived", "arrive", "VERB", "VBD", "ROOT", -1)
        .tok(".", "PUNCT", ".", "punct", 1)
        .newSentence()
        .tok("He", "he", "PRON", "PRP", "nsubj", 4)
        .tok("sat", "sit", "VERB", "VBD", "ROOT", -1)
        .tok(".", "PUNCT", ".", "punct", 4)
        .coref(1, new LabeledSpan(0, 1, "MAIN1"), new LabeledSpan(3, 4, "REF1"))
        .build();
  }

  /** Tom sits on mats */
  public static Document tomSitsOnMats() {
    return new DocBuilder("tomSitsOnMats")
        .tok("Tom", "PROPN", "NNP", "nsubj", 1)
        .tok("sits", "sit", "VERB", "VBZ", "ROOT", -1)
        .tok("on", "ADP", "IN", "prep", 1)
        .tok("mats", "mat", "NOUN", "NNS", "pobj", 2)
        .build();
  }

  /** the big dog */
  public static Document theBigDog() {
    return new DocBuilder("theBigDog")
        .tok("the", "DET", "DT", "det", 2)
        .tok("big", "ADJ", "JJ", "amod", 2)
        .tok("dog", "NOUN", "NN", "ROOT", -1)
        .build();
  }
}
