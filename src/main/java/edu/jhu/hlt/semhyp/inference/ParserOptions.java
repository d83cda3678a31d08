package edu.jhu.hlt.semhyp.inference;

import java.util.Map;

import edu.jhu.hlt.semhyp.datatypes.Sentence;
import edu.jhu.hlt.semhyp.util.Config;

/**
 * What goes into atom labels.
 */
public class ParserOptions {
  public static final String WITH_LEMMA = "withLemma";
  public static final String WITH_SYNSET = "withSynset";

  private final boolean withLemma;
  private final boolean withSynset;

  public ParserOptions(boolean withLemma, boolean withSynset) {
    this.withLemma = withLemma;
    this.withSynset = withSynset;
  }

  /** Lower-cased words, no synsets. */
  public static ParserOptions defaults() {
    return new ParserOptions(false, false);
  }

  public static ParserOptions fromConfig(Map<String, String> config) {
    return new ParserOptions(
        Config.getBoolean(config, WITH_LEMMA, false),
        Config.getBoolean(config, WITH_SYNSET, false));
  }

  public boolean withLemma() {
    return withLemma;
  }

  public boolean withSynset() {
    return withSynset;
  }

  /**
   * The synset id if requested and known, else the lemma if requested, else
   * the lower-cased word.
   */
  public String label(Sentence s, int i) {
    if (withSynset) {
      String synset = s.getSynset(i);
      if (synset != null && !synset.isEmpty())
        return synset;
    }
    if (withLemma)
      return s.getLemma(i);
    return s.getWord(i).toLowerCase();
  }

  @Override
  public String toString() {
    return "(ParserOptions withLemma=" + withLemma + " withSynset=" + withSynset + ")";
  }
}
