package edu.jhu.hlt.semhyp.features;

import java.util.HashMap;
import java.util.Map;

/**
 * Dependency relations (ClearNLP/spaCy English style) which the hyperedge
 * parser knows about. Anything else is {@link #OTHER}.
 */
public enum DepRel {
  // core arguments
  NSUBJ, NSUBJPASS, CSUBJ, CSUBJPASS, DOBJ, DATIVE, OPRD, ACOMP, ATTR, EXPL,
  PARATAXIS, INTJ, AGENT,
  // clausal
  CCOMP, XCOMP, ADVCL, ACL, RELCL,
  // prepositions and markers
  PREP, POBJ, PCOMP, MARK, CASE,
  // modifiers
  AMOD, ADVMOD, NPADVMOD, DET, PREDET, NMOD, NUMMOD, QUANTMOD, COMPOUND,
  POSS, APPOS, AUX, AUXPASS, PRT, NEG,
  // coordination
  CONJ, CC, PRECONJ,
  // leftovers
  DEP, META, PUNCT, ROOT, OTHER;

  private static final Map<String, DepRel> BY_LABEL = new HashMap<>();
  static {
    for (DepRel r : values())
      BY_LABEL.put(r.label(), r);
  }

  /** Lowercase dependency label, e.g. "nsubj". */
  public String label() {
    return name().toLowerCase();
  }

  public static DepRel fromLabel(String label) {
    if (label == null)
      return OTHER;
    DepRel r = BY_LABEL.get(label.toLowerCase());
    return r == null ? OTHER : r;
  }
}
