package edu.jhu.hlt.semhyp.inference;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import edu.jhu.hlt.semhyp.datatypes.Sentence;
import edu.jhu.hlt.semhyp.features.DepRel;
import edu.jhu.hlt.semhyp.features.TokenFeatureExtractor;

/**
 * The order in which tokens are folded into their heads: deepest first, then
 * by priority (adjuncts stick to their heads before arguments do, markers and
 * coordination come last), then closest to the head first.
 */
public class TokenOrdering {

  private static final Map<DepRel, Integer> ADJUNCT_PRIORITY = new EnumMap<>(DepRel.class);
  private static final Map<DepRel, Integer> OTHER_PRIORITY = new EnumMap<>(DepRel.class);
  static {
    ADJUNCT_PRIORITY.put(DepRel.PRT, 3);
    ADJUNCT_PRIORITY.put(DepRel.AUX, 2);
    ADJUNCT_PRIORITY.put(DepRel.AUXPASS, 2);
    ADJUNCT_PRIORITY.put(DepRel.NEG, 2);
    ADJUNCT_PRIORITY.put(DepRel.COMPOUND, 5);
    ADJUNCT_PRIORITY.put(DepRel.NMOD, 5);
    ADJUNCT_PRIORITY.put(DepRel.ADVMOD, 4);
    ADJUNCT_PRIORITY.put(DepRel.AMOD, 4);
    ADJUNCT_PRIORITY.put(DepRel.NUMMOD, 4);
    ADJUNCT_PRIORITY.put(DepRel.QUANTMOD, 3);
    ADJUNCT_PRIORITY.put(DepRel.DET, 4);
    ADJUNCT_PRIORITY.put(DepRel.PREDET, 1);

    OTHER_PRIORITY.put(DepRel.MARK, -1);
    OTHER_PRIORITY.put(DepRel.CC, -2);
    OTHER_PRIORITY.put(DepRel.CONJ, -3);
    OTHER_PRIORITY.put(DepRel.PRECONJ, -4);
  }

  /** Priority of a token attached after all conjuncts of a non-verbal head. */
  public static final int AFTER_COORDINATION = -5;

  private static class Key {
    final int token;
    final int depth, priority, distance;
    Key(int token, int depth, int priority, int distance) {
      this.token = token;
      this.depth = depth;
      this.priority = priority;
      this.distance = distance;
    }
  }

  private static final Comparator<Key> ORDER = new Comparator<Key>() {
    @Override
    public int compare(Key a, Key b) {
      if (a.depth != b.depth)
        return Integer.compare(b.depth, a.depth);
      if (a.priority != b.priority)
        return Integer.compare(b.priority, a.priority);
      if (a.distance != b.distance)
        return Integer.compare(a.distance, b.distance);
      return Integer.compare(a.token, b.token);
    }
  };

  /** Every non-punctuation token of the sentence, in processing order. */
  public static List<Integer> order(Sentence s) {
    List<Key> keys = new ArrayList<>();
    for (int i = s.start(); i < s.end(); i++) {
      if (TokenFeatureExtractor.rel(s, i) == DepRel.PUNCT)
        continue;
      keys.add(new Key(i, s.getDepth(i), priority(s, i), distance(s, i)));
    }
    Collections.sort(keys, ORDER);
    List<Integer> order = new ArrayList<>(keys.size());
    for (Key k : keys)
      order.add(k.token);
    return order;
  }

  public static int priority(Sentence s, int i) {
    DepRel r = TokenFeatureExtractor.rel(s, i);
    if (TokenFeatureExtractor.isAdjunct(s, i)) {
      Integer p = ADJUNCT_PRIORITY.get(r);
      return p == null ? 0 : p;
    }
    Integer p = OTHER_PRIORITY.get(r);
    int prior = p == null ? 0 : p;

    // e.g. "the speed, power and versatility of computers": "of" has to wait
    // for the coordination of its head to be built
    int h = s.getHeadOrSelf(i);
    if (prior == 0 && h < i && !"VERB".equals(s.getPos(h)) && !"AUX".equals(s.getPos(h))) {
      List<Integer> conjs = s.getConjuncts(h);
      if (!conjs.isEmpty() && Collections.max(conjs) < i)
        return AFTER_COORDINATION;
    }
    return prior;
  }

  /**
   * Adjuncts and markers: how far they are from their head. Everything else:
   * how many non-adjunct siblings come before it.
   */
  public static int distance(Sentence s, int i) {
    int h = s.getHeadOrSelf(i);
    if (TokenFeatureExtractor.isAdjunct(s, i) || TokenFeatureExtractor.rel(s, i) == DepRel.MARK)
      return Math.abs(i - h);
    int dist = 0;
    for (int c : s.getChildren(h)) {
      if (TokenFeatureExtractor.isAdjunct(s, c))
        continue;
      if (c == i)
        return dist;
      dist++;
    }
    return dist;
  }
}
