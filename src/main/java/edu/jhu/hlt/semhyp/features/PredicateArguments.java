package edu.jhu.hlt.semhyp.features;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

import edu.jhu.hlt.semhyp.datatypes.LabeledSpan;
import edu.jhu.hlt.semhyp.datatypes.Sentence;

/**
 * The arguments of a predicate token according to the dependency parse and,
 * if the document has them, semantic role labels. The two sources are merged
 * in token order; the role string of a predicate atom has one character per
 * merged argument in each of its fields.
 *
 * Arguments of light verb constructions (an ARGM-PRR argument of the
 * predicate) count as arguments of the predicate.
 */
public class PredicateArguments {

  /** Relations which never introduce an argument of a predicate. */
  public static final Set<DepRel> NON_ARGUMENTS = Collections.unmodifiableSet(EnumSet.of(
      DepRel.CASE, DepRel.DET, DepRel.PREDET,
      DepRel.AMOD, DepRel.NUMMOD, DepRel.NMOD, DepRel.QUANTMOD, DepRel.COMPOUND,
      DepRel.AUX, DepRel.AUXPASS, DepRel.PRT, DepRel.NEG,
      DepRel.CC, DepRel.MARK,
      DepRel.DEP, DepRel.PUNCT, DepRel.META));

  public static final String LIGHT_VERB = "ARGM-PRR";

  /** Which annotation does not know about an argument. */
  public static enum Missing { DEP, SRL }

  /** An argument found by only one of the two sources. */
  public static class HiddenArgument {
    public final int index;     // position among the merged arguments
    public final int token;
    public final Missing missing;

    public HiddenArgument(int index, int token, Missing missing) {
      this.index = index;
      this.token = token;
      this.missing = missing;
    }

    @Override
    public String toString() {
      return "(HiddenArgument " + index + " tok=" + token + " missing=" + missing + ")";
    }
  }

  private final int predicate;
  private final Map<Integer, String> srlArgs;   // token -> SRL label
  private final Map<Integer, DepRel> depArgs;   // token -> relation to the predicate
  private final List<Integer> tokens;           // union of both, sorted

  public PredicateArguments(Sentence sent, int predicate) {
    this.predicate = predicate;

    Set<Integer> verbs = new LinkedHashSet<>();
    verbs.add(predicate);

    srlArgs = new HashMap<>();
    if (sent.getDocument().hasSrl()) {
      for (LabeledSpan a : sent.getSrlArgs(predicate))
        if (LIGHT_VERB.equals(a.getLabel()))
          verbs.add(sent.getRoot(a.getSpan()));
      for (int v : verbs) {
        for (LabeledSpan a : sent.getSrlArgs(v)) {
          int root = sent.getRoot(a.getSpan());
          if (root == v || "ARGM-LVB".equals(a.getLabel()) || "ARGM-MOD".equals(a.getLabel()))
            continue;
          boolean relative = sent.getHeadOrSelf(v) == root
              && (DepRel.fromLabel(sent.getDep(v)) == DepRel.RELCL
                  || DepRel.fromLabel(sent.getDep(v)) == DepRel.ACL);
          if (!NON_ARGUMENTS.contains(DepRel.fromLabel(sent.getDep(root))) || relative)
            srlArgs.put(root, a.getLabel());
        }
      }
    }

    depArgs = new HashMap<>();
    for (int v : verbs) {
      for (int c : sent.getChildren(v)) {
        DepRel rel = DepRel.fromLabel(sent.getDep(c));
        if (!NON_ARGUMENTS.contains(rel))
          depArgs.put(c, rel);
      }
    }

    Set<Integer> all = new TreeSet<>(srlArgs.keySet());
    all.addAll(depArgs.keySet());
    tokens = Collections.unmodifiableList(new ArrayList<>(all));
  }

  public int getPredicate() {
    return predicate;
  }

  /** Argument tokens in increasing order. */
  public List<Integer> getTokens() {
    return tokens;
  }

  public boolean hasSrl(int token) {
    return srlArgs.containsKey(token);
  }

  public boolean hasDep(int token) {
    return depArgs.containsKey(token);
  }

  /**
   * The roles part of the predicate's atom: dependency roles, then a ":" and
   * the semantic roles if there are any. Arguments with "-" in a field are
   * unknown to that source. Arguments with an unrecognized dependency role and
   * no semantic role are dropped.
   */
  public String getRoles() {
    StringBuilder dep = new StringBuilder();
    StringBuilder srl = new StringBuilder();
    boolean anySrl = false;
    for (int t : tokens) {
      String d = depArgs.containsKey(t) ? RoleTables.depRole(depArgs.get(t)) : "-";
      String s = srlArgs.containsKey(t) ? RoleTables.srlRole(srlArgs.get(t)) : "-";
      if (RoleTables.UNKNOWN.equals(d) && "-".equals(s))
        continue;
      dep.append(d);
      srl.append(s);
      anySrl |= !"-".equals(s);
    }
    if (anySrl)
      return dep + ":" + srl;
    return dep.toString();
  }

  /**
   * Arguments only one source knows about, with their position in
   * {@link #getTokens()}.
   */
  public List<HiddenArgument> getHiddenArguments() {
    List<HiddenArgument> h = new ArrayList<>();
    for (int i = 0; i < tokens.size(); i++) {
      int t = tokens.get(i);
      boolean s = srlArgs.containsKey(t);
      boolean d = depArgs.containsKey(t);
      if (s && !d)
        h.add(new HiddenArgument(i, t, Missing.DEP));
      else if (d && !s)
        h.add(new HiddenArgument(i, t, Missing.SRL));
    }
    return h;
  }
}
