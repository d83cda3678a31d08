package edu.jhu.hlt.semhyp.inference;

import java.util.List;
import java.util.Map;

import edu.jhu.hlt.semhyp.features.PredicateArguments;
import edu.jhu.hlt.semhyp.features.PredicateArguments.HiddenArgument;
import edu.jhu.hlt.semhyp.hyper.TokenAtom;
import edu.jhu.hlt.semhyp.inference.Fragment.Branch;
import edu.jhu.hlt.semhyp.util.Diagnostic;

/**
 * Semantic role arguments of a predicate which are not its dependents (e.g.
 * the subject of an embedded infinitive) are spliced into the predicate's
 * relation, at the position their role was given in the predicate atom.
 *
 * Arguments known only to the dependency parse are already in place and are
 * left alone.
 */
public class HiddenArgumentResolver {

  public static void resolve(TransductionState st) {
    for (Map.Entry<Integer, Fragment> p : st.getPredicates().entrySet()) {
      int verb = p.getKey();
      List<HiddenArgument> hidden = new PredicateArguments(st.getSentence(), verb).getHiddenArguments();
      for (HiddenArgument h : hidden) {
        TokenAtom verbAtom = st.getAtom(verb);
        if (verbAtom == null) {
          st.addDiagnostic(Diagnostic.Kind.PREDICATE_WITHOUT_ATOM, verb,
              "predicate " + verb + " has no atom");
          continue;
        }
        List<Fragment> history = st.getHistory(h.token);
        if (history == null) {
          st.addDiagnostic(Diagnostic.Kind.ARGUMENT_WITHOUT_HISTORY, h.token,
              "argument " + h.token + " of predicate " + verb + " has no edge");
          continue;
        }
        Fragment argument = latestWithout(history, verbAtom);
        Fragment relation = p.getValue();
        if (relation.isAtom()) {
          st.addDiagnostic(Diagnostic.Kind.PREDICATE_EDGE_IS_ATOM, verb,
              "relation of predicate " + verb + " is an atom");
          continue;
        }
        if (h.missing == PredicateArguments.Missing.DEP)
          ((Branch) relation).insert(h.index + 1, argument);
      }
    }
  }

  /**
   * The most recent edge headed by the argument which does not already
   * contain the predicate, or its first (the bare atom) if there is none.
   */
  static Fragment latestWithout(List<Fragment> history, TokenAtom predicate) {
    for (int i = history.size() - 1; i >= 0; i--)
      if (!history.get(i).containsAtom(predicate))
        return history.get(i);
    return history.get(0);
  }
}
