package edu.jhu.hlt.semhyp.inference;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.apache.log4j.Logger;

import edu.jhu.hlt.semhyp.datatypes.Sentence;
import edu.jhu.hlt.semhyp.features.DepRel;
import edu.jhu.hlt.semhyp.features.TokenFeatureExtractor;
import edu.jhu.hlt.semhyp.hyper.Node;
import edu.jhu.hlt.semhyp.hyper.TokenAtom;
import edu.jhu.hlt.semhyp.inference.Fragment.Branch;
import edu.jhu.hlt.semhyp.util.Diagnostic;

/**
 * Builds the hyperedge of a sentence bottom-up: every token starts as an
 * atom, then tokens are visited in {@link TokenOrdering} order and the
 * partial edge of each is combined into the partial edge of its head,
 * according to the dependency relation between them.
 */
public class HyperedgeTransducer {
  public static final Logger LOG = Logger.getLogger(HyperedgeTransducer.class);

  private static final Set<DepRel> CORE_ARGUMENTS = Collections.unmodifiableSet(EnumSet.of(
      DepRel.NSUBJ, DepRel.NSUBJPASS, DepRel.DOBJ, DepRel.DATIVE, DepRel.OPRD,
      DepRel.ACOMP, DepRel.ATTR, DepRel.EXPL, DepRel.CSUBJ, DepRel.CSUBJPASS,
      DepRel.PARATAXIS, DepRel.INTJ));
  private static final Set<DepRel> CLAUSAL = Collections.unmodifiableSet(EnumSet.of(
      DepRel.CCOMP, DepRel.XCOMP, DepRel.ADVCL));
  private static final Set<DepRel> NOT_CLAUSE_HOSTS = Collections.unmodifiableSet(EnumSet.of(
      DepRel.ACOMP, DepRel.ADVMOD, DepRel.ATTR));
  private static final Set<DepRel> VERBAL_ADJUNCTS = Collections.unmodifiableSet(EnumSet.of(
      DepRel.ADVMOD, DepRel.PREP, DepRel.NPADVMOD));

  private final ParserOptions options;

  public HyperedgeTransducer(ParserOptions options) {
    this.options = options;
  }

  public ParserOptions getOptions() {
    return options;
  }

  /**
   * @throws IllegalStateException if the sentence root ends up without an
   * edge (e.g. a parse whose root is punctuation).
   */
  public SentenceParse transduce(Sentence s) {
    TransductionState st = new TransductionState(s);
    List<Integer> order = TokenOrdering.order(s);
    if (LOG.isDebugEnabled())
      LOG.debug("[transduce] " + s + " order=" + order);

    for (int i : order)
      st.addToken(i, TokenFeatureExtractor.extract(s, i).toAtom(i, options.label(s, i)));
    for (int i : order)
      combine(st, i);

    HiddenArgumentResolver.resolve(st);

    Map<Integer, Node> edges = new LinkedHashMap<>();
    for (Map.Entry<Integer, Fragment> e : st.getEdges().entrySet())
      edges.put(e.getKey(), e.getValue().toNode());
    int root = s.getRoot();
    Node edge = edges.get(root);
    if (edge == null)
      throw new IllegalStateException("root " + root + " of " + s + " has no edge");
    return new SentenceParse(s, edge, edges, st.getAtoms(), st.getDiagnostics());
  }

  /** One combination step: folds child into the edge of its head. */
  void combine(TransductionState st, int child) {
    Sentence s = st.getSentence();
    int parent = s.getHeadOrSelf(child);
    if (parent == child)
      return;

    DepRel rel = TokenFeatureExtractor.rel(s, child);
    DepRel parentRel = TokenFeatureExtractor.rel(s, parent);
    Fragment childEdge = st.getEdge(child);
    char childType = st.getMajorType(child);
    Fragment parentEdge = st.getEdge(parent);
    char parentType = st.getMajorType(parent);
    if (parentEdge == null) {
      st.addDiagnostic(Diagnostic.Kind.HEAD_WITHOUT_EDGE, child,
          "head " + parent + " (" + s.getWord(parent) + ") of " + s.getWord(child) + " has no edge");
      parentEdge = Fragment.leaf(TokenAtom.synthetic("?", "", "", "", ""));
    }

    if (isArgument(s, rel, parent, parentRel)) {
      childEdge = promote(st, child, childEdge, childType == 'P');
      Fragment relation = st.isPredicate(parent)
          ? concat(items(parentEdge), childEdge)
          : Fragment.branch(parentEdge, childEdge);
      st.setEdge(parent, relation);
      st.setPredicate(parent, relation);
      st.recordHistory(parent);
      return;
    }

    Fragment result = null;
    switch (rel) {
    case CCOMP:
    case XCOMP:
    case ADVCL:
      // only under acomp, attr and advmod heads, everything else is an argument
      childEdge = promote(st, child, childEdge, childType == 'P');
      if (parentRel == DepRel.ACOMP || parentRel == DepRel.ATTR)
        result = Fragment.branch(builder("+", "Br", "am", "", s, parent, child), parentEdge, childEdge);
      else if (parentRel == DepRel.ADVMOD)
        result = Fragment.branch(parentEdge, childEdge);
      break;

    case PREP:
      if (parentRel == DepRel.PREP) {
        Fragment conj = builder(":", "J", "", "", s, parent, child);
        if (childEdge.isAtom())
          result = Fragment.branch(conj, parentEdge, childEdge);
        else
          result = concat(list(conj, parentEdge), ((Branch) childEdge).items());
      } else {
        if (childEdge.isAtom()) {
          result = Fragment.branch(parentEdge, childEdge);
        } else {
          Branch c = (Branch) childEdge;
          result = concat(list(c.first(), parentEdge), c.rest());
        }
      }
      break;

    case AGENT:
      if (parentEdge.isAtom())
        result = Fragment.branch(parentEdge, childEdge);
      else if (st.isPredicate(parent))
        result = concat(items(parentEdge), childEdge);
      else
        result = Fragment.branch(parentEdge, childEdge);
      st.setPredicate(parent, result);
      break;

    case MARK:
      result = Fragment.branch(childEdge, parentEdge);
      break;

    case POBJ:
    case PCOMP:
      result = Fragment.branch(parentEdge, childEdge);
      break;

    case AMOD:
      if (parentRel == DepRel.PREP) {
        // "as fast as possible"
        result = child > parent
            ? Fragment.branch(parentEdge, childEdge)
            : Fragment.branch(childEdge, parentEdge);
      } else {
        result = modify(s, parent, parentEdge, parentType, child, childEdge, childType);
      }
      break;

    case NPADVMOD:
      if (parentRel == DepRel.MARK || parentRel == DepRel.PREP)
        result = Fragment.branch(childEdge, parentEdge);
      else
        result = modify(s, parent, parentEdge, parentType, child, childEdge, childType);
      break;

    case DET:
    case PREDET:
    case ADVMOD:
    case NMOD:
    case NUMMOD:
    case QUANTMOD:
      result = modify(s, parent, parentEdge, parentType, child, childEdge, childType);
      break;

    case AUX:
    case AUXPASS:
    case PRT:
    case NEG:
    case PRECONJ:
      result = Fragment.branch(childEdge, parentEdge);
      break;

    case CASE:
      result = Fragment.branch(childEdge, parentEdge);
      st.markCase(parent);
      break;

    case POSS:
      if (st.isCaseMarked(child))
        result = concat(items(childEdge), parentEdge);
      else
        result = Fragment.branch(childEdge, parentEdge);
      break;

    case APPOS:
      result = Fragment.branch(
          builder("+", "Ba", "ma", TokenFeatureExtractor.apposFeatures(s, child), s, parent, child),
          parentEdge, childEdge);
      break;

    case COMPOUND:
      result = Fragment.branch(builder("+", "B", "am", "", s, parent, child), childEdge, parentEdge);
      break;

    case ACL:
    case RELCL:
      childEdge = promote(st, child, childEdge, true);
      result = Fragment.branch(builder("+", "Jr", "ma", "", s, parent, child), parentEdge, childEdge);
      break;

    case CONJ:
      result = coordinate(st, parent, parentEdge, parentType, child, childEdge, childType);
      break;

    case CC:
      if (parentType == 'P' && !st.isConjunct(parent))
        parentEdge = promote(st, parent, parentEdge, true);
      result = Fragment.branch(childEdge, parentEdge);
      st.addConjunct(parent);
      break;

    case DEP:
    case META:
      if (parentType != 'P')
        result = Fragment.branch(builder(":", "J", "", "", s, parent, child), parentEdge, childEdge);
      break;

    default:
      break;
    }

    if (result != null)
      st.setEdge(parent, result);
    st.recordHistory(parent);
  }

  /**
   * Core arguments, clausal complements (unless the head is an adjectival or
   * adverbial complement) and adverbial adjuncts of verbs become arguments of
   * the head's relation.
   */
  static boolean isArgument(Sentence s, DepRel rel, int parent, DepRel parentRel) {
    if (CORE_ARGUMENTS.contains(rel))
      return true;
    if (CLAUSAL.contains(rel) && !NOT_CLAUSE_HOSTS.contains(parentRel))
      return true;
    return TokenFeatureExtractor.VERBAL.contains(s.getPos(parent))
        && VERBAL_ADJUNCTS.contains(rel)
        && !TokenFeatureExtractor.isAdjunct(s, TokenFeatureExtractor.conjClosure(s, parent));
  }

  /**
   * Turns a predicate which is still a bare atom into a relation with no
   * arguments yet.
   */
  private static Fragment promote(TransductionState st, int token, Fragment edge, boolean condition) {
    if (!condition || st.isPredicate(token))
      return edge;
    Fragment relation = Fragment.branch(edge);
    st.setPredicate(token, relation);
    st.setEdge(token, relation);
    return relation;
  }

  /** Determiners, adjectives, adverbs, numbers and the like. */
  private static Fragment modify(Sentence s,
      int parent, Fragment parentEdge, char parentType,
      int child, Fragment childEdge, char childType) {
    if (parentType == 'C' && childType == 'C') {
      if (parent < child)
        return Fragment.branch(builder("+", "B", "ma", "", s, parent, child), parentEdge, childEdge);
      return Fragment.branch(builder("+", "B", "am", "", s, parent, child), childEdge, parentEdge);
    }
    if (parentType == 'C')
      return Fragment.branch(childEdge, parentEdge);
    if (childType == 'C')
      return Fragment.branch(parentEdge, childEdge);
    return child < parent
        ? Fragment.branch(childEdge, parentEdge)
        : Fragment.branch(parentEdge, childEdge);
  }

  /**
   * The first pair of conjuncts gets a ":/J" connector, later conjuncts are
   * added to that edge in token order.
   */
  private static Fragment coordinate(TransductionState st,
      int parent, Fragment parentEdge, char parentType,
      int child, Fragment childEdge, char childType) {
    if (childType == 'P' && !st.isConjunct(child))
      childEdge = promote(st, child, childEdge, true);
    if (parentType == 'P' && !st.isConjunct(parent))
      parentEdge = promote(st, parent, parentEdge, true);

    boolean parentIn = st.isConjunct(parent);
    boolean childIn = st.isConjunct(child);
    Fragment result;
    if (parentIn && childIn) {
      result = parent < child
          ? concat(items(parentEdge), childEdge)
          : concat(items(childEdge), parentEdge);
    } else if (parentIn) {
      result = child < parent
          ? insertSecond(parentEdge, childEdge)
          : concat(items(parentEdge), childEdge);
      st.addConjunct(child);
    } else if (childIn) {
      result = parent < child
          ? insertSecond(childEdge, parentEdge)
          : concat(items(childEdge), parentEdge);
      st.addConjunct(parent);
    } else {
      Sentence s = st.getSentence();
      result = Fragment.branch(builder(":", "J", "", "", s, parent, child), parentEdge, childEdge);
      st.addConjunct(parent);
      st.addConjunct(child);
    }
    return result;
  }

  /** A copy of edge with f right after its first element. */
  private static Fragment insertSecond(Fragment edge, Fragment f) {
    List<Fragment> e = items(edge);
    return concat(list(e.get(0), f), e.subList(1, e.size()));
  }

  /** A connector not belonging to any token, tagged with the entity of parent and child. */
  private static Fragment builder(String label, String type, String roles, String morph,
      Sentence s, int parent, int child) {
    String entity = TokenFeatureExtractor.entityFeatures(s, parent, child);
    return Fragment.leaf(TokenAtom.synthetic(label, type, roles, morph, entity));
  }

  /** The elements of a branch, or the fragment itself for a leaf. */
  private static List<Fragment> items(Fragment f) {
    if (f.isAtom())
      return Collections.singletonList(f);
    return ((Branch) f).items();
  }

  private static List<Fragment> list(Fragment... fs) {
    List<Fragment> l = new ArrayList<>(fs.length);
    Collections.addAll(l, fs);
    return l;
  }

  private static Fragment concat(List<Fragment> prefix, Fragment last) {
    return concat(prefix, Collections.singletonList(last));
  }

  private static Fragment concat(List<Fragment> prefix, List<Fragment> suffix) {
    List<Fragment> l = new ArrayList<>(prefix.size() + suffix.size());
    l.addAll(prefix);
    l.addAll(suffix);
    return new Branch(l);
  }
}
