package edu.jhu.hlt.semhyp.features;

import java.util.Arrays;
import java.util.Collections;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import edu.jhu.hlt.semhyp.datatypes.Sentence;

/**
 * Decides the type, roles, morphology and entity parts of the atom built for
 * a token, looking only at the token's annotations and its immediate
 * neighborhood in the dependency tree.
 */
public class TokenFeatureExtractor {

  public static final Set<String> VERBAL = Collections.unmodifiableSet(
      new HashSet<>(Arrays.asList("VERB", "AUX", "MD")));

  /** Relations which make a token an adjunct unless its head is a preposition. */
  private static final Set<DepRel> ADJUNCT_RELS = Collections.unmodifiableSet(EnumSet.of(
      DepRel.CASE, DepRel.DET, DepRel.PREDET,
      DepRel.AMOD, DepRel.NUMMOD, DepRel.NMOD, DepRel.QUANTMOD, DepRel.COMPOUND,
      DepRel.AUX, DepRel.AUXPASS, DepRel.PRT, DepRel.NEG));

  private static final String QUOTES = "\"'`´‘’“”";
  private static final String BRACKETS = "()[]{}";

  public static DepRel rel(Sentence s, int i) {
    return DepRel.fromLabel(s.getDep(i));
  }

  /**
   * Adjunct-class tokens (modifiers, determiners, auxiliaries, case markers,
   * non-verbal adverbial modifiers, ...) are combined with their head before
   * anything else happens to it. A root counts as its own head.
   */
  public static boolean isAdjunct(Sentence s, int i) {
    int h = s.getHeadOrSelf(i);
    DepRel r = rel(s, i);
    if (rel(s, h) != DepRel.PREP && ADJUNCT_RELS.contains(r))
      return true;
    if ((r == DepRel.ADVMOD || r == DepRel.NPADVMOD) && !VERBAL.contains(s.getPos(h)))
      return true;
    return "X".equals(s.getPos(h)) && "X".equals(s.getPos(i));
  }

  /** Follows "conj" links up to the first conjunct. */
  public static int conjClosure(Sentence s, int i) {
    while (rel(s, i) == DepRel.CONJ && s.getHead(i) >= 0)
      i = s.getHead(i);
    return i;
  }

  public static AtomFeatures extract(Sentence s, int i) {
    String t = typeAndSubtype(s, i);
    switch (t.charAt(0)) {
    case 'P':
      return new AtomFeatures(t,
          new PredicateArguments(s, i).getRoles(),
          verbFeatures(s.getTag(i)),
          entityFeatures(s, i));
    case 'C':
    case 'M':
      return new AtomFeatures(t,
          directionalRoles(s, i),
          conceptFeatures(s.getTag(i)),
          entityFeatures(s, i));
    default:
      return new AtomFeatures(t, "", "", entityFeatures(s, i));
    }
  }

  /**
   * First match wins. Coordinated tokens with the same tag as the first
   * conjunct get the first conjunct's type.
   */
  public static String typeAndSubtype(Sentence s, int i) {
    DepRel r = rel(s, i);
    String tag = s.getTag(i);
    String pos = s.getPos(i);

    if (r == DepRel.CONJ) {
      int closure = conjClosure(s, i);
      if (closure != i && tag.equals(s.getTag(closure)))
        return typeAndSubtype(s, closure);
    }

    switch (r) {
    case AMOD:
      if ("JJR".equals(tag)) return "Mc";
      if ("JJS".equals(tag)) return "Ms";
      return "Ma";
    case NUMMOD:
      return "M#";
    case NMOD:
      return "X".equals(pos) ? "Cm" : "M";
    case DET:
      return "WDT".equals(tag) ? "Mw" : "Md";
    case NEG:
      return "Mn";
    case AUX:
    case AUXPASS:
      if ("TO".equals(tag)) return "Mi";
      if ("MD".equals(tag)) return "Mm";
      return "Mv";
    case ADVMOD:
      if ("RBR".equals(tag)) return "M=";
      if ("RBS".equals(tag)) return "M^";
      if ("WRB".equals(tag)) return "Mw";
      return "M";
    case PREDET:
    case QUANTMOD:
      return "M";
    case PRT:
      return "Ml";
    case EXPL:
      return "Me";
    default:
      break;
    }

    int head = s.getHeadOrSelf(i);
    DepRel headRel = rel(s, head);
    if (r == DepRel.NPADVMOD && (headRel == DepRel.MARK || headRel == DepRel.PREP))
      return "M";
    if (r == DepRel.CC || r == DepRel.PRECONJ)
      return "J";
    if (r == DepRel.POSS) {
      if ("PRP$".equals(tag)) return "Mp";
      if ("PRP".equals(tag)) return "Ci";
      if (!"NOUN".equals(pos) && !"PROPN".equals(pos)) return "Mp";
    }
    if (r == DepRel.CASE)
      return "Bp";
    if (r == DepRel.AGENT)
      return "T" + triggerSubtype(s, i);
    if (r == DepRel.PREP) {
      if (!VERBAL.contains(s.getPos(head)) && headRel != DepRel.PREP)
        return "Br";
      return "T" + triggerSubtype(s, i);
    }
    if (r == DepRel.MARK)
      return "T" + triggerSubtype(s, i);
    if (r == DepRel.ACOMP)
      return "Ca";

    switch (pos) {
    case "NOUN":
      return "Cc";
    case "PROPN":
      return "Cp";
    case "PRON":
      return tag.startsWith("W") ? "Cw" : "Ci";
    case "NUM":
      return "C#";
    case "DET":
      return "Cd";
    case "ADJ":
      return "M";
    case "ADP":
    case "SCONJ":
      return "T" + triggerSubtype(s, i);
    case "VERB":
    case "AUX":
    case "MD":
      return predicateType(s, i);
    default:
      return "C";
    }
  }

  /** Sentence mood from the last punctuation attached to the predicate. */
  private static String predicateType(Sentence s, int i) {
    List<Integer> rights = s.getRights(i);
    for (int k = rights.size() - 1; k >= 0; k--) {
      int c = rights.get(k);
      if (rel(s, c) != DepRel.PUNCT)
        continue;
      String text = s.getWord(c);
      if (".,;:".contains(text)) return "Pd";
      if ("?".equals(text)) return "P?";
      if ("!".equals(text)) return "P!";
    }
    return "P";
  }

  /** "t" or "l" for temporal or locative arguments of the head, else empty. */
  public static String triggerSubtype(Sentence s, int i) {
    if (s.getSrl().isEmpty())
      return "";
    String label = s.getSrlLabel(i, s.getHeadOrSelf(i));
    String role = label.substring(label.lastIndexOf('-') + 1);
    if ("TMP".equals(role)) return "t";
    if ("LOC".equals(role)) return "l";
    return "";
  }

  /** "<" or ">" for adjuncts before or after their head, else empty. */
  public static String directionalRoles(Sentence s, int i) {
    if (!isAdjunct(s, i))
      return "";
    int h = s.getHeadOrSelf(i);
    if (i < h) return "<";
    if (i > h) return ">";
    return "";
  }

  /** Number of a common or proper noun: "s" or "p". */
  public static String conceptFeatures(String tag) {
    if (tag.startsWith("NN"))
      return tag.endsWith("S") ? "p" : "s";
    return "";
  }

  /**
   * Seven characters (tense, verb form, aspect, mood, person, number, verb
   * type) derived from a Penn verb tag, "-" where unknown, with trailing "-"
   * removed. E.g. VBZ gives "|f--3s".
   */
  public static String verbFeatures(String tag) {
    char tense = '-', form = '-', aspect = '-', mood = '-', person = '-', number = '-', type = '-';
    switch (tag) {
    case "VB":
      form = 'i';
      break;
    case "VBD":
      form = 'f';
      tense = '<';
      break;
    case "VBG":
      form = 'p';
      tense = '|';
      aspect = 'g';
      break;
    case "VBN":
      form = 'p';
      tense = '<';
      aspect = 'f';
      break;
    case "VBP":
      form = 'f';
      tense = '|';
      break;
    case "VBZ":
      form = 'f';
      tense = '|';
      number = 's';
      person = '3';
      break;
    default:
      break;
    }
    String f = new String(new char[] {tense, form, aspect, mood, person, number, type});
    int end = f.length();
    while (end > 0 && f.charAt(end - 1) == '-')
      end--;
    return f.substring(0, end);
  }

  /**
   * The entity code of tok, provided every token in rest has the same one.
   */
  public static String entityFeatures(Sentence s, int tok, int... rest) {
    String label = s.getEntityLabel(tok);
    if (label.isEmpty())
      return "";
    String e = RoleTables.entity(label);
    for (int t : rest)
      if (!e.equals(RoleTables.entity(s.getEntityLabel(t))))
        return "";
    return e;
  }

  /**
   * How an appositive is set off from its head: "q" quotes, "b" brackets, "c"
   * comma or semicolon, "n" nothing (or several different marks), otherwise
   * the punctuation itself.
   */
  public static String apposFeatures(Sentence s, int i) {
    int h = s.getHeadOrSelf(i);
    int start = Math.min(i, h);
    int stop = Math.max(i, h);
    Set<String> puncts = new HashSet<>();
    for (int c : s.getChildren(h))
      if (start < c && c < stop && rel(s, c) == DepRel.PUNCT)
        puncts.add(s.getWord(c));
    String punct = puncts.size() == 1 ? puncts.iterator().next() : "n";
    if (QUOTES.contains(punct))
      return "q";
    if (BRACKETS.contains(punct))
      return "b";
    if (",;".contains(punct))
      return "c";
    return punct;
  }
}
