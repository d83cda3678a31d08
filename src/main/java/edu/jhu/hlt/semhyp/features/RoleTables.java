package edu.jhu.hlt.semhyp.features;

import java.util.HashMap;
import java.util.Map;

/**
 * Single character codes used in the roles and entity parts of atoms.
 */
public class RoleTables {

  public static final String UNKNOWN = "?";

  private static Map<String, String> srlRoles;
  private static Map<DepRel, String> depRoles;
  private static Map<String, String> entities;
  private static Map<String, String> corefRoles;
  static {
    // PropBank ARGM suffixes
    srlRoles = new HashMap<String, String>();
    srlRoles.put("ADJ", "a");
    srlRoles.put("ADV", "r");
    srlRoles.put("CAU", "c");
    srlRoles.put("COM", "o");
    srlRoles.put("DIR", "d");
    srlRoles.put("DIS", "s");
    srlRoles.put("EXT", "e");
    srlRoles.put("GOL", "g");
    srlRoles.put("LOC", "l");
    srlRoles.put("LVB", "b");
    srlRoles.put("MNR", "m");
    srlRoles.put("MOD", "f");
    srlRoles.put("NEG", "n");
    srlRoles.put("PNC", "p");
    srlRoles.put("PRD", "h");
    srlRoles.put("PRP", "i");
    srlRoles.put("PRR", "k");
    srlRoles.put("V", "v");
    srlRoles.put("TMP", "t");

    depRoles = new HashMap<DepRel, String>();
    depRoles.put(DepRel.NSUBJ, "s");
    depRoles.put(DepRel.CSUBJ, "s");
    depRoles.put(DepRel.NSUBJPASS, "p");
    depRoles.put(DepRel.CSUBJPASS, "p");
    depRoles.put(DepRel.EXPL, "e");
    depRoles.put(DepRel.AGENT, "a");
    depRoles.put(DepRel.ACOMP, "c");
    depRoles.put(DepRel.ATTR, "c");
    depRoles.put(DepRel.DOBJ, "o");
    depRoles.put(DepRel.POBJ, "o");
    depRoles.put(DepRel.PRT, "o");
    depRoles.put(DepRel.OPRD, "o");
    depRoles.put(DepRel.DATIVE, "i");
    depRoles.put(DepRel.ADVCL, "x");
    depRoles.put(DepRel.PREP, "x");
    depRoles.put(DepRel.NPADVMOD, "x");
    depRoles.put(DepRel.ADVMOD, "x");
    depRoles.put(DepRel.PARATAXIS, "t");
    depRoles.put(DepRel.INTJ, "j");
    depRoles.put(DepRel.XCOMP, "r");
    depRoles.put(DepRel.CCOMP, "r");

    // OntoNotes named entity classes
    entities = new HashMap<String, String>();
    entities.put("CARDINAL", "c");
    entities.put("DATE", "d");
    entities.put("EVENT", "e");
    entities.put("FAC", "f");
    entities.put("GPE", "g");
    entities.put("LANGUAGE", "u");
    entities.put("LAW", "w");
    entities.put("LOC", "l");
    entities.put("MONEY", "$");
    entities.put("NORP", "n");
    entities.put("ORDINAL", "#");
    entities.put("ORG", "o");
    entities.put("PERCENT", "%");
    entities.put("PERSON", "p");
    entities.put("PRODUCT", "r");
    entities.put("QUANTITY", "q");
    entities.put("TIME", "t");
    entities.put("WORK_OF_ART", "a");

    corefRoles = new HashMap<String, String>();
    corefRoles.put("PROPN", "p");
    corefRoles.put("PRON", "r");
    corefRoles.put("NOUN", "c");
  }

  /**
   * Numbered arguments map to their number (the last character of e.g.
   * "ARG0", "R-ARG1"), modifiers to the code of their last "-" separated
   * piece, anything else to "?".
   */
  public static String srlRole(String label) {
    if (label == null || label.isEmpty())
      return UNKNOWN;
    char last = label.charAt(label.length() - 1);
    if (Character.isDigit(last))
      return String.valueOf(last);
    String suffix = label.substring(label.lastIndexOf('-') + 1);
    String r = srlRoles.get(suffix);
    return r == null ? UNKNOWN : r;
  }

  public static String depRole(DepRel rel) {
    String r = depRoles.get(rel);
    return r == null ? UNKNOWN : r;
  }

  /** The code of a named entity class, or the empty string. */
  public static String entity(String label) {
    if (label == null)
      return "";
    String e = entities.get(label);
    return e == null ? "" : e;
  }

  public static String corefRole(String pos) {
    String r = corefRoles.get(pos);
    return r == null ? UNKNOWN : r;
  }
}
