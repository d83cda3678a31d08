package edu.jhu.hlt.semhyp.features;

import static org.junit.Assert.*;

import org.junit.Test;

import edu.jhu.hlt.semhyp.datatypes.Sentence;
import edu.jhu.hlt.semhyp.inference.TestingUtil;
import edu.jhu.hlt.semhyp.inference.TestingUtil.DocBuilder;

public class TokenFeatureExtractorTest {

  @Test
  public void verbFeatures() {
    assertEquals("-i", TokenFeatureExtractor.verbFeatures("VB"));
    assertEquals("<f", TokenFeatureExtractor.verbFeatures("VBD"));
    assertEquals("|pg", TokenFeatureExtractor.verbFeatures("VBG"));
    assertEquals("<pf", TokenFeatureExtractor.verbFeatures("VBN"));
    assertEquals("|f", TokenFeatureExtractor.verbFeatures("VBP"));
    assertEquals("|f--3s", TokenFeatureExtractor.verbFeatures("VBZ"));
    assertEquals("", TokenFeatureExtractor.verbFeatures("NN"));
  }

  @Test
  public void conceptFeatures() {
    assertEquals("s", TokenFeatureExtractor.conceptFeatures("NN"));
    assertEquals("p", TokenFeatureExtractor.conceptFeatures("NNS"));
    assertEquals("s", TokenFeatureExtractor.conceptFeatures("NNP"));
    assertEquals("p", TokenFeatureExtractor.conceptFeatures("NNPS"));
    assertEquals("", TokenFeatureExtractor.conceptFeatures("JJ"));
  }

  @Test
  public void types() {
    Sentence s = TestingUtil.bobIsNotSad().getSentence(0);
    assertEquals("Cp", TokenFeatureExtractor.typeAndSubtype(s, 0));
    assertEquals("P", TokenFeatureExtractor.typeAndSubtype(s, 1));
    assertEquals("Mn", TokenFeatureExtractor.typeAndSubtype(s, 2));
    assertEquals("Ca", TokenFeatureExtractor.typeAndSubtype(s, 3));

    s = TestingUtil.theBigDog().getSentence(0);
    assertEquals("Md", TokenFeatureExtractor.typeAndSubtype(s, 0));
    assertEquals("Ma", TokenFeatureExtractor.typeAndSubtype(s, 1));
    assertEquals("Cc", TokenFeatureExtractor.typeAndSubtype(s, 2));

    s = TestingUtil.johnWantsToEat().getSentence(0);
    assertEquals("Mi", TokenFeatureExtractor.typeAndSubtype(s, 2));
  }

  @Test
  public void conjunctsShareTheFirstConjunctsType() {
    Sentence s = TestingUtil.johnAndMaryRun().getSentence(0);
    assertEquals(0, TokenFeatureExtractor.conjClosure(s, 2));
    assertEquals("Cp", TokenFeatureExtractor.typeAndSubtype(s, 2));
    assertEquals("J", TokenFeatureExtractor.typeAndSubtype(s, 1));
  }

  @Test
  public void particle() {
    Sentence s = new DocBuilder("giveUp")
        .tok("give", "VERB", "VB", "ROOT", -1)
        .tok("up", "ADP", "RP", "prt", 0)
        .build().getSentence(0);
    assertEquals("Ml", TokenFeatureExtractor.typeAndSubtype(s, 1));
    assertEquals(">", TokenFeatureExtractor.directionalRoles(s, 1));
  }

  @Test
  public void mood() {
    Sentence s = new DocBuilder("run!")
        .tok("Run", "run", "VERB", "VB", "ROOT", -1)
        .tok("!", "PUNCT", ".", "punct", 0)
        .build().getSentence(0);
    assertEquals("P!", TokenFeatureExtractor.typeAndSubtype(s, 0));

    s = new DocBuilder("run?")
        .tok("Run", "run", "VERB", "VB", "ROOT", -1)
        .tok("?", "PUNCT", ".", "punct", 0)
        .build().getSentence(0);
    assertEquals("P?", TokenFeatureExtractor.typeAndSubtype(s, 0));

    s = TestingUtil.twoSentences().getSentence(0);
    assertEquals("Pd", TokenFeatureExtractor.typeAndSubtype(s, 1));
  }

  @Test
  public void temporalTrigger() {
    Sentence s = new DocBuilder("leftOnMonday")
        .tok("John", "PROPN", "NNP", "nsubj", 1)
        .tok("left", "leave", "VERB", "VBD", "ROOT", -1)
        .tok("on", "ADP", "IN", "prep", 1)
        .tok("Monday", "PROPN", "NNP", "pobj", 2)
        .srl(1, 0, 1, "ARG0", 2, 4, "ARGM-TMP")
        .build().getSentence(0);
    assertEquals("t", TokenFeatureExtractor.triggerSubtype(s, 2));
    assertEquals("Tt", TokenFeatureExtractor.typeAndSubtype(s, 2));

    // no semantic roles, no subtype
    s = TestingUtil.tomSitsOnMats().getSentence(0);
    assertEquals("T", TokenFeatureExtractor.typeAndSubtype(s, 2));
  }

  @Test
  public void adjuncts() {
    Sentence s = TestingUtil.bobIsNotSad().getSentence(0);
    assertTrue(TokenFeatureExtractor.isAdjunct(s, 2));
    assertFalse(TokenFeatureExtractor.isAdjunct(s, 0));
    assertFalse(TokenFeatureExtractor.isAdjunct(s, 1));
    assertEquals(">", TokenFeatureExtractor.directionalRoles(s, 2));
    assertEquals("", TokenFeatureExtractor.directionalRoles(s, 0));

    s = TestingUtil.theBigDog().getSentence(0);
    assertEquals("<", TokenFeatureExtractor.directionalRoles(s, 0));
  }

  @Test
  public void entityFeatures() {
    Sentence s = TestingUtil.johnAndMaryRun().getSentence(0);
    assertEquals("p", TokenFeatureExtractor.entityFeatures(s, 0));
    assertEquals("p", TokenFeatureExtractor.entityFeatures(s, 0, 2));
    assertEquals("", TokenFeatureExtractor.entityFeatures(s, 0, 3));
    assertEquals("", TokenFeatureExtractor.entityFeatures(s, 3));
  }

  @Test
  public void apposition() {
    Sentence s = new DocBuilder("bobTheBoss")
        .tok("Bob", "PROPN", "NNP", "ROOT", -1)
        .tok(",", "PUNCT", ",", "punct", 0)
        .tok("the", "DET", "DT", "det", 3)
        .tok("boss", "NOUN", "NN", "appos", 0)
        .build().getSentence(0);
    assertEquals("c", TokenFeatureExtractor.apposFeatures(s, 3));

    s = new DocBuilder("bobTheBoss2")
        .tok("Bob", "PROPN", "NNP", "ROOT", -1)
        .tok("the", "DET", "DT", "det", 2)
        .tok("boss", "NOUN", "NN", "appos", 0)
        .build().getSentence(0);
    assertEquals("n", TokenFeatureExtractor.apposFeatures(s, 2));

    s = new DocBuilder("bobTheBoss3")
        .tok("Bob", "PROPN", "NNP", "ROOT", -1)
        .tok("(", "PUNCT", "-LRB-", "punct", 0)
        .tok("boss", "NOUN", "NN", "appos", 0)
        .tok(")", "PUNCT", "-RRB-", "punct", 0)
        .build().getSentence(0);
    assertEquals("b", TokenFeatureExtractor.apposFeatures(s, 2));
  }

  @Test
  public void extract() {
    Sentence s = TestingUtil.johnRuns().getSentence(0);
    AtomFeatures f = TokenFeatureExtractor.extract(s, 1);
    assertEquals("P", f.getType());
    assertEquals('P', f.getMajorType());
    assertEquals("s", f.getRoles());
    assertEquals("|f--3s", f.getMorph());
    assertEquals("", f.getEntity());

    f = TokenFeatureExtractor.extract(TestingUtil.johnAndMaryRun().getSentence(0), 2);
    assertEquals("Cp", f.getType());
    assertEquals("", f.getRoles());
    assertEquals("s", f.getMorph());
    assertEquals("p", f.getEntity());
  }
}
