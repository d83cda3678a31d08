package edu.jhu.hlt.semhyp.inference;

import static org.junit.Assert.*;

import java.util.Arrays;

import org.junit.Test;

import edu.jhu.hlt.semhyp.datatypes.Document;
import edu.jhu.hlt.semhyp.datatypes.Sentence;

public class TokenOrderingTest {

  @Test
  public void deepestFirst() {
    Sentence s = TestingUtil.johnAndMaryRun().getSentence(0);
    // "and" and "Mary" hang off "John" which hangs off "run"
    assertEquals(Arrays.asList(1, 2, 0, 3), TokenOrdering.order(s));
  }

  @Test
  public void adjunctsBeforeArguments() {
    Sentence s = TestingUtil.bobIsNotSad().getSentence(0);
    assertEquals(1, TokenOrdering.distance(s, 2));
    assertEquals(1, TokenOrdering.distance(s, 3));
    assertEquals(0, TokenOrdering.distance(s, 0));
    assertEquals(Arrays.asList(2, 0, 3, 1), TokenOrdering.order(s));
  }

  @Test
  public void prepositionsWaitForCoordination() {
    Document d = new TestingUtil.DocBuilder("catsAndDogs")
        .tok("cats", "NOUN", "NNS", "ROOT", -1)
        .tok("and", "CCONJ", "CC", "cc", 0)
        .tok("dogs", "NOUN", "NNS", "conj", 0)
        .tok("of", "ADP", "IN", "prep", 0)
        .tok("Rome", "PROPN", "NNP", "pobj", 3)
        .build();
    Sentence s = d.getSentence(0);
    assertEquals(TokenOrdering.AFTER_COORDINATION, TokenOrdering.priority(s, 3));
    assertEquals(-2, TokenOrdering.priority(s, 1));
    assertEquals(-3, TokenOrdering.priority(s, 2));
    assertTrue(TokenOrdering.order(s).indexOf(3) > TokenOrdering.order(s).indexOf(2));
  }

  @Test
  public void punctuationIsSkipped() {
    Document d = TestingUtil.twoSentences();
    assertEquals(Arrays.asList(0, 1), TokenOrdering.order(d.getSentence(0)));
    assertEquals(Arrays.asList(3, 4), TokenOrdering.order(d.getSentence(1)));
  }
}
