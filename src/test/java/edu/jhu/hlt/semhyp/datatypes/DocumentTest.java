package edu.jhu.hlt.semhyp.datatypes;

import static org.junit.Assert.*;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.Test;

import edu.jhu.hlt.semhyp.inference.TestingUtil;

public class DocumentTest {

  @Test
  public void sentences() {
    Document d = TestingUtil.twoSentences();
    assertEquals(6, d.size());
    assertEquals(2, d.getNumSentences());
    Sentence s = d.getSentence(1);
    assertEquals(3, s.start());
    assertEquals(6, s.end());
    assertEquals(3, s.size());
    assertSame(s, d.getSentenceOf(5));
    assertSame(d.getSentence(0), d.getSentenceOf(2));
    assertEquals("He sat .", s.getText());
    assertEquals(4, s.getRoot());
  }

  @Test(expected = IllegalArgumentException.class)
  public void sentencesMustStartAtZero() {
    new Document("bad", new String[] {"a", "b"}, null, null,
        new String[] {"X", "X"}, new String[] {"X", "X"},
        new DependencyParse(new int[] {-1, 0}, new String[] {"ROOT", "dep"}),
        new int[] {1});
  }

  @Test
  public void dependencyParse() {
    Document d = TestingUtil.johnAndMaryRun();
    DependencyParse p = d.getDependencyParse();
    assertTrue(p.isRoot(3));
    assertEquals(0, p.getDepth(3));
    assertEquals(1, p.getDepth(0));
    assertEquals(2, p.getDepth(2));
    assertArrayEquals(new int[] {1, 2}, p.getChildren(0));
    assertArrayEquals(new int[0], p.getChildren(1));
    assertEquals("conj", p.getLabel(2));
  }

  @Test(expected = IllegalArgumentException.class)
  public void selfHead() {
    new DependencyParse(new int[] {0}, new String[] {"ROOT"});
  }

  @Test
  public void conjuncts() {
    Sentence s = TestingUtil.johnAndMaryRun().getSentence(0);
    assertEquals(Arrays.asList(2), s.getConjuncts(0));
    assertEquals(Arrays.asList(0), s.getConjuncts(2));
    assertEquals(Collections.emptyList(), s.getConjuncts(3));
  }

  @Test
  public void rootOfSpan() {
    Sentence s = TestingUtil.johnWantsToEat().getSentence(0);
    assertEquals(3, s.getRoot(Span.getSpan(2, 4)));
    assertEquals(1, s.getRoot());
    assertEquals(1, s.getHeadOrSelf(1));
    assertEquals(Arrays.asList(0), s.getLefts(1));
    assertEquals(Arrays.asList(3), s.getRights(1));
  }

  @Test
  public void semanticRoles() {
    Sentence s = TestingUtil.johnWantsToEat().getSentence(0);
    assertEquals("ARG1", s.getSrlLabel(2, 1));
    assertEquals("V", s.getSrlLabel(1, 1));
    assertEquals("", s.getSrlLabel(2, 3));
    assertEquals("", s.getSrlLabel(0, 2));
    assertEquals(2, s.getSrl().size());
    assertEquals(3, s.getSrlArgs(1).size());
    assertTrue(s.getSrlArgs(0).isEmpty());
  }

  @Test
  public void entities() {
    Sentence s = TestingUtil.johnAndMaryRun().getSentence(0);
    assertEquals("PERSON", s.getEntityLabel(2));
    assertEquals("", s.getEntityLabel(1));
  }

  @Test
  public void corefIsRestrictedToTheSentence() {
    Document d = TestingUtil.twoSentences();
    assertEquals(1, d.getCorefClusters().size());
    assertTrue(d.getSentence(0).getCorefClusters().isEmpty());
    assertTrue(d.getSentence(1).getCorefClusters().isEmpty());

    List<CorefCluster> c = TestingUtil.johnSaidHeWon().getSentence(0).getCorefClusters();
    assertEquals(1, c.size());
    assertEquals(new LabeledSpan(2, 3, "REF1"), c.get(0).getRefs().get(0));
  }
}
