package edu.jhu.hlt.semhyp.features;

import static org.junit.Assert.*;

import java.util.Arrays;
import java.util.List;

import org.junit.Test;

import edu.jhu.hlt.semhyp.datatypes.Sentence;
import edu.jhu.hlt.semhyp.features.PredicateArguments.HiddenArgument;
import edu.jhu.hlt.semhyp.inference.TestingUtil;
import edu.jhu.hlt.semhyp.inference.TestingUtil.DocBuilder;

public class PredicateArgumentsTest {

  @Test
  public void dependencyRolesOnly() {
    Sentence s = TestingUtil.tomSitsOnMats().getSentence(0);
    PredicateArguments pa = new PredicateArguments(s, 1);
    assertEquals(Arrays.asList(0, 2), pa.getTokens());
    assertEquals("sx", pa.getRoles());

    // without SRL every dependent is missing its semantic role
    List<HiddenArgument> hidden = pa.getHiddenArguments();
    assertEquals(2, hidden.size());
    assertEquals(0, hidden.get(0).index);
    assertEquals(0, hidden.get(0).token);
    assertEquals(PredicateArguments.Missing.SRL, hidden.get(0).missing);
    assertEquals(1, hidden.get(1).index);
    assertEquals(2, hidden.get(1).token);
    assertEquals(PredicateArguments.Missing.SRL, hidden.get(1).missing);
  }

  @Test
  public void semanticRolesAreAppended() {
    Sentence s = TestingUtil.johnWantsToEat().getSentence(0);
    PredicateArguments wants = new PredicateArguments(s, 1);
    assertEquals("sr:01", wants.getRoles());
    assertTrue(wants.getHiddenArguments().isEmpty());

    // "John" is the ARG0 of "eat" but not one of its dependents
    PredicateArguments eat = new PredicateArguments(s, 3);
    assertEquals("-:0", eat.getRoles());
    List<HiddenArgument> hidden = eat.getHiddenArguments();
    assertEquals(1, hidden.size());
    assertEquals(0, hidden.get(0).index);
    assertEquals(0, hidden.get(0).token);
    assertEquals(PredicateArguments.Missing.DEP, hidden.get(0).missing);
  }

  @Test
  public void unknownRelationsAreDropped() {
    Sentence s = new DocBuilder("weird")
        .tok("run", "VERB", "VB", "ROOT", -1)
        .tok("x", "NOUN", "NN", "weird", 0)
        .build().getSentence(0);
    PredicateArguments pa = new PredicateArguments(s, 0);
    assertEquals("", pa.getRoles());
    assertTrue(pa.hasDep(1));
    assertFalse(pa.hasSrl(1));
    assertEquals(PredicateArguments.Missing.SRL, pa.getHiddenArguments().get(0).missing);
  }

  @Test
  public void lightVerbConstruction() {
    Sentence s = new DocBuilder("tookAWalk")
        .tok("John", "PROPN", "NNP", "nsubj", 1)
        .tok("took", "take", "VERB", "VBD", "ROOT", -1)
        .tok("a", "DET", "DT", "det", 3)
        .tok("walk", "NOUN", "NN", "dobj", 1)
        .srl(1, 0, 1, "ARG0", 2, 4, PredicateArguments.LIGHT_VERB)
        .srl(3, 0, 1, "ARG0")
        .build().getSentence(0);
    PredicateArguments pa = new PredicateArguments(s, 1);
    assertEquals(Arrays.asList(0, 3), pa.getTokens());
    assertEquals("so:0k", pa.getRoles());
  }
}
