package edu.jhu.hlt.semhyp.inference;

import static org.junit.Assert.*;

import java.util.Arrays;
import java.util.List;

import org.junit.Test;

import edu.jhu.hlt.semhyp.hyper.TokenAtom;

public class HiddenArgumentResolverTest {

  private final TokenAtom eat = new TokenAtom(1, "eat", "P", "", "", "");
  private final TokenAtom john = new TokenAtom(0, "john", "Cp", "", "", "");
  private final TokenAtom big = new TokenAtom(2, "big", "Ma", "", "", "");

  @Test
  public void latestEdgeWithoutThePredicate() {
    Fragment bare = Fragment.leaf(john);
    Fragment modified = Fragment.branch(Fragment.leaf(big), bare);
    Fragment withVerb = Fragment.branch(Fragment.leaf(eat), modified);
    List<Fragment> history = Arrays.asList(bare, modified, withVerb);
    assertSame(modified, HiddenArgumentResolver.latestWithout(history, eat));
  }

  @Test
  public void fallsBackToTheFirstEdge() {
    Fragment bare = Fragment.leaf(john);
    Fragment withVerb = Fragment.branch(Fragment.leaf(eat), bare);
    assertSame(bare, HiddenArgumentResolver.latestWithout(Arrays.asList(bare, withVerb), eat));

    // even the first one contains the predicate
    Fragment self = Fragment.leaf(eat);
    assertSame(self, HiddenArgumentResolver.latestWithout(Arrays.asList(self), eat));
  }

  @Test
  public void insertionIsSeenByEveryHolder() {
    Fragment.Branch relation = Fragment.branch(Fragment.leaf(eat));
    Fragment.Branch outer = Fragment.branch(Fragment.leaf(big), relation);
    relation.insert(1, Fragment.leaf(john));
    assertEquals("(big/Ma (eat/P john/Cp))", outer.toNode().toString());
  }
}
