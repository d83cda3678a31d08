package edu.jhu.hlt.semhyp.datatypes;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

/**
 * A basic dependency tree over all tokens of a {@link Document}. Heads are
 * document-global token indices, sentence roots have head {@link #ROOT}.
 * Punctuation is attached like any other token (with the label "punct").
 */
public class DependencyParse {

  public static final int ROOT = -1;

  private int[] heads;
  private String[] labels;

  private int[] depths;
  private int[][] children;

  public DependencyParse(int[] heads, String[] labels) {
    if (heads.length != labels.length)
      throw new IllegalArgumentException("heads.length=" + heads.length + " labels.length=" + labels.length);
    for (int i = 0; i < heads.length; i++) {
      if (heads[i] < ROOT || heads[i] >= heads.length || heads[i] == i)
        throw new IllegalArgumentException("bad head for token " + i + ": " + heads[i]);
    }
    this.heads = heads;
    this.labels = labels;
  }

  public int size() {
    return heads.length;
  }

  public boolean isRoot(int i) {
    return heads[i] == ROOT;
  }

  public int getHead(int i) {
    return heads[i];
  }

  public String getLabel(int i) {
    return labels[i];
  }

  /** Number of head hops from i up to its root. */
  public int getDepth(int i) {
    if (depths == null) {
      depths = new int[size()];
      Arrays.fill(depths, -1);
    }
    if (depths[i] < 0) {
      int h = heads[i];
      if (h < 0) {
        depths[i] = 0;
      } else {
        // walk up, checking for cycles
        int d = 0;
        int ptr = i;
        while (heads[ptr] >= 0) {
          ptr = heads[ptr];
          d++;
          if (d > size())
            throw new IllegalStateException("cycle in dependency parse through token " + i);
        }
        depths[i] = d;
      }
    }
    return depths[i];
  }

  private static class Dep {
    public final int gov, dep;
    public Dep(int gov, int dep) {
      this.gov = gov;
      this.dep = dep;
    }
  }

  /** Children of i in increasing token order. */
  public int[] getChildren(int i) {
    if (children == null) {
      // Get all dependency edges sorted by gov
      List<Dep> deps = new ArrayList<>();
      int n = size();
      for (int j = 0; j < n; j++)
        deps.add(new Dep(heads[j], j));
      Collections.sort(deps, new Comparator<Dep>() {
        @Override public int compare(Dep o1, Dep o2) { return o1.gov - o2.gov; }
      });
      // Group edges by gov and populate children for each
      children = new int[n][];
      int ptr = 0;
      while (ptr < n) {
        Dep s = deps.get(ptr);
        int offset = 1;
        while (ptr + offset < n && s.gov == deps.get(ptr + offset).gov)
          offset++;
        if (s.gov >= 0) {
          children[s.gov] = new int[offset];
          for (int j = 0; j < offset; j++)
            children[s.gov][j] = deps.get(ptr + j).dep;
        }
        ptr += offset;
      }
    }
    int[] c = children[i];
    if (c == null) {
      children[i] = new int[0];
      return children[i];
    } else {
      return c;
    }
  }
}
