package edu.jhu.hlt.semhyp.inference;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import edu.jhu.hlt.semhyp.hyper.Atom;
import edu.jhu.hlt.semhyp.hyper.Hyperedge;
import edu.jhu.hlt.semhyp.hyper.Node;

/**
 * A hyperedge under construction. Branches are mutable and compared by
 * identity: the same branch may be shared by several partial edges, and an
 * argument spliced into it later shows up in all of them.
 */
public abstract class Fragment {

  public abstract boolean isAtom();

  public abstract boolean containsAtom(Atom a);

  /** An immutable copy of the current state of this fragment. */
  public abstract Node toNode();

  public static Leaf leaf(Atom a) {
    return new Leaf(a);
  }

  public static Branch branch(Fragment... items) {
    return new Branch(Arrays.asList(items));
  }

  public static final class Leaf extends Fragment {
    private final Atom atom;

    Leaf(Atom atom) {
      if (atom == null)
        throw new IllegalArgumentException();
      this.atom = atom;
    }

    public Atom getAtom() {
      return atom;
    }

    @Override
    public boolean isAtom() {
      return true;
    }

    @Override
    public boolean containsAtom(Atom a) {
      return atom.equals(a);
    }

    @Override
    public Node toNode() {
      return atom;
    }

    @Override
    public String toString() {
      return atom.toString();
    }
  }

  public static final class Branch extends Fragment {
    private final List<Fragment> items;

    Branch(List<Fragment> items) {
      if (items.isEmpty())
        throw new IllegalArgumentException("empty fragment");
      this.items = new ArrayList<>(items);
    }

    public int size() {
      return items.size();
    }

    public Fragment get(int i) {
      return items.get(i);
    }

    public Fragment first() {
      return items.get(0);
    }

    public List<Fragment> items() {
      return Collections.unmodifiableList(items);
    }

    /** Everything after the first element. */
    public List<Fragment> rest() {
      return items().subList(1, items.size());
    }

    /** A new branch with the same elements and more at the end. */
    public Branch append(Fragment... more) {
      List<Fragment> l = new ArrayList<>(items);
      Collections.addAll(l, more);
      return new Branch(l);
    }

    /** Inserts in place, clamping the position to the end. */
    public void insert(int position, Fragment f) {
      items.add(Math.min(position, items.size()), f);
    }

    @Override
    public boolean isAtom() {
      return false;
    }

    @Override
    public boolean containsAtom(Atom a) {
      for (Fragment f : items)
        if (f.containsAtom(a))
          return true;
      return false;
    }

    @Override
    public Node toNode() {
      List<Node> nodes = new ArrayList<>(items.size());
      for (Fragment f : items)
        nodes.add(f.toNode());
      return new Hyperedge(nodes);
    }

    @Override
    public String toString() {
      StringBuilder sb = new StringBuilder("[");
      for (int i = 0; i < items.size(); i++) {
        if (i > 0)
          sb.append(' ');
        sb.append(items.get(i));
      }
      return sb.append(']').toString();
    }
  }
}
