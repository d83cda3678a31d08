package edu.jhu.hlt.semhyp.datatypes;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One main mention and the mentions which refer back to it.
 */
public class CorefCluster {

  private final int id;
  private final LabeledSpan main;
  private final List<LabeledSpan> refs;

  public CorefCluster(int id, LabeledSpan main, List<LabeledSpan> refs) {
    if (main == null)
      throw new IllegalArgumentException("cluster " + id + " has no main mention");
    this.id = id;
    this.main = main;
    this.refs = Collections.unmodifiableList(new ArrayList<>(refs));
  }

  public int getId() {
    return id;
  }

  public LabeledSpan getMain() {
    return main;
  }

  public List<LabeledSpan> getRefs() {
    return refs;
  }

  @Override
  public String toString() {
    return "(Coref " + id + " main=" + main + " refs=" + refs + ")";
  }
}
