package edu.cmu.ml.rtw.hetnet.matrix;

import junit.framework.TestCase;

import edu.cmu.ml.rtw.hetnet.util.TestUtil;
import edu.cmu.ml.rtw.hetnet.util.TestUtil.Function;

public class DegreeWeighterTest extends TestCase {

  // Undirected star 0 - 1, 0 - 2, with node 3 isolated.
  private SparseMatrix star = new SparseMatrix.Builder(4, 4)
      .set(0, 1, 1.0).set(1, 0, 1.0)
      .set(0, 2, 1.0).set(2, 0, 1.0)
      .build();

  public void testZeroDampeningLeavesAdjacencyUnchanged() {
    assertEquals(star, new DegreeWeighter(0.0).weight(star, false));
  }

  public void testUndirectedWeighting() {
    SparseMatrix weighted = new DegreeWeighter(0.5).weight(star, false);
    // deg(0) = 2, deg(1) = 1
    assertEquals(1 / Math.sqrt(2), weighted.get(0, 1), 1e-12);
    assertEquals(1 / Math.sqrt(2), weighted.get(1, 0), 1e-12);
    assertEquals(0.0, weighted.get(3, 3));
  }

  public void testIsolatedNodesWeightToZeroNotNaN() {
    SparseMatrix weighted = new DegreeWeighter(1.0).weight(star, false);
    double[] sums = weighted.rowSums();
    for (double sum : sums) {
      assertFalse(Double.isNaN(sum));
    }
    assertEquals(0.0, sums[3]);
  }

  public void testDirectedUsesOutAndInDegree() {
    // 0 > 2, 1 > 2, 0 > 3
    SparseMatrix directed = new SparseMatrix.Builder(4, 4)
        .set(0, 2, 1.0).set(1, 2, 1.0).set(0, 3, 1.0).build();
    SparseMatrix weighted = new DegreeWeighter(1.0).weight(directed, true);
    // out(0) = 2, in(2) = 2
    assertEquals(0.25, weighted.get(0, 2), 1e-12);
    // out(1) = 1, in(2) = 2
    assertEquals(0.5, weighted.get(1, 2), 1e-12);
    // out(0) = 2, in(3) = 1
    assertEquals(0.5, weighted.get(0, 3), 1e-12);
  }

  public void testDampeningOutOfRangeFails() {
    TestUtil.expectError(IllegalArgumentException.class, new Function() {
      @Override
      public void call() {
        new DegreeWeighter(1.5);
      }
    });
  }
}
