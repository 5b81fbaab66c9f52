package edu.cmu.ml.rtw.hetnet.matrix;

import com.google.common.base.Preconditions;

/**
 * Turns an adjacency matrix into a degree-weighted one: D_row^-w · A · D_col^-w, with degrees
 * taken from the unweighted matrix.  For undirected matrices both degree vectors are the row
 * sums; for directed ones the row degree is the out-degree and the column degree the in-degree.
 * A node of degree zero gets a weighting factor of zero, never a division by zero.
 */
public class DegreeWeighter {
  private final double w;

  public DegreeWeighter(double w) {
    Preconditions.checkArgument(w >= 0.0 && w <= 1.0,
                                "Dampening exponent must be in [0, 1]: %s", w);
    this.w = w;
  }

  public double getDampening() {
    return w;
  }

  public SparseMatrix weight(SparseMatrix adjacency, boolean directed) {
    double[] rowDegrees = adjacency.rowSums();
    double[] colDegrees = directed ? adjacency.columnSums() : rowDegrees;
    return adjacency.scale(inversePowers(rowDegrees), inversePowers(colDegrees));
  }

  private double[] inversePowers(double[] degrees) {
    double[] factors = new double[degrees.length];
    for (int i = 0; i < degrees.length; i++) {
      if (degrees[i] > 0) {
        factors[i] = Math.pow(degrees[i], -w);
      }
    }
    return factors;
  }
}
