package edu.cmu.ml.rtw.hetnet.features;

import java.util.List;

import com.google.common.base.Preconditions;

import edu.cmu.ml.rtw.hetnet.graphs.SelectedNodes;
import edu.cmu.ml.rtw.hetnet.matrix.SparseMatrix;

/**
 * Restricts each metapath's N x N product to the selected start rows and end columns and lays the
 * result out as a {@link FeatureTable}, one column per metapath in the order they were requested.
 */
public class ResultAssembler {

  public FeatureTable assemble(List<SparseMatrix> products,
                               List<String> featureNames,
                               SelectedNodes start,
                               SelectedNodes end) {
    Preconditions.checkArgument(products.size() == featureNames.size(),
                                "One product is needed per feature name");
    int[] startIndices = start.getIndices();
    int[] endIndices = end.getIndices();
    double[][] columns = new double[products.size()][];
    for (int f = 0; f < products.size(); f++) {
      double[][] block = products.get(f).select(startIndices, endIndices);
      double[] column = new double[startIndices.length * endIndices.length];
      for (int s = 0; s < startIndices.length; s++) {
        System.arraycopy(block[s], 0, column, s * endIndices.length, endIndices.length);
      }
      columns[f] = column;
    }
    return new FeatureTable(start.getColumnName(),
                            endColumnName(start, end),
                            start.getIds(),
                            end.getIds(),
                            featureNames,
                            columns,
                            false);
  }

  /**
   * The end id column name, suffixed when the start and end nodes have the same type so the two
   * id columns stay distinguishable.
   */
  static String endColumnName(SelectedNodes start, SelectedNodes end) {
    if (start.getColumnName().equals(end.getColumnName())) {
      return end.getColumnName() + "_end";
    }
    return end.getColumnName();
  }
}
