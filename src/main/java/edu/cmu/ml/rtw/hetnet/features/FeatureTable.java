package edu.cmu.ml.rtw.hetnet.features;

import java.util.List;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import edu.cmu.ml.rtw.hetnet.errors.UnknownMetaPathException;

/**
 * A long-format feature table: one row per (start id, end id) pair and one numeric column per
 * feature.  Rows are the Cartesian product of the start ids and end ids, start-major, so row r
 * pairs start id r / numEndIds with end id r % numEndIds.
 */
public class FeatureTable {
  private final String startColumn;
  private final String endColumn;
  private final List<String> startIds;
  private final List<String> endIds;
  private final List<String> featureNames;
  // values[f][r] is feature f for row r.
  private final double[][] values;
  private final boolean integral;

  public FeatureTable(String startColumn,
                      String endColumn,
                      List<String> startIds,
                      List<String> endIds,
                      List<String> featureNames,
                      double[][] values,
                      boolean integral) {
    Preconditions.checkArgument(values.length == featureNames.size(),
                                "Got %s feature names for %s columns",
                                featureNames.size(), values.length);
    for (double[] column : values) {
      Preconditions.checkArgument(column.length == startIds.size() * endIds.size(),
                                  "Feature column has the wrong number of rows");
    }
    this.startColumn = startColumn;
    this.endColumn = endColumn;
    this.startIds = ImmutableList.copyOf(startIds);
    this.endIds = ImmutableList.copyOf(endIds);
    this.featureNames = ImmutableList.copyOf(featureNames);
    this.values = values;
    this.integral = integral;
  }

  public String getStartColumn() {
    return startColumn;
  }

  public String getEndColumn() {
    return endColumn;
  }

  public int getNumRows() {
    return startIds.size() * endIds.size();
  }

  public List<String> getFeatureNames() {
    return featureNames;
  }

  public List<String> getStartIds() {
    return startIds;
  }

  public List<String> getEndIds() {
    return endIds;
  }

  public String getStartId(int row) {
    return startIds.get(row / endIds.size());
  }

  public String getEndId(int row) {
    return endIds.get(row % endIds.size());
  }

  public double getValue(int row, int feature) {
    return values[feature][row];
  }

  public double getValue(int row, String featureName) {
    return values[getFeatureIndex(featureName)][row];
  }

  /**
   * The value for a particular (start id, end id) pair, or NaN if the pair is not in the table.
   * This is a linear scan over the ids, mostly useful in tests.
   */
  public double getValue(String startId, String endId, String featureName) {
    int start = startIds.indexOf(startId);
    int end = endIds.indexOf(endId);
    if (start < 0 || end < 0) return Double.NaN;
    return values[getFeatureIndex(featureName)][start * endIds.size() + end];
  }

  /** True if every value is a whole number, as with degree tables. */
  public boolean isIntegral() {
    return integral;
  }

  private int getFeatureIndex(String featureName) {
    int index = featureNames.indexOf(featureName);
    if (index < 0) {
      throw new UnknownMetaPathException("No feature column named " + featureName);
    }
    return index;
  }
}
