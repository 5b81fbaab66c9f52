package edu.cmu.ml.rtw.hetnet.matrix;

import java.util.Arrays;

import com.google.common.base.Preconditions;

import it.unimi.dsi.fastutil.ints.Int2DoubleMap;
import it.unimi.dsi.fastutil.ints.Int2DoubleOpenHashMap;
import it.unimi.dsi.fastutil.ints.IntArrays;

/**
 * An immutable sparse matrix of doubles in compressed sparse row form.  Column indices within a
 * row are sorted and only non-zero values are stored.  Because instances never change after
 * construction, a single matrix can be shared by any number of threads without locking; every
 * operation here returns a new matrix.
 */
public class SparseMatrix {
  private final int numRows;
  private final int numCols;
  // rowStarts[i]..rowStarts[i+1] is the range of row i in columns and values.
  private final int[] rowStarts;
  private final int[] columns;
  private final double[] values;

  private SparseMatrix(int numRows, int numCols, int[] rowStarts, int[] columns, double[] values) {
    this.numRows = numRows;
    this.numCols = numCols;
    this.rowStarts = rowStarts;
    this.columns = columns;
    this.values = values;
  }

  public static SparseMatrix zeros(int numRows, int numCols) {
    return new SparseMatrix(numRows, numCols, new int[numRows + 1], new int[0], new double[0]);
  }

  public int getNumRows() {
    return numRows;
  }

  public int getNumCols() {
    return numCols;
  }

  public int getNonZeroCount() {
    return values.length;
  }

  public double get(int row, int col) {
    Preconditions.checkElementIndex(row, numRows, "row");
    Preconditions.checkElementIndex(col, numCols, "column");
    int position = Arrays.binarySearch(columns, rowStarts[row], rowStarts[row + 1], col);
    if (position < 0) {
      return 0.0;
    }
    return values[position];
  }

  public double[] rowSums() {
    double[] sums = new double[numRows];
    for (int i = 0; i < numRows; i++) {
      for (int k = rowStarts[i]; k < rowStarts[i + 1]; k++) {
        sums[i] += values[k];
      }
    }
    return sums;
  }

  public double[] columnSums() {
    double[] sums = new double[numCols];
    for (int k = 0; k < values.length; k++) {
      sums[columns[k]] += values[k];
    }
    return sums;
  }

  public SparseMatrix transpose() {
    int[] counts = new int[numCols + 1];
    for (int k = 0; k < columns.length; k++) {
      counts[columns[k] + 1]++;
    }
    for (int j = 0; j < numCols; j++) {
      counts[j + 1] += counts[j];
    }
    int[] newRowStarts = counts.clone();
    int[] next = Arrays.copyOf(counts, numCols);
    int[] newColumns = new int[columns.length];
    double[] newValues = new double[values.length];
    // Walking rows in order keeps the new column indices sorted within each new row.
    for (int i = 0; i < numRows; i++) {
      for (int k = rowStarts[i]; k < rowStarts[i + 1]; k++) {
        int position = next[columns[k]]++;
        newColumns[position] = i;
        newValues[position] = values[k];
      }
    }
    return new SparseMatrix(numCols, numRows, newRowStarts, newColumns, newValues);
  }

  /**
   * The product this · other.
   */
  public SparseMatrix multiply(SparseMatrix other) {
    Preconditions.checkArgument(numCols == other.numRows,
                                "Cannot multiply %sx%s by %sx%s",
                                numRows, numCols, other.numRows, other.numCols);
    double[] accumulator = new double[other.numCols];
    boolean[] touched = new boolean[other.numCols];
    int[] touchedColumns = new int[other.numCols];
    Builder builder = new Builder(numRows, other.numCols);
    for (int i = 0; i < numRows; i++) {
      int numTouched = 0;
      for (int k = rowStarts[i]; k < rowStarts[i + 1]; k++) {
        int middle = columns[k];
        double value = values[k];
        for (int l = other.rowStarts[middle]; l < other.rowStarts[middle + 1]; l++) {
          int col = other.columns[l];
          if (!touched[col]) {
            touched[col] = true;
            touchedColumns[numTouched++] = col;
          }
          accumulator[col] += value * other.values[l];
        }
      }
      IntArrays.quickSort(touchedColumns, 0, numTouched);
      for (int t = 0; t < numTouched; t++) {
        int col = touchedColumns[t];
        builder.appendToRow(i, col, accumulator[col]);
        accumulator[col] = 0.0;
        touched[col] = false;
      }
    }
    return builder.buildFromAppended();
  }

  /**
   * Returns diag(rowFactors) · this · diag(colFactors).  Entries that end up zero are dropped.
   */
  public SparseMatrix scale(double[] rowFactors, double[] colFactors) {
    Preconditions.checkArgument(rowFactors.length == numRows, "Wrong number of row factors");
    Preconditions.checkArgument(colFactors.length == numCols, "Wrong number of column factors");
    Builder builder = new Builder(numRows, numCols);
    for (int i = 0; i < numRows; i++) {
      for (int k = rowStarts[i]; k < rowStarts[i + 1]; k++) {
        builder.appendToRow(i, columns[k], values[k] * rowFactors[i] * colFactors[columns[k]]);
      }
    }
    return builder.buildFromAppended();
  }

  /**
   * A copy of this matrix with every (i, i) entry removed.
   */
  public SparseMatrix withZeroDiagonal() {
    Builder builder = new Builder(numRows, numCols);
    for (int i = 0; i < numRows; i++) {
      for (int k = rowStarts[i]; k < rowStarts[i + 1]; k++) {
        if (columns[k] != i) {
          builder.appendToRow(i, columns[k], values[k]);
        }
      }
    }
    return builder.buildFromAppended();
  }

  /**
   * Restricts this matrix to the given rows and columns, in the given order, as a dense
   * rows.length x cols.length array.  Indices may repeat.
   */
  public double[][] select(int[] rows, int[] cols) {
    double[][] result = new double[rows.length][cols.length];
    double[] scratch = new double[numCols];
    for (int r = 0; r < rows.length; r++) {
      int row = rows[r];
      Preconditions.checkElementIndex(row, numRows, "row");
      for (int k = rowStarts[row]; k < rowStarts[row + 1]; k++) {
        scratch[columns[k]] = values[k];
      }
      for (int c = 0; c < cols.length; c++) {
        result[r][c] = scratch[cols[c]];
      }
      for (int k = rowStarts[row]; k < rowStarts[row + 1]; k++) {
        scratch[columns[k]] = 0.0;
      }
    }
    return result;
  }

  /**
   * True if every stored value of this matrix is within tolerance of the same entry in other, and
   * vice versa.
   */
  public boolean approximatelyEquals(SparseMatrix other, double tolerance) {
    if (numRows != other.numRows || numCols != other.numCols) return false;
    for (int i = 0; i < numRows; i++) {
      for (int k = rowStarts[i]; k < rowStarts[i + 1]; k++) {
        if (Math.abs(values[k] - other.get(i, columns[k])) > tolerance) return false;
      }
      for (int k = other.rowStarts[i]; k < other.rowStarts[i + 1]; k++) {
        if (Math.abs(other.values[k] - get(i, other.columns[k])) > tolerance) return false;
      }
    }
    return true;
  }

  @Override
  public int hashCode() {
    final int prime = 31;
    int result = 1;
    result = prime * result + numRows;
    result = prime * result + numCols;
    result = prime * result + Arrays.hashCode(rowStarts);
    result = prime * result + Arrays.hashCode(columns);
    result = prime * result + Arrays.hashCode(values);
    return result;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (obj == null)
      return false;
    if (getClass() != obj.getClass())
      return false;
    SparseMatrix other = (SparseMatrix) obj;
    if (numRows != other.numRows || numCols != other.numCols)
      return false;
    if (!Arrays.equals(rowStarts, other.rowStarts))
      return false;
    if (!Arrays.equals(columns, other.columns))
      return false;
    return Arrays.equals(values, other.values);
  }

  @Override
  public String toString() {
    return "SparseMatrix(" + numRows + "x" + numCols + ", " + values.length + " non-zero)";
  }

  /**
   * Accumulates entries for a new matrix.  Entries can be set in any order with {@link #set}; the
   * matrix operations in this class instead append to rows in increasing row and column order,
   * which skips the hashing.  The two styles are not meant to be mixed on one builder.
   */
  public static class Builder {
    private final int numRows;
    private final int numCols;
    private Int2DoubleOpenHashMap[] rows;
    // Append-mode storage.
    private int[] appendedRows = new int[16];
    private int[] appendedColumns = new int[16];
    private double[] appendedValues = new double[16];
    private int numAppended = 0;

    public Builder(int numRows, int numCols) {
      Preconditions.checkArgument(numRows >= 0 && numCols >= 0, "Negative matrix dimensions");
      this.numRows = numRows;
      this.numCols = numCols;
    }

    public Builder set(int row, int col, double value) {
      Preconditions.checkElementIndex(row, numRows, "row");
      Preconditions.checkElementIndex(col, numCols, "column");
      if (rows == null) {
        rows = new Int2DoubleOpenHashMap[numRows];
      }
      if (rows[row] == null) {
        rows[row] = new Int2DoubleOpenHashMap();
      }
      rows[row].put(col, value);
      return this;
    }

    private void appendToRow(int row, int col, double value) {
      if (value == 0.0) return;
      if (numAppended == appendedValues.length) {
        int capacity = numAppended * 2;
        appendedRows = Arrays.copyOf(appendedRows, capacity);
        appendedColumns = Arrays.copyOf(appendedColumns, capacity);
        appendedValues = Arrays.copyOf(appendedValues, capacity);
      }
      appendedRows[numAppended] = row;
      appendedColumns[numAppended] = col;
      appendedValues[numAppended] = value;
      numAppended++;
    }

    private SparseMatrix buildFromAppended() {
      int[] rowStarts = new int[numRows + 1];
      for (int k = 0; k < numAppended; k++) {
        rowStarts[appendedRows[k] + 1]++;
      }
      for (int i = 0; i < numRows; i++) {
        rowStarts[i + 1] += rowStarts[i];
      }
      return new SparseMatrix(numRows,
                              numCols,
                              rowStarts,
                              Arrays.copyOf(appendedColumns, numAppended),
                              Arrays.copyOf(appendedValues, numAppended));
    }

    public SparseMatrix build() {
      if (rows == null) {
        return buildFromAppended();
      }
      int[] rowStarts = new int[numRows + 1];
      for (int i = 0; i < numRows; i++) {
        int count = 0;
        if (rows[i] != null) {
          for (Int2DoubleMap.Entry entry : rows[i].int2DoubleEntrySet()) {
            if (entry.getDoubleValue() != 0.0) count++;
          }
        }
        rowStarts[i + 1] = rowStarts[i] + count;
      }
      int[] columns = new int[rowStarts[numRows]];
      double[] values = new double[rowStarts[numRows]];
      for (int i = 0; i < numRows; i++) {
        if (rows[i] == null) continue;
        int[] rowColumns = new int[rowStarts[i + 1] - rowStarts[i]];
        int n = 0;
        for (Int2DoubleMap.Entry entry : rows[i].int2DoubleEntrySet()) {
          if (entry.getDoubleValue() != 0.0) rowColumns[n++] = entry.getIntKey();
        }
        IntArrays.quickSort(rowColumns);
        for (int c = 0; c < rowColumns.length; c++) {
          columns[rowStarts[i] + c] = rowColumns[c];
          values[rowStarts[i] + c] = rows[i].get(rowColumns[c]);
        }
      }
      return new SparseMatrix(numRows, numCols, rowStarts, columns, values);
    }
  }
}
