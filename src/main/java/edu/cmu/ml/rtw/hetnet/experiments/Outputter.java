package edu.cmu.ml.rtw.hetnet.experiments;

import java.io.FileWriter;
import java.io.IOException;
import java.util.List;

import org.apache.log4j.Logger;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Joiner;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import edu.cmu.ml.rtw.hetnet.features.FeatureTable;
import edu.cmu.ml.rtw.hetnet.features.MetaPathCatalog;
import edu.cmu.ml.rtw.hetnet.graphs.Edge;
import edu.cmu.ml.rtw.hetnet.permutation.PermutationStats;
import edu.cmu.ml.rtw.hetnet.util.FileUtil;

/**
 * Writes feature tables, permuted edges, permutation statistics and metapath catalogs to the
 * file system.  All tables are tab separated with a header line.
 */
public class Outputter {
  private static final Logger log = Logger.getLogger(Outputter.class);

  public static final String STATS_HEADER = "cumulative_attempts\tattempts\tcomplete\tunchanged"
      + "\tself_loop\tduplicate\tundirected_duplicate\texcluded";

  private static final List<String> DEFAULT_EDGE_COLUMNS =
      ImmutableList.of("start_id", "end_id", "type");

  private final FileUtil fileUtil;

  public Outputter() {
    this(new FileUtil());
  }

  @VisibleForTesting
  protected Outputter(FileUtil fileUtil) {
    this.fileUtil = fileUtil;
  }

  public void outputFeatureTable(String filename, FeatureTable table) throws IOException {
    log.info("Writing " + table.getNumRows() + " rows to " + filename);
    FileWriter writer = fileUtil.getFileWriter(filename);
    try {
      writer.write(table.getStartColumn() + "\t" + table.getEndColumn());
      for (String name : table.getFeatureNames()) {
        writer.write("\t" + name);
      }
      writer.write("\n");
      int numFeatures = table.getFeatureNames().size();
      for (int row = 0; row < table.getNumRows(); row++) {
        writer.write(table.getStartId(row) + "\t" + table.getEndId(row));
        for (int f = 0; f < numFeatures; f++) {
          writer.write("\t" + formatValue(table.getValue(row, f), table.isIntegral()));
        }
        writer.write("\n");
      }
    } finally {
      writer.close();
    }
  }

  /**
   * Writes edges with a start_id, end_id, type header, which GraphLoader reads back as an edge
   * table.
   */
  public void outputEdges(String filename, List<Edge> edges) throws IOException {
    outputEdges(filename, edges, DEFAULT_EDGE_COLUMNS);
  }

  /**
   * Writes edges under the given start id, end id and type column names, such as those of the
   * table the edges were loaded from.
   */
  public void outputEdges(String filename, List<Edge> edges, List<String> columnNames)
      throws IOException {
    Preconditions.checkArgument(columnNames.size() == 3,
                                "Expected start, end and type column names, got %s", columnNames);
    log.info("Writing " + edges.size() + " edges to " + filename);
    FileWriter writer = fileUtil.getFileWriter(filename);
    try {
      writer.write(Joiner.on('\t').join(columnNames) + "\n");
      for (Edge edge : edges) {
        writer.write(edge.getStartId() + "\t" + edge.getEndId() + "\t" + edge.getType() + "\n");
      }
    } finally {
      writer.close();
    }
  }

  /**
   * Writes one line per checkpoint.  If includeEdgeType is true, an etype column is appended.
   */
  public void outputStats(String filename, List<PermutationStats> stats, boolean includeEdgeType)
      throws IOException {
    FileWriter writer = fileUtil.getFileWriter(filename);
    try {
      writer.write(STATS_HEADER);
      if (includeEdgeType) writer.write("\tetype");
      writer.write("\n");
      for (PermutationStats stat : stats) {
        writer.write(stat.cumulativeAttempts + "\t" + stat.attempts + "\t"
                     + formatValue(stat.complete, false) + "\t"
                     + formatValue(stat.unchanged, false) + "\t"
                     + formatValue(stat.selfLoop, false) + "\t"
                     + formatValue(stat.duplicate, false) + "\t"
                     + formatValue(stat.undirectedDuplicate, false) + "\t"
                     + formatValue(stat.excluded, false));
        if (includeEdgeType) writer.write("\t" + stat.edgeType);
        writer.write("\n");
      }
    } finally {
      writer.close();
    }
  }

  public void outputMetaPaths(String filename, MetaPathCatalog catalog) throws IOException {
    log.info("Writing " + catalog.getRecords().size() + " metapaths to " + filename);
    FileWriter writer = fileUtil.getFileWriter(filename);
    try {
      catalog.write(writer);
    } finally {
      writer.close();
    }
  }

  @VisibleForTesting
  protected static String formatValue(double value, boolean integral) {
    if (integral) return Long.toString(Math.round(value));
    return Double.toString(value);
  }
}
