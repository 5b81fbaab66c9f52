package edu.cmu.ml.rtw.hetnet.features;

import java.util.List;
import java.util.Map;

import com.google.common.collect.Lists;
import com.google.common.collect.Maps;

import edu.cmu.ml.rtw.hetnet.graphs.SelectedNodes;
import edu.cmu.ml.rtw.hetnet.matrix.MatrixCache;
import edu.cmu.ml.rtw.hetnet.matrix.SparseMatrix;
import edu.cmu.ml.rtw.hetnet.schema.MetaEdge;
import edu.cmu.ml.rtw.hetnet.schema.MetaGraph;

/**
 * Degree features for (start, end) pairs: for every metaedge that touches the start or end node
 * type, the node's degree along that metaedge.  A column is named by the metaedge abbreviation as
 * seen from that node type, so a Compound start node gets "CbG" for Compound-binds-Gene and a
 * Gene end node gets "GbC".  Columns are sorted by name.  When the start and end types share a
 * column name, the two columns are suffixed "_start" and "_end".
 */
public class DegreeFeatureExtractor {
  private final MetaGraph metaGraph;
  private final MatrixCache cache;

  public DegreeFeatureExtractor(MetaGraph metaGraph, MatrixCache cache) {
    this.metaGraph = metaGraph;
    this.cache = cache;
  }

  public FeatureTable extract(SelectedNodes start, SelectedNodes end) {
    Map<String, double[]> startDegrees = degreesFrom(start.getType());
    Map<String, double[]> endDegrees = degreesFrom(end.getType());

    // column name -> (degrees, is start side)
    Map<String, double[]> columnDegrees = Maps.newTreeMap();
    Map<String, Boolean> columnIsStart = Maps.newHashMap();
    for (Map.Entry<String, double[]> entry : startDegrees.entrySet()) {
      String name = entry.getKey();
      if (endDegrees.containsKey(name)) name += "_start";
      columnDegrees.put(name, entry.getValue());
      columnIsStart.put(name, true);
    }
    for (Map.Entry<String, double[]> entry : endDegrees.entrySet()) {
      String name = entry.getKey();
      if (startDegrees.containsKey(name)) name += "_end";
      columnDegrees.put(name, entry.getValue());
      columnIsStart.put(name, false);
    }

    int[] startIndices = start.getIndices();
    int[] endIndices = end.getIndices();
    List<String> names = Lists.newArrayList(columnDegrees.keySet());
    double[][] columns = new double[names.size()][startIndices.length * endIndices.length];
    for (int f = 0; f < names.size(); f++) {
      double[] degrees = columnDegrees.get(names.get(f));
      boolean isStart = columnIsStart.get(names.get(f));
      for (int s = 0; s < startIndices.length; s++) {
        for (int e = 0; e < endIndices.length; e++) {
          int node = isStart ? startIndices[s] : endIndices[e];
          columns[f][s * endIndices.length + e] = degrees[node];
        }
      }
    }
    return new FeatureTable(start.getColumnName(),
                            ResultAssembler.endColumnName(start, end),
                            start.getIds(),
                            end.getIds(),
                            names,
                            columns,
                            true);
  }

  /**
   * Degree vectors over all nodes, keyed by the abbreviation of each metaedge leaving nodeType.
   * The source side of a metaedge counts its rows (out-degree) and the target side its columns
   * (in-degree); for undirected metaedges these are the same.
   */
  private Map<String, double[]> degreesFrom(String nodeType) {
    Map<String, double[]> degrees = Maps.newLinkedHashMap();
    for (MetaEdge metaEdge : metaGraph.getMetaEdges()) {
      SparseMatrix adjacency = cache.getAdjacency(metaEdge.getAbbrev());
      if (metaEdge.getSourceType().equals(nodeType)) {
        degrees.put(metaEdge.getAbbrev(), adjacency.rowSums());
      }
      // A directed metaedge from a type to itself contributes both an out- and an in-degree.
      if (metaEdge.getTargetType().equals(nodeType) && metaEdge.getInverse() != metaEdge) {
        degrees.put(metaEdge.getInverse().getAbbrev(), adjacency.columnSums());
      }
    }
    return degrees;
  }
}
