package edu.cmu.ml.rtw.hetnet.matrix;

import java.util.Map;

import org.apache.log4j.Logger;

import com.google.common.collect.Maps;

import edu.cmu.ml.rtw.hetnet.graphs.Edge;
import edu.cmu.ml.rtw.hetnet.graphs.HetGraph;
import edu.cmu.ml.rtw.hetnet.schema.MetaEdge;
import edu.cmu.ml.rtw.hetnet.schema.MetaGraph;

/**
 * Builds one N x N adjacency matrix per metaedge, where N is the number of nodes in the whole
 * graph (all node types share one index space).  Entry (i, j) is 1 if an edge of the metaedge's
 * type goes from node i to node j; undirected edge types set (j, i) as well.
 */
public class AdjacencyMatrixBuilder {
  private static final Logger log = Logger.getLogger(AdjacencyMatrixBuilder.class);

  private final HetGraph graph;

  public AdjacencyMatrixBuilder(HetGraph graph) {
    this.graph = graph;
  }

  /**
   * The adjacency matrix for the declared orientation of metaEdge.  Throws
   * UnknownNodeReferenceException if an edge endpoint is not in the node table.
   */
  public SparseMatrix build(MetaEdge metaEdge) {
    int numNodes = graph.getNumNodes();
    SparseMatrix.Builder builder = new SparseMatrix.Builder(numNodes, numNodes);
    boolean directed = metaEdge.isDirected();
    for (Edge edge : graph.getEdgesOfType(metaEdge.getEdgeType())) {
      int start = graph.getIndex(edge.getStartId());
      int end = graph.getIndex(edge.getEndId());
      builder.set(start, end, 1.0);
      if (!directed) {
        builder.set(end, start, 1.0);
      }
    }
    return builder.build();
  }

  /**
   * Adjacency matrices for every traversable orientation of every metaedge, keyed by
   * abbreviation.  A directed metaedge's inverse gets the transpose of its matrix; an undirected
   * metaedge's matrix is symmetric, so its inverse shares the same instance.
   */
  public Map<String, SparseMatrix> buildAll(MetaGraph metaGraph) {
    Map<String, SparseMatrix> matrices = Maps.newLinkedHashMap();
    for (MetaEdge metaEdge : metaGraph.getMetaEdges()) {
      SparseMatrix matrix = build(metaEdge);
      log.debug("Built adjacency matrix for " + metaEdge.getAbbrev() + ": " + matrix);
      matrices.put(metaEdge.getAbbrev(), matrix);
      MetaEdge inverse = metaEdge.getInverse();
      if (inverse == metaEdge) continue;
      if (metaEdge.isDirected()) {
        matrices.put(inverse.getAbbrev(), matrix.transpose());
      } else {
        matrices.put(inverse.getAbbrev(), matrix);
      }
    }
    return matrices;
  }
}
