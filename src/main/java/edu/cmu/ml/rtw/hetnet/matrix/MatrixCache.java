package edu.cmu.ml.rtw.hetnet.matrix;

import java.util.Map;
import java.util.Set;

import org.apache.log4j.Logger;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Maps;

import edu.cmu.ml.rtw.hetnet.errors.UnknownMetaPathException;
import edu.cmu.ml.rtw.hetnet.graphs.HetGraph;
import edu.cmu.ml.rtw.hetnet.schema.MetaEdge;
import edu.cmu.ml.rtw.hetnet.schema.MetaGraph;

/**
 * The adjacency and degree-weighted matrices for every metaedge orientation, keyed by
 * abbreviation.  Built once, before any counting starts, and never modified afterwards, so the
 * counting workers read from it without synchronization.  Every metapath that uses a given
 * metaedge gets the very same weighted matrix instance.
 */
public class MatrixCache {
  private static final Logger log = Logger.getLogger(MatrixCache.class);

  private final ImmutableMap<String, SparseMatrix> adjacency;
  private final ImmutableMap<String, SparseMatrix> weighted;
  private final double w;

  private MatrixCache(Map<String, SparseMatrix> adjacency,
                      Map<String, SparseMatrix> weighted,
                      double w) {
    this.adjacency = ImmutableMap.copyOf(adjacency);
    this.weighted = ImmutableMap.copyOf(weighted);
    this.w = w;
  }

  public static MatrixCache build(HetGraph graph, MetaGraph metaGraph, double w) {
    log.info("Generating adjacency matrices...");
    Map<String, SparseMatrix> adjacency = new AdjacencyMatrixBuilder(graph).buildAll(metaGraph);
    log.info("Weighting matrices by degree with dampening factor " + w + "...");
    DegreeWeighter weighter = new DegreeWeighter(w);
    Map<String, SparseMatrix> weighted = Maps.newLinkedHashMap();
    for (MetaEdge metaEdge : metaGraph.getMetaEdges()) {
      SparseMatrix matrix = weighter.weight(adjacency.get(metaEdge.getAbbrev()),
                                            metaEdge.isDirected());
      weighted.put(metaEdge.getAbbrev(), matrix);
      MetaEdge inverse = metaEdge.getInverse();
      if (inverse == metaEdge) continue;
      // The weighting of a transpose is the transpose of the weighting.
      weighted.put(inverse.getAbbrev(), metaEdge.isDirected() ? matrix.transpose() : matrix);
    }
    return new MatrixCache(adjacency, weighted, w);
  }

  public double getDampening() {
    return w;
  }

  public Set<String> getAbbreviations() {
    return weighted.keySet();
  }

  public SparseMatrix getAdjacency(String abbreviation) {
    SparseMatrix matrix = adjacency.get(abbreviation);
    if (matrix == null) {
      throw new UnknownMetaPathException("No adjacency matrix for metaedge " + abbreviation);
    }
    return matrix;
  }

  public SparseMatrix getWeighted(String abbreviation) {
    SparseMatrix matrix = weighted.get(abbreviation);
    if (matrix == null) {
      throw new UnknownMetaPathException("No weighted matrix for metaedge " + abbreviation);
    }
    return matrix;
  }
}
