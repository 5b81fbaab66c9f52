package edu.cmu.ml.rtw.hetnet.features;

import java.util.List;
import java.util.Set;

import org.apache.log4j.Logger;

import com.google.common.collect.Sets;

import edu.cmu.ml.rtw.hetnet.matrix.MatrixCache;
import edu.cmu.ml.rtw.hetnet.matrix.SparseMatrix;
import edu.cmu.ml.rtw.hetnet.schema.MetaEdge;

/**
 * Multiplies the degree-weighted matrices along a metapath, left to right in traversal order.
 *
 * <p>For walk counts the chain product is the answer.  For path counts, after every
 * multiplication that lands on a node type the metapath has already visited, the diagonal of the
 * running product is zeroed, removing walks that come back to the node they started from.  This
 * is exact when the repeated type is the start type, and an approximation otherwise.
 *
 * <p>A PathCounter only reads from the cache, so one instance can serve many threads.
 */
public class PathCounter {
  private static final Logger log = Logger.getLogger(PathCounter.class);

  private final MatrixCache cache;

  public PathCounter(MatrixCache cache) {
    this.cache = cache;
  }

  public SparseMatrix count(MetaPath metaPath, PathCountSemantics semantics) {
    List<MetaEdge> edges = metaPath.getEdges();
    Set<String> visited = Sets.newHashSet(metaPath.getStartType());
    SparseMatrix product = null;
    for (MetaEdge edge : edges) {
      SparseMatrix next = cache.getWeighted(edge.getAbbrev());
      product = (product == null) ? next : product.multiply(next);
      if (!visited.add(edge.getTargetType()) && semantics == PathCountSemantics.PATHS) {
        product = product.withZeroDiagonal();
      }
    }
    if (log.isDebugEnabled()) {
      log.debug(semantics.getFeatureName() + " for " + metaPath + ": " + product);
    }
    return product;
  }
}
