package edu.cmu.ml.rtw.hetnet.features;

import java.util.List;

import org.apache.log4j.Logger;

import com.google.common.base.Preconditions;
import com.google.common.collect.Lists;

import edu.cmu.ml.rtw.hetnet.schema.MetaEdge;
import edu.cmu.ml.rtw.hetnet.schema.MetaGraph;

/**
 * Finds every metapath between two node types up to a maximum length, by extending partial paths
 * one metaedge at a time over the schema graph.  Schema graphs have tens of node types, so the
 * search is exhaustive and only bounded by length.  Results are ordered by length, then by the
 * order the search reached them, which depends only on the schema (outgoing metaedges are sorted
 * by abbreviation).
 *
 * <p>Length-one metapaths from the start type directly to the end type are dropped: they are the
 * relation being predicted, not a feature of it.
 */
public class MetaPathEnumerator {
  private static final Logger log = Logger.getLogger(MetaPathEnumerator.class);

  private final MetaGraph metaGraph;

  public MetaPathEnumerator(MetaGraph metaGraph) {
    this.metaGraph = metaGraph;
  }

  public List<MetaPath> enumerate(String startType, String endType, int maxLength) {
    Preconditions.checkArgument(maxLength >= 1, "Maximum metapath length must be positive");
    if (!metaGraph.hasNodeType(startType) || !metaGraph.hasNodeType(endType)) {
      log.warn("No edges touch " + startType + " or " + endType + "; there are no metapaths");
      return Lists.newArrayList();
    }
    List<MetaPath> metaPaths = Lists.newArrayList();
    List<List<MetaEdge>> frontier = Lists.newArrayList();
    frontier.add(Lists.<MetaEdge>newArrayList());
    for (int length = 1; length <= maxLength; length++) {
      List<List<MetaEdge>> extended = Lists.newArrayList();
      for (List<MetaEdge> partial : frontier) {
        String at = partial.isEmpty() ? startType : partial.get(partial.size() - 1).getTargetType();
        for (MetaEdge next : metaGraph.getOutgoing(at)) {
          List<MetaEdge> path = Lists.newArrayList(partial);
          path.add(next);
          extended.add(path);
          if (next.getTargetType().equals(endType) && length > 1) {
            metaPaths.add(new MetaPath(path));
          }
        }
      }
      frontier = extended;
    }
    log.info("Found " + metaPaths.size() + " metapaths from " + startType + " to " + endType
             + " of length at most " + maxLength);
    return metaPaths;
  }
}
