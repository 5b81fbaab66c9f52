package edu.cmu.ml.rtw.hetnet.features;

import java.util.List;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;

import edu.cmu.ml.rtw.hetnet.schema.MetaEdge;

/**
 * A sequence of metaedges leading from a start node type to an end node type, each metaedge
 * starting at the node type the previous one ended at.  The metaedges are oriented in traversal
 * order, so a directed edge type walked backward appears here as its inverse.
 *
 * <p>The abbreviation (e.g. "CbGaD" or "CbGr>GaD") is the start node code followed by each
 * step's predicate part and the next node code, and is the name of the metapath's feature column.
 */
public class MetaPath {
  private final String abbreviation;
  private final int length;
  private final List<MetaEdge> edges;
  private final List<String> edgeNames;
  private final List<String> edgeAbbreviations;
  private final List<String> standardEdgeAbbreviations;

  public MetaPath(List<MetaEdge> edges) {
    Preconditions.checkArgument(!edges.isEmpty(), "A metapath needs at least one metaedge");
    StringBuilder builder = new StringBuilder(edges.get(0).getSourceCode());
    List<String> names = Lists.newArrayList();
    List<String> abbreviations = Lists.newArrayList();
    List<String> standard = Lists.newArrayList();
    MetaEdge previous = null;
    for (MetaEdge edge : edges) {
      if (previous != null) {
        Preconditions.checkArgument(previous.getTargetType().equals(edge.getSourceType()),
                                    "Metaedge %s does not start where %s ends", edge, previous);
      }
      builder.append(edge.getPredicatePart());
      builder.append(edge.getTargetCode());
      names.add(edge.toString());
      abbreviations.add(edge.getAbbrev());
      standard.add(edge.getStandardAbbrev());
      previous = edge;
    }
    this.abbreviation = builder.toString();
    this.length = edges.size();
    this.edges = ImmutableList.copyOf(edges);
    this.edgeNames = ImmutableList.copyOf(names);
    this.edgeAbbreviations = ImmutableList.copyOf(abbreviations);
    this.standardEdgeAbbreviations = ImmutableList.copyOf(standard);
  }

  /**
   * A metapath whose descriptive fields come from an external catalog and are kept exactly as
   * given.  The metaedges are only used to find matrices and node types.
   */
  public MetaPath(String abbreviation,
                  int length,
                  List<MetaEdge> edges,
                  List<String> edgeNames,
                  List<String> edgeAbbreviations,
                  List<String> standardEdgeAbbreviations) {
    this.abbreviation = abbreviation;
    this.length = length;
    this.edges = ImmutableList.copyOf(edges);
    this.edgeNames = ImmutableList.copyOf(edgeNames);
    this.edgeAbbreviations = ImmutableList.copyOf(edgeAbbreviations);
    this.standardEdgeAbbreviations = ImmutableList.copyOf(standardEdgeAbbreviations);
  }

  public String getAbbreviation() {
    return abbreviation;
  }

  public int getLength() {
    return length;
  }

  public List<MetaEdge> getEdges() {
    return edges;
  }

  public List<String> getEdgeNames() {
    return edgeNames;
  }

  public List<String> getEdgeAbbreviations() {
    return edgeAbbreviations;
  }

  public List<String> getStandardEdgeAbbreviations() {
    return standardEdgeAbbreviations;
  }

  public String getStartType() {
    return edges.get(0).getSourceType();
  }

  public String getEndType() {
    return edges.get(edges.size() - 1).getTargetType();
  }

  /**
   * The node types visited, in order, including the start and end types.
   */
  public List<String> getNodeTypes() {
    List<String> types = Lists.newArrayList(getStartType());
    for (MetaEdge edge : edges) {
      types.add(edge.getTargetType());
    }
    return types;
  }

  /**
   * The same path traversed from its end to its start.
   */
  public MetaPath reverse() {
    List<MetaEdge> reversed = Lists.newArrayList();
    for (MetaEdge edge : Lists.reverse(edges)) {
      reversed.add(edge.getInverse());
    }
    return new MetaPath(reversed);
  }

  @Override
  public String toString() {
    return abbreviation;
  }

  @Override
  public int hashCode() {
    return abbreviation.hashCode();
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (obj == null)
      return false;
    if (getClass() != obj.getClass())
      return false;
    MetaPath other = (MetaPath) obj;
    return abbreviation.equals(other.abbreviation)
        && edgeAbbreviations.equals(other.edgeAbbreviations);
  }
}
