package edu.cmu.ml.rtw.hetnet.graphs;

import java.util.List;

import com.google.common.base.Joiner;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;

import edu.cmu.ml.rtw.hetnet.errors.InvalidSelectorException;
import edu.cmu.ml.rtw.hetnet.errors.UnknownNodeReferenceException;

/**
 * Picks out the start or end nodes of a feature extraction.  A selector is one of: a node type
 * name (all nodes of that type), an explicit list of node ids, or an explicit list of node
 * indices.  Selectors are resolved against a graph with {@link #resolve}, which is where invalid
 * selections are reported.
 */
public class NodeSelector {
  private enum Kind { TYPE, IDS, INDICES }

  private static final String IDS_PREFIX = "ids:";
  private static final String INDICES_PREFIX = "indices:";

  private final Kind kind;
  private final String type;
  private final List<String> ids;
  private final List<Integer> indices;

  private NodeSelector(Kind kind, String type, List<String> ids, List<Integer> indices) {
    this.kind = kind;
    this.type = type;
    this.ids = ids;
    this.indices = indices;
  }

  public static NodeSelector ofType(String type) {
    return new NodeSelector(Kind.TYPE, type, null, null);
  }

  public static NodeSelector ofIds(List<String> ids) {
    return new NodeSelector(Kind.IDS, null, ImmutableList.copyOf(ids), null);
  }

  public static NodeSelector ofIndices(List<Integer> indices) {
    return new NodeSelector(Kind.INDICES, null, null, ImmutableList.copyOf(indices));
  }

  /**
   * Parses the textual form used in parameter files and on the command line: "ids:a,b,c",
   * "indices:0,4,7", or anything else as a node type name.
   */
  public static NodeSelector parse(String selector) {
    if (selector == null || selector.trim().isEmpty()) {
      throw new InvalidSelectorException("Empty node selector");
    }
    Splitter splitter = Splitter.on(',').trimResults().omitEmptyStrings();
    if (selector.startsWith(IDS_PREFIX)) {
      return ofIds(splitter.splitToList(selector.substring(IDS_PREFIX.length())));
    }
    if (selector.startsWith(INDICES_PREFIX)) {
      List<Integer> parsed = Lists.newArrayList();
      for (String index : splitter.split(selector.substring(INDICES_PREFIX.length()))) {
        try {
          parsed.add(Integer.parseInt(index));
        } catch (NumberFormatException e) {
          throw new InvalidSelectorException("Not a node index: " + index);
        }
      }
      return ofIndices(parsed);
    }
    return ofType(selector.trim());
  }

  public SelectedNodes resolve(HetGraph graph) {
    int[] resolved;
    switch (kind) {
      case TYPE:
        if (!graph.hasNodeType(type)) {
          throw new InvalidSelectorException("Unknown node type: " + type);
        }
        resolved = graph.getIndicesOfType(type);
        break;
      case IDS:
        resolved = new int[ids.size()];
        for (int i = 0; i < ids.size(); i++) {
          try {
            resolved[i] = graph.getIndex(ids.get(i));
          } catch (UnknownNodeReferenceException e) {
            throw new InvalidSelectorException("Unknown node id in selector: " + ids.get(i));
          }
        }
        break;
      default:
        resolved = new int[indices.size()];
        for (int i = 0; i < indices.size(); i++) {
          int index = indices.get(i);
          if (index < 0 || index >= graph.getNumNodes()) {
            throw new InvalidSelectorException("Node index out of range: " + index);
          }
          resolved[i] = index;
        }
        break;
    }
    if (resolved.length == 0) {
      throw new InvalidSelectorException("Selector " + this + " matched no nodes");
    }
    return new SelectedNodes(resolved, graph.getIds(resolved), graph.getType(resolved[0]));
  }

  @Override
  public String toString() {
    switch (kind) {
      case TYPE:
        return type;
      case IDS:
        return IDS_PREFIX + Joiner.on(',').join(ids);
      default:
        return INDICES_PREFIX + Joiner.on(',').join(indices);
    }
  }
}
