package edu.cmu.ml.rtw.hetnet.graphs;

import java.util.Collections;
import java.util.List;
import java.util.Map;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;

import edu.cmu.ml.rtw.hetnet.errors.UnknownNodeReferenceException;
import edu.cmu.ml.rtw.hetnet.util.MapUtil;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;

/**
 * A heterogeneous network held in memory.  Nodes get dense indices 0..N-1 in the order they
 * appear in the node table; the index, id and type mappings never change after construction, so
 * a HetGraph can be shared freely across threads.
 *
 * <p>Edges are stored as given and are not checked against the node set here.  Anything that
 * needs an edge's endpoint indices goes through {@link #getIndex}, which fails on unknown ids.
 */
public class HetGraph {
  private final String[] ids;
  private final String[] types;
  private final Object2IntOpenHashMap<String> idToIndex;
  private final Map<String, int[]> typeIndices;
  private final List<Edge> edges;
  private final Map<String, List<Edge>> edgesByType;

  public HetGraph(List<Node> nodes, List<Edge> edges) {
    int numNodes = nodes.size();
    ids = new String[numNodes];
    types = new String[numNodes];
    idToIndex = new Object2IntOpenHashMap<String>(numNodes);
    idToIndex.defaultReturnValue(-1);
    Map<String, IntArrayList> indicesByType = Maps.newLinkedHashMap();
    for (int i = 0; i < numNodes; i++) {
      Node node = nodes.get(i);
      Preconditions.checkArgument(!idToIndex.containsKey(node.getId()),
                                  "Duplicate node id: %s", node.getId());
      ids[i] = node.getId();
      types[i] = node.getType();
      idToIndex.put(node.getId(), i);
      IntArrayList indices = indicesByType.get(node.getType());
      if (indices == null) {
        indices = new IntArrayList();
        indicesByType.put(node.getType(), indices);
      }
      indices.add(i);
    }
    idToIndex.trim();
    Map<String, int[]> typeIndexArrays = Maps.newLinkedHashMap();
    for (Map.Entry<String, IntArrayList> entry : indicesByType.entrySet()) {
      typeIndexArrays.put(entry.getKey(), entry.getValue().toIntArray());
    }
    this.typeIndices = Collections.unmodifiableMap(typeIndexArrays);

    this.edges = ImmutableList.copyOf(edges);
    Map<String, List<Edge>> byType = Maps.newLinkedHashMap();
    for (Edge edge : edges) {
      MapUtil.addValueToKeyList(byType, edge.getType(), edge);
    }
    ImmutableMap.Builder<String, List<Edge>> builder = ImmutableMap.builder();
    for (Map.Entry<String, List<Edge>> entry : byType.entrySet()) {
      builder.put(entry.getKey(), ImmutableList.copyOf(entry.getValue()));
    }
    this.edgesByType = builder.build();
  }

  public int getNumNodes() {
    return ids.length;
  }

  public boolean hasNode(String id) {
    return idToIndex.containsKey(id);
  }

  public int getIndex(String id) {
    int index = idToIndex.getInt(id);
    if (index == -1) {
      throw new UnknownNodeReferenceException(id);
    }
    return index;
  }

  public String getId(int index) {
    return ids[index];
  }

  public String getType(int index) {
    return types[index];
  }

  public String getNodeType(String id) {
    return types[getIndex(id)];
  }

  public boolean hasNodeType(String type) {
    return typeIndices.containsKey(type);
  }

  /**
   * The indices of every node of the given type, in node table order.  The returned array is a
   * copy.
   */
  public int[] getIndicesOfType(String type) {
    int[] indices = typeIndices.get(type);
    if (indices == null) {
      return new int[0];
    }
    return indices.clone();
  }

  public List<String> getNodeTypes() {
    return ImmutableList.copyOf(typeIndices.keySet());
  }

  public List<Edge> getEdges() {
    return edges;
  }

  /** Edges grouped by edge type, with types in order of first appearance. */
  public Map<String, List<Edge>> getEdgesByType() {
    return edgesByType;
  }

  public List<Edge> getEdgesOfType(String type) {
    return MapUtil.getWithDefault(edgesByType, type, Collections.<Edge>emptyList());
  }

  public List<String> getIds(int[] indices) {
    List<String> result = Lists.newArrayListWithCapacity(indices.length);
    for (int index : indices) {
      result.add(ids[index]);
    }
    return result;
  }
}
