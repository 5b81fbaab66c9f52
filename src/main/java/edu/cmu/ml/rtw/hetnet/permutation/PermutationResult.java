package edu.cmu.ml.rtw.hetnet.permutation;

import java.util.List;

import com.google.common.collect.ImmutableList;

import edu.cmu.ml.rtw.hetnet.graphs.Edge;

public class PermutationResult {
  private final List<Edge> edges;
  private final List<PermutationStats> stats;

  public PermutationResult(List<Edge> edges, List<PermutationStats> stats) {
    this.edges = ImmutableList.copyOf(edges);
    this.stats = ImmutableList.copyOf(stats);
  }

  public List<Edge> getEdges() {
    return edges;
  }

  public List<PermutationStats> getStats() {
    return stats;
  }
}
