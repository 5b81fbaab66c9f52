package edu.cmu.ml.rtw.hetnet.permutation;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Callable;

import org.apache.log4j.Logger;

import com.google.common.collect.Lists;

import edu.cmu.ml.rtw.hetnet.graphs.Edge;
import edu.cmu.ml.rtw.hetnet.parallel.ParallelMapper;
import edu.cmu.ml.rtw.hetnet.util.Pair;

/**
 * Permutes every edge type of a graph independently and concatenates the results in the order
 * the edge types first appear.  The edges of type t are permuted with seed (seed + number of
 * edges of type t), so a run is reproducible regardless of how many workers the mapper uses.
 * An edge type is directed if its abbreviation contains a direction marker.
 */
public class GraphPermuter {
  private static final Logger log = Logger.getLogger(GraphPermuter.class);

  private final ParallelMapper mapper;

  public GraphPermuter(ParallelMapper mapper) {
    this.mapper = mapper;
  }

  public PermutationResult permute(Map<String, List<Edge>> edgesByType,
                                   double multiplier,
                                   Set<Pair<String, String>> excluded,
                                   long seed) {
    List<PermuteTypeTask> tasks = Lists.newArrayList();
    for (Map.Entry<String, List<Edge>> entry : edgesByType.entrySet()) {
      tasks.add(new PermuteTypeTask(entry.getKey(), entry.getValue(), multiplier, excluded,
                                    seed + entry.getValue().size()));
    }
    log.info("Permuting " + tasks.size() + " edge types");
    List<PermutationResult> results = mapper.map(tasks);

    List<Edge> edges = Lists.newArrayList();
    List<PermutationStats> stats = Lists.newArrayList();
    for (int i = 0; i < tasks.size(); i++) {
      edges.addAll(results.get(i).getEdges());
      for (PermutationStats stat : results.get(i).getStats()) {
        stats.add(stat.withEdgeType(tasks.get(i).edgeType));
      }
    }
    return new PermutationResult(edges, stats);
  }

  public static boolean isDirected(String edgeType) {
    return edgeType.contains(">") || edgeType.contains("<");
  }

  private static class PermuteTypeTask implements Callable<PermutationResult> {
    private final String edgeType;
    private final List<Edge> edges;
    private final double multiplier;
    private final Set<Pair<String, String>> excluded;
    private final long seed;

    public PermuteTypeTask(String edgeType,
                           List<Edge> edges,
                           double multiplier,
                           Set<Pair<String, String>> excluded,
                           long seed) {
      this.edgeType = edgeType;
      this.edges = edges;
      this.multiplier = multiplier;
      this.excluded = excluded;
      this.seed = seed;
    }

    @Override
    public PermutationResult call() {
      log.info("Permuting " + edges.size() + " edges of type " + edgeType);
      return new EdgePermuter(seed).permute(edges, isDirected(edgeType), multiplier, excluded);
    }
  }
}
