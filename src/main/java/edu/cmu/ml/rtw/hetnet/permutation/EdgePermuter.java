package edu.cmu.ml.rtw.hetnet.permutation;

import java.util.List;
import java.util.Random;
import java.util.Set;

import org.apache.log4j.Logger;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.Lists;
import com.google.common.collect.Sets;

import edu.cmu.ml.rtw.hetnet.errors.DuplicateEdgeException;
import edu.cmu.ml.rtw.hetnet.errors.MultipleEdgeTypesException;
import edu.cmu.ml.rtw.hetnet.graphs.Edge;
import edu.cmu.ml.rtw.hetnet.util.Pair;

/**
 * Degree-preserving randomization of the edges of a single edge type by repeated double-edge
 * swaps.  Each attempt picks two distinct edges (s0, e0) and (s1, e1) and proposes (s0, e1) and
 * (s1, e0) in their place.  The swap is rejected if either proposed edge is a self-loop, already
 * present, present in reverse (undirected edge types only) or excluded; only the first failing
 * check of the first failing edge is counted.
 *
 * <p>Every node keeps its out- and in-degree (its degree, for undirected types), and the output
 * has as many edges as the input.  An EdgePermuter is not thread safe; GraphPermuter creates one
 * per edge type.
 */
public class EdgePermuter {
  private static final Logger log = Logger.getLogger(EdgePermuter.class);

  private final Random random;

  public EdgePermuter(long seed) {
    this(new Random(seed));
  }

  @VisibleForTesting
  protected EdgePermuter(Random random) {
    this.random = random;
  }

  public static PermutationResult permute(List<Edge> edges,
                                          boolean directed,
                                          double multiplier,
                                          Set<Pair<String, String>> excluded,
                                          long seed) {
    return new EdgePermuter(seed).permute(edges, directed, multiplier, excluded);
  }

  public PermutationResult permute(List<Edge> edges,
                                   boolean directed,
                                   double multiplier,
                                   Set<Pair<String, String>> excluded) {
    if (edges.isEmpty()) {
      return new PermutationResult(edges, Lists.<PermutationStats>newArrayList());
    }
    String edgeType = checkSingleType(edges);

    List<Pair<String, String>> current = Lists.newArrayList();
    Set<Pair<String, String>> present = Sets.newHashSet();
    for (Edge edge : edges) {
      Pair<String, String> pair = Pair.makePair(edge.getStartId(), edge.getEndId());
      if (!present.add(pair)) {
        throw new DuplicateEdgeException(edgeType, edge.getStartId(), edge.getEndId());
      }
      current.add(pair);
    }
    Set<Pair<String, String>> original = Sets.newHashSet(present);
    if (excluded == null) excluded = Sets.newHashSet();

    List<PermutationStats> stats = Lists.newArrayList();
    int numEdges = current.size();
    int n = numEdges < 2 ? 0 : (int) (numEdges * multiplier);
    Set<Integer> checkpoints = checkpoints(n);
    int previousCheckpoint = -1;
    int selfLoop = 0;
    int duplicate = 0;
    int undirectedDuplicate = 0;
    int excludedCount = 0;

    for (int i = 0; i < n; i++) {
      int i0 = random.nextInt(numEdges);
      int i1 = i0;
      while (i1 == i0) {
        i1 = random.nextInt(numEdges);
      }
      Pair<String, String> edge0 = current.get(i0);
      Pair<String, String> edge1 = current.get(i1);
      List<Pair<String, String>> swapped = Lists.newArrayList(
          Pair.makePair(edge0.getLeft(), edge1.getRight()),
          Pair.makePair(edge1.getLeft(), edge0.getRight()));

      boolean valid = true;
      for (Pair<String, String> candidate : swapped) {
        if (candidate.getLeft().equals(candidate.getRight())) {
          selfLoop++;
        } else if (present.contains(candidate)) {
          duplicate++;
        } else if (!directed && present.contains(candidate.reverse())) {
          undirectedDuplicate++;
        } else if (excluded.contains(candidate)) {
          excludedCount++;
        } else {
          continue;
        }
        valid = false;
        break;
      }

      if (valid) {
        present.remove(edge0);
        present.remove(edge1);
        current.set(i0, swapped.get(0));
        current.set(i1, swapped.get(1));
        present.addAll(swapped);
      }

      if (checkpoints.contains(i)) {
        int attempts = previousCheckpoint < 0 ? i + 1 : i - previousCheckpoint;
        int unchanged = Sets.intersection(original, present).size();
        PermutationStats stat = new PermutationStats(i,
                                                     attempts,
                                                     (i + 1) / (double) n,
                                                     unchanged / (double) numEdges,
                                                     selfLoop / (double) attempts,
                                                     duplicate / (double) attempts,
                                                     undirectedDuplicate / (double) attempts,
                                                     excludedCount / (double) attempts,
                                                     null);
        log.debug(edgeType + ": " + stat);
        stats.add(stat);
        previousCheckpoint = i;
        selfLoop = 0;
        duplicate = 0;
        undirectedDuplicate = 0;
        excludedCount = 0;
      }
    }

    List<Edge> permuted = Lists.newArrayList();
    for (Pair<String, String> pair : current) {
      permuted.add(new Edge(pair.getLeft(), pair.getRight(), edgeType));
    }
    return new PermutationResult(permuted, stats);
  }

  /**
   * Attempt indices after which statistics are recorded: every n / 10 attempts (at least every
   * attempt) and always the last one.
   */
  @VisibleForTesting
  protected static Set<Integer> checkpoints(int n) {
    Set<Integer> checkpoints = Sets.newTreeSet();
    if (n <= 0) return checkpoints;
    int step = Math.max(1, n / 10);
    for (int i = step; i < n; i += step) {
      checkpoints.add(i);
    }
    checkpoints.add(n - 1);
    return checkpoints;
  }

  private String checkSingleType(List<Edge> edges) {
    Set<String> types = Sets.newLinkedHashSet();
    for (Edge edge : edges) {
      types.add(edge.getType());
    }
    if (types.size() > 1) {
      throw new MultipleEdgeTypesException(types);
    }
    return types.iterator().next();
  }
}
