package edu.cmu.ml.rtw.hetnet.permutation;

/**
 * One checkpoint of a permutation run.  The rejection fields are rates: the number of attempts
 * rejected for that reason since the previous checkpoint, divided by attempts.  edgeType is null
 * for a single-type run and set by GraphPermuter.
 */
public class PermutationStats {
  public final int cumulativeAttempts;
  public final int attempts;
  public final double complete;
  public final double unchanged;
  public final double selfLoop;
  public final double duplicate;
  public final double undirectedDuplicate;
  public final double excluded;
  public final String edgeType;

  public PermutationStats(int cumulativeAttempts,
                          int attempts,
                          double complete,
                          double unchanged,
                          double selfLoop,
                          double duplicate,
                          double undirectedDuplicate,
                          double excluded,
                          String edgeType) {
    this.cumulativeAttempts = cumulativeAttempts;
    this.attempts = attempts;
    this.complete = complete;
    this.unchanged = unchanged;
    this.selfLoop = selfLoop;
    this.duplicate = duplicate;
    this.undirectedDuplicate = undirectedDuplicate;
    this.excluded = excluded;
    this.edgeType = edgeType;
  }

  public PermutationStats withEdgeType(String edgeType) {
    return new PermutationStats(cumulativeAttempts, attempts, complete, unchanged, selfLoop,
                                duplicate, undirectedDuplicate, excluded, edgeType);
  }

  @Override
  public String toString() {
    return String.format("attempts %d (+%d), %.1f%% complete, %.3f unchanged, rejected: "
                         + "self_loop %.3f, duplicate %.3f, undirected_duplicate %.3f, "
                         + "excluded %.3f",
                         cumulativeAttempts, attempts, complete * 100, unchanged, selfLoop,
                         duplicate, undirectedDuplicate, excluded);
  }
}
