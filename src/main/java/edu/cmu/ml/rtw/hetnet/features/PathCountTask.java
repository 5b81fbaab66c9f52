package edu.cmu.ml.rtw.hetnet.features;

import java.util.concurrent.Callable;

import edu.cmu.ml.rtw.hetnet.errors.MetaPathComputationException;
import edu.cmu.ml.rtw.hetnet.matrix.SparseMatrix;

/**
 * One metapath's count, as a unit of work for a
 * {@link edu.cmu.ml.rtw.hetnet.parallel.ParallelMapper}.  Failures come back tagged with the
 * metapath they belong to.
 */
public class PathCountTask implements Callable<SparseMatrix> {
  private final PathCounter counter;
  private final MetaPath metaPath;
  private final PathCountSemantics semantics;

  public PathCountTask(PathCounter counter, MetaPath metaPath, PathCountSemantics semantics) {
    this.counter = counter;
    this.metaPath = metaPath;
    this.semantics = semantics;
  }

  public MetaPath getMetaPath() {
    return metaPath;
  }

  @Override
  public SparseMatrix call() {
    try {
      return counter.count(metaPath, semantics);
    } catch (RuntimeException e) {
      throw new MetaPathComputationException(metaPath.getAbbreviation(), e);
    }
  }
}
