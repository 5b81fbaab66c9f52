package edu.cmu.ml.rtw.hetnet.parallel;

import java.util.List;
import java.util.concurrent.Callable;

/**
 * Runs a list of independent tasks and returns their results in the order the tasks were given,
 * no matter which finishes first.
 */
public interface ParallelMapper {
  public <T> List<T> map(List<? extends Callable<T>> tasks);
}
