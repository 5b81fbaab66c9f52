package edu.cmu.ml.rtw.hetnet.parallel;

import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import org.apache.log4j.Logger;

import com.google.common.base.Preconditions;
import com.google.common.collect.Lists;
import com.google.common.util.concurrent.ThreadFactoryBuilder;

import edu.cmu.ml.rtw.hetnet.errors.HetnetException;

/**
 * A {@link ParallelMapper} backed by a fixed thread pool.  With one worker the tasks simply run
 * in the calling thread.
 *
 * <p>When a task fails, the default is to let every other task finish and then throw the first
 * failure (in task order), with any later failures attached as suppressed exceptions.  With
 * failFast set, the first failure observed cancels the tasks that haven't completed yet.
 */
public class ExecutorParallelMapper implements ParallelMapper {
  private static final Logger log = Logger.getLogger(ExecutorParallelMapper.class);

  private final int numWorkers;
  private final boolean failFast;

  public ExecutorParallelMapper(int numWorkers) {
    this(numWorkers, false);
  }

  public ExecutorParallelMapper(int numWorkers, boolean failFast) {
    Preconditions.checkArgument(numWorkers >= 1, "Need at least one worker, got %s", numWorkers);
    this.numWorkers = numWorkers;
    this.failFast = failFast;
  }

  public int getNumWorkers() {
    return numWorkers;
  }

  @Override
  public <T> List<T> map(List<? extends Callable<T>> tasks) {
    if (numWorkers == 1 || tasks.size() <= 1) {
      return mapSequentially(tasks);
    }
    ExecutorService executor = Executors.newFixedThreadPool(
        Math.min(numWorkers, tasks.size()),
        new ThreadFactoryBuilder().setNameFormat("hetnet-worker-%d").setDaemon(true).build());
    try {
      List<Future<T>> futures = Lists.newArrayList();
      for (Callable<T> task : tasks) {
        futures.add(executor.submit(task));
      }
      List<T> results = Lists.newArrayListWithCapacity(tasks.size());
      RuntimeException failure = null;
      for (int i = 0; i < futures.size(); i++) {
        try {
          results.add(futures.get(i).get());
        } catch (ExecutionException e) {
          RuntimeException cause = asRuntimeException(e.getCause());
          if (failFast) {
            cancelAll(futures);
            throw cause;
          }
          failure = recordFailure(failure, cause);
          results.add(null);
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
          cancelAll(futures);
          throw new HetnetException("Interrupted while waiting for task " + i, e);
        }
      }
      if (failure != null) {
        throw failure;
      }
      return results;
    } finally {
      executor.shutdownNow();
    }
  }

  private <T> List<T> mapSequentially(List<? extends Callable<T>> tasks) {
    List<T> results = Lists.newArrayListWithCapacity(tasks.size());
    RuntimeException failure = null;
    for (Callable<T> task : tasks) {
      try {
        results.add(task.call());
      } catch (Exception e) {
        RuntimeException cause = asRuntimeException(e);
        if (failFast) {
          throw cause;
        }
        failure = recordFailure(failure, cause);
        results.add(null);
      }
    }
    if (failure != null) {
      throw failure;
    }
    return results;
  }

  private RuntimeException recordFailure(RuntimeException first, RuntimeException next) {
    log.error("Task failed: " + next.getMessage());
    if (first == null) {
      return next;
    }
    first.addSuppressed(next);
    return first;
  }

  private RuntimeException asRuntimeException(Throwable throwable) {
    if (throwable instanceof RuntimeException) {
      return (RuntimeException) throwable;
    }
    if (throwable instanceof Error) {
      throw (Error) throwable;
    }
    return new HetnetException("Task failed: " + throwable.getMessage(), throwable);
  }

  private <T> void cancelAll(List<Future<T>> futures) {
    for (Future<T> future : futures) {
      future.cancel(true);
    }
  }
}
