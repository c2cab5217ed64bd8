package com.slack.indexgateway.util;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.ListeningExecutorService;
import com.google.common.util.concurrent.UncheckedExecutionException;
import io.grpc.Context;
import io.grpc.Contexts;
import io.grpc.Status;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

public final class ConcurrencyUtil {

  /** A unit of work identified by its index in [0, jobs). */
  @FunctionalInterface
  public interface Job {
    void run(int idx) throws Exception;
  }

  private ConcurrencyUtil() {}

  /**
   * Runs jobs {@code 0..jobs-1} with at most {@code concurrency} of them in flight, and waits for
   * all of them. Workers run under {@code ctx}, so RPCs issued by the jobs observe its deadline and
   * cancellation.
   *
   * <p>Once a job fails no new jobs are started, but jobs already running are left to finish. The
   * first failure is rethrown once every worker has returned: unchecked exceptions as-is, checked
   * ones wrapped in an {@link UncheckedExecutionException}. If the context is cancelled before all
   * jobs ran, the cancellation status is thrown.
   */
  public static void forEachJob(
      ListeningExecutorService executor, Context ctx, int jobs, int concurrency, Job job) {
    checkArgument(jobs >= 0, "jobs can't be negative");
    checkArgument(concurrency > 0, "concurrency must be positive");
    if (jobs == 0) {
      return;
    }

    AtomicInteger nextJob = new AtomicInteger();
    AtomicInteger completedJobs = new AtomicInteger();
    AtomicReference<Throwable> firstFailure = new AtomicReference<>();

    int workers = Math.min(jobs, concurrency);
    List<ListenableFuture<?>> workerFutures = new ArrayList<>(workers);
    for (int i = 0; i < workers; i++) {
      workerFutures.add(
          executor.submit(
              ctx.wrap(
                  () -> {
                    while (firstFailure.get() == null && !ctx.isCancelled()) {
                      int idx = nextJob.getAndIncrement();
                      if (idx >= jobs) {
                        return;
                      }
                      try {
                        job.run(idx);
                        completedJobs.incrementAndGet();
                      } catch (Throwable t) {
                        firstFailure.compareAndSet(null, t);
                        return;
                      }
                    }
                  })));
    }

    try {
      Futures.successfulAsList(workerFutures).get();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      workerFutures.forEach(future -> future.cancel(true));
      throw Status.CANCELLED
          .withDescription("interrupted while waiting for jobs")
          .withCause(e)
          .asRuntimeException();
    } catch (ExecutionException e) {
      // successfulAsList never fails
      throw new IllegalStateException(e);
    }

    Throwable failure = firstFailure.get();
    if (failure != null) {
      if (failure instanceof RuntimeException) {
        throw (RuntimeException) failure;
      }
      if (failure instanceof Error) {
        throw (Error) failure;
      }
      throw new UncheckedExecutionException(failure);
    }

    if (completedJobs.get() < jobs) {
      Status status = Contexts.statusFromCancelled(ctx);
      throw (status != null ? status : Status.CANCELLED).asRuntimeException();
    }
  }
}
