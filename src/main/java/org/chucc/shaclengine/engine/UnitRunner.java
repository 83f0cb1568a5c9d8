package org.chucc.shaclengine.engine;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ScheduledFuture;
import org.chucc.shaclengine.exception.UnitTimeoutException;
import org.chucc.shaclengine.model.ValidationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * Runs validation units and isolates their failures.
 *
 * <p>Every unit yields its own result list. A unit that throws (including
 * {@link StackOverflowError}) or times out yields a single engine error result
 * instead; sibling units are never cancelled. Only fatal virtual machine
 * errors such as {@link OutOfMemoryError} escape. Result lists are returned in
 * unit order in every mode.</p>
 *
 * <p>Worker and watchdog threads only live for the duration of one call.</p>
 */
class UnitRunner {

  private static final Logger logger = LoggerFactory.getLogger(UnitRunner.class);

  /** Grace period for aborted workers to stop after a run. */
  private static final int SHUTDOWN_GRACE_SECONDS = 5;

  /**
   * Evaluates one unit.
   */
  @FunctionalInterface
  interface UnitEvaluator {

    /**
     * Evaluates a unit.
     *
     * @param unit the unit
     * @param deadline instant by which the unit must finish, or null for none
     * @return the unit's results
     */
    List<ValidationResult> evaluate(ValidationUnit unit, Instant deadline);
  }

  private final UnitEvaluator evaluator;

  UnitRunner(UnitEvaluator evaluator) {
    this.evaluator = evaluator;
  }

  /**
   * Runs units one after another on the calling thread.
   *
   * @param units the units, in order
   * @return one result list per unit, in unit order
   */
  List<List<ValidationResult>> runInline(List<ValidationUnit> units) {
    List<List<ValidationResult>> results = new ArrayList<>(units.size());
    for (ValidationUnit unit : units) {
      try {
        results.add(evaluator.evaluate(unit, null));
      } catch (Throwable failure) {
        rethrowIfFatal(failure);
        results.add(List.of(failed(unit, failure)));
      }
    }
    return results;
  }

  /**
   * Runs units on a fixed pool of worker threads.
   *
   * <p>The timeout of a unit starts when a worker picks it up, not when it is
   * queued. The evaluator receives the matching deadline so that long running
   * queries can be cancelled by their engine. On timeout the unit's worker is
   * also interrupted and the unit is reported as failed.</p>
   *
   * @param units the units
   * @param workerCount number of worker threads (units in flight)
   * @param timeout per-unit timeout, or null for none
   * @return one result list per unit, in unit order
   */
  List<List<ValidationResult>> runOnPool(List<ValidationUnit> units, int workerCount,
      Duration timeout) {
    if (units.isEmpty()) {
      return List.of();
    }

    ThreadPoolTaskExecutor workers = workerPool(Math.min(workerCount, units.size()));
    ThreadPoolTaskScheduler watchdog = timeout == null ? null : watchdog();

    try {
      List<CompletableFuture<List<ValidationResult>>> outcomes = new ArrayList<>(units.size());
      for (ValidationUnit unit : units) {
        CompletableFuture<List<ValidationResult>> outcome = new CompletableFuture<>();
        workers.execute(() -> runGuarded(unit, outcome, watchdog, timeout));
        outcomes.add(outcome);
      }

      List<List<ValidationResult>> results = new ArrayList<>(units.size());
      for (int i = 0; i < units.size(); i++) {
        results.add(await(units.get(i), outcomes.get(i)));
      }
      return results;
    } finally {
      if (watchdog != null) {
        watchdog.shutdown();
      }
      workers.shutdown();
      if (!workers.getThreadPoolExecutor().isTerminated()) {
        logger.warn("Validation worker threads did not stop within {}s",
            SHUTDOWN_GRACE_SECONDS);
      }
    }
  }

  private void runGuarded(ValidationUnit unit, CompletableFuture<List<ValidationResult>> outcome,
      ThreadPoolTaskScheduler watchdog, Duration timeout) {
    UnitAttempt attempt = new UnitAttempt(Thread.currentThread());
    Instant deadline = null;
    ScheduledFuture<?> alarm = null;
    if (watchdog != null) {
      deadline = Instant.now().plus(timeout);
      alarm = watchdog.schedule(() -> {
        if (attempt.abort()) {
          outcome.completeExceptionally(new UnitTimeoutException(timeout));
        }
      }, deadline);
    }

    try {
      List<ValidationResult> results = evaluator.evaluate(unit, deadline);
      if (attempt.finish()) {
        outcome.complete(results);
      }
    } catch (Throwable failure) {
      // Handed to the caller, which rethrows fatal errors
      if (attempt.finish()) {
        outcome.completeExceptionally(failure instanceof Exception && pastDeadline(deadline)
            ? new UnitTimeoutException(timeout) : failure);
      }
    } finally {
      if (alarm != null) {
        alarm.cancel(false);
      }
      attempt.finish();
      // Clear an interrupt delivered by an abort so the next unit starts clean
      Thread.interrupted();
    }
  }

  /**
   * A query cancelled by its engine at the deadline can fail before the
   * watchdog fires. Such exceptions are reported as timeouts.
   */
  private static boolean pastDeadline(Instant deadline) {
    return deadline != null && !Instant.now().isBefore(deadline);
  }

  private List<ValidationResult> await(ValidationUnit unit,
      CompletableFuture<List<ValidationResult>> outcome) {
    try {
      return outcome.get();
    } catch (ExecutionException e) {
      rethrowIfFatal(e.getCause());
      return List.of(failed(unit, e.getCause()));
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      logger.warn("Run interrupted, abandoning unit {} / {}",
          unit.shape().id(), unit.focusNode());
      return List.of(EngineErrors.interrupted(unit));
    }
  }

  private ValidationResult failed(ValidationUnit unit, Throwable failure) {
    ValidationResult result = EngineErrors.fromFailure(unit, failure);
    logger.warn("Validation unit failed for shape {} and focus node {}: {}",
        unit.shape().id(), unit.focusNode(), result.message(), failure);
    return result;
  }

  /**
   * Rethrows virtual machine errors the process cannot recover from. A stack
   * overflow only unwinds the failing unit and is isolated like any other
   * failure.
   */
  private static void rethrowIfFatal(Throwable failure) {
    if (failure instanceof VirtualMachineError error && !(failure instanceof StackOverflowError)) {
      throw error;
    }
  }

  private static ThreadPoolTaskExecutor workerPool(int size) {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(size);
    executor.setMaxPoolSize(size);
    executor.setThreadNamePrefix("shacl-unit-");
    executor.setDaemon(true);
    executor.setWaitForTasksToCompleteOnShutdown(false);
    executor.setAwaitTerminationSeconds(SHUTDOWN_GRACE_SECONDS);
    executor.initialize();
    return executor;
  }

  private static ThreadPoolTaskScheduler watchdog() {
    ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
    scheduler.setPoolSize(1);
    scheduler.setThreadNamePrefix("shacl-watchdog-");
    scheduler.setDaemon(true);
    scheduler.setRemoveOnCancelPolicy(true);
    scheduler.initialize();
    return scheduler;
  }

  /**
   * Tracks one execution of a unit so that a timeout interrupts the worker
   * only while that unit is still running on it.
   */
  private static final class UnitAttempt {
    private final Thread worker;
    private boolean done;

    UnitAttempt(Thread worker) {
      this.worker = worker;
    }

    synchronized boolean finish() {
      if (done) {
        return false;
      }
      done = true;
      return true;
    }

    synchronized boolean abort() {
      if (done) {
        return false;
      }
      done = true;
      worker.interrupt();
      return true;
    }
  }
}
