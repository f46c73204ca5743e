package dev.regula.cascade;

import dev.regula.query.Question;
import dev.regula.retrieval.Backend;
import dev.regula.retrieval.RetrievalAdapter;
import dev.regula.retrieval.RetrievalHit;
import dev.regula.retrieval.ScoreCalibrator;
import dev.regula.retrieval.Tier;
import dev.regula.retrieval.TierQuery;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Runs the retrieval tiers in escalation order until the gathered evidence is good enough.
 *
 * <p>Tiers 1 and 2 (hybrid narrow, hybrid relaxed) always run sequentially. Tiers 3 (graph) and 4
 * (relational full-text) run sequentially by default, or concurrently when {@code
 * regula.cascade.parallel-fallback} is set, in which case Tier 3 is judged first and an unneeded
 * Tier 4 call is cancelled.
 *
 * <p>Every adapter call runs on the retrieval executor under its own timeout. Failures and
 * timeouts are recorded as tier outcomes with zero hits and never propagate. If the calling thread
 * is interrupted, in-flight calls are cancelled, the interrupt flag is restored and the cascade
 * stops with what it has.
 */
@Service
public class TierCascadeController {

  private static final Logger log = LoggerFactory.getLogger(TierCascadeController.class);

  private static final List<Tier> PRIMARY_TIERS =
      List.of(Tier.HYBRID_NARROW, Tier.HYBRID_RELAXED);
  private static final List<Tier> FALLBACK_TIERS = List.of(Tier.GRAPH, Tier.FULL_TEXT);

  private final Map<Backend, RetrievalAdapter> adapters;
  private final TierQueryPlanner planner;
  private final ScoreCalibrator calibrator;
  private final CascadeProperties properties;
  private final ExecutorService executor;

  public TierCascadeController(
      List<RetrievalAdapter> adapters,
      TierQueryPlanner planner,
      ScoreCalibrator calibrator,
      CascadeProperties properties,
      @Qualifier("retrievalExecutor") ExecutorService executor) {
    this.adapters = new EnumMap<>(Backend.class);
    for (RetrievalAdapter adapter : adapters) {
      this.adapters.put(adapter.backend(), adapter);
    }
    this.planner = planner;
    this.calibrator = calibrator;
    this.properties = properties;
    this.executor = executor;
  }

  /**
   * Runs the cascade for one question.
   *
   * @param question the analyzed question
   * @return gathered hits, per-tier outcomes and whether the evidence was accepted
   */
  public CascadeResult run(Question question) {
    CascadeState state = CascadeState.initial();

    for (Tier tier : PRIMARY_TIERS) {
      state = step(state, tier, question);
      if (state.finished()) {
        return CascadeResult.from(state);
      }
    }

    if (properties.isParallelFallback()) {
      state = runFallbackConcurrently(state, question);
    } else {
      for (Tier tier : FALLBACK_TIERS) {
        state = step(state, tier, question);
        if (state.finished()) {
          break;
        }
      }
    }

    if (!state.accepted() && !state.interrupted()) {
      log.info(
          "All tiers exhausted without meeting the stop condition: quality={}, relevant={}",
          format(state.quality().score()),
          state.quality().relevantCount());
    }
    return CascadeResult.from(state);
  }

  private CascadeState step(CascadeState state, Tier tier, Question question) {
    TierQuery query = planner.plan(tier, question, state.hits());
    long started = System.nanoTime();
    Future<List<RetrievalHit>> future = submit(query);
    TierOutcome outcome =
        future == null
            ? unavailable(tier)
            : await(tier, future, started + properties.getTierTimeout().toNanos(), started);
    CascadeState next = state.after(outcome, calibrator, properties);
    logDecision(outcome, next);
    return next;
  }

  private CascadeState runFallbackConcurrently(CascadeState state, Question question) {
    TierQuery graphQuery = planner.plan(Tier.GRAPH, question, state.hits());
    TierQuery fullTextQuery = planner.plan(Tier.FULL_TEXT, question, state.hits());
    long started = System.nanoTime();
    long deadline = started + properties.getTierTimeout().toNanos();
    Future<List<RetrievalHit>> graphFuture = submit(graphQuery);
    Future<List<RetrievalHit>> fullTextFuture = submit(fullTextQuery);

    TierOutcome graphOutcome =
        graphFuture == null
            ? unavailable(Tier.GRAPH)
            : await(Tier.GRAPH, graphFuture, deadline, started);
    CascadeState next = state.after(graphOutcome, calibrator, properties);
    logDecision(graphOutcome, next);

    if (next.finished()) {
      if (fullTextFuture != null) {
        fullTextFuture.cancel(true);
      }
      log.info("Graph tier met the stop condition, discarding the concurrent full-text call");
      return next.discarding(
          new TierOutcome(
              Tier.FULL_TEXT, TierStatus.DISCARDED, List.of(), elapsedMillis(started), null));
    }

    TierOutcome fullTextOutcome =
        fullTextFuture == null
            ? unavailable(Tier.FULL_TEXT)
            : await(Tier.FULL_TEXT, fullTextFuture, deadline, started);
    next = next.after(fullTextOutcome, calibrator, properties);
    logDecision(fullTextOutcome, next);
    return next;
  }

  private @Nullable Future<List<RetrievalHit>> submit(TierQuery query) {
    RetrievalAdapter adapter = adapters.get(query.tier().backend());
    if (adapter == null) {
      return null;
    }
    try {
      return executor.submit(() -> adapter.retrieve(query));
    } catch (RejectedExecutionException e) {
      log.warn("Retrieval executor rejected tier {}: {}", query.tier().number(), e.getMessage());
      return rejected(e);
    }
  }

  private TierOutcome await(
      Tier tier, Future<List<RetrievalHit>> future, long deadlineNanos, long startedNanos) {
    try {
      long remaining = Math.max(0L, deadlineNanos - System.nanoTime());
      List<RetrievalHit> hits = future.get(remaining, TimeUnit.NANOSECONDS);
      return TierOutcome.of(tier, hits == null ? List.of() : hits, elapsedMillis(startedNanos));
    } catch (TimeoutException e) {
      future.cancel(true);
      log.warn(
          "Tier {} timed out after {} ms", tier.number(), properties.getTierTimeout().toMillis());
      return TierOutcome.failed(
          tier,
          TierStatus.TIMED_OUT,
          elapsedMillis(startedNanos),
          "Timed out after " + properties.getTierTimeout().toMillis() + " ms");
    } catch (ExecutionException e) {
      Throwable cause = e.getCause() == null ? e : e.getCause();
      log.warn("Tier {} failed: {}", tier.number(), cause.getMessage());
      return TierOutcome.failed(
          tier, TierStatus.FAILED, elapsedMillis(startedNanos), String.valueOf(cause.getMessage()));
    } catch (InterruptedException e) {
      future.cancel(true);
      Thread.currentThread().interrupt();
      log.warn("Interrupted while waiting for tier {}", tier.number());
      return TierOutcome.failed(
          tier, TierStatus.CANCELLED, elapsedMillis(startedNanos), "Request interrupted");
    } catch (CancellationException e) {
      return TierOutcome.failed(
          tier, TierStatus.CANCELLED, elapsedMillis(startedNanos), "Call cancelled");
    }
  }

  private static Future<List<RetrievalHit>> rejected(RejectedExecutionException cause) {
    CompletableFuture<List<RetrievalHit>> future = new CompletableFuture<>();
    future.completeExceptionally(cause);
    return future;
  }

  private static TierOutcome unavailable(Tier tier) {
    return TierOutcome.failed(
        tier, TierStatus.SKIPPED, 0L, "No adapter registered for " + tier.backend());
  }

  private void logDecision(TierOutcome outcome, CascadeState state) {
    log.info(
        "Tier {} ({}) -> {} with {} hits in {} ms; quality={}, relevant={}, {}",
        outcome.tier().number(),
        outcome.tier().backend(),
        outcome.status(),
        outcome.hits().size(),
        outcome.elapsedMillis(),
        format(state.quality().score()),
        state.quality().relevantCount(),
        state.accepted() ? "stopping" : "escalating");
  }

  private static long elapsedMillis(long startedNanos) {
    return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedNanos);
  }

  private static String format(double value) {
    return String.format(Locale.ROOT, "%.3f", value);
  }
}
