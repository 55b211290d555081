package io.vulnwitness.witness;

import io.vulnwitness.model.CallStack;
import io.vulnwitness.model.Result;
import io.vulnwitness.model.Vuln;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Computes representative call stacks for every vulnerability of a result.
 * <p>
 * One search is submitted per vuln with a call sink. Searches only read the call graph.
 * Their results are joined in result order and merged by the calling thread, so the
 * mapping is the same whatever order the searches complete in.
 */
public class WitnessFinder {

    private static final Logger log = LoggerFactory.getLogger(WitnessFinder.class);

    private final int parallelism;
    private final SearchListener listener;

    /**
     * Creates a finder using one thread per available processor.
     */
    public WitnessFinder() {
        this(Runtime.getRuntime().availableProcessors());
    }

    public WitnessFinder(int parallelism) {
        this(parallelism, SearchListener.NONE);
    }

    /**
     * @param parallelism Maximum number of concurrent searches
     * @param listener    Observer shared by all searches, must be thread-safe
     */
    public WitnessFinder(int parallelism, SearchListener listener) {
        if (parallelism < 1) {
            throw new IllegalArgumentException("Parallelism must be at least 1, got " + parallelism);
        }
        this.parallelism = parallelism;
        this.listener = listener != null ? listener : SearchListener.NONE;
    }

    /**
     * Finds witnesses using a pool owned by this call.
     */
    public Witnesses findWitnesses(Result result) {
        List<Vuln> vulns = result.vulnsWithCallSink();
        if (vulns.isEmpty()) {
            log.info("No vulnerability with a call sink among {} vulnerabilities", result.vulns().size());
            return Witnesses.empty();
        }

        ExecutorService executor = Executors.newFixedThreadPool(
                Math.min(parallelism, vulns.size()), new SearchThreadFactory());
        try {
            return findWitnesses(result, executor);
        } finally {
            executor.shutdown();
        }
    }

    /**
     * Finds witnesses on the given executor. The executor is not shut down.
     * <p>
     * Waits for every search. If a search fails, the first failure is rethrown once all
     * searches are done, with later failures attached as suppressed exceptions.
     */
    public Witnesses findWitnesses(Result result, ExecutorService executor) {
        WitnessSearch search = new WitnessSearch(result, listener);

        Map<Vuln, Future<Optional<CallStack>>> pending = new LinkedHashMap<>();
        for (Vuln vuln : result.vulnsWithCallSink()) {
            pending.put(vuln, executor.submit(() -> search.witness(vuln)));
        }

        Map<Vuln, CallStack> stacks = new LinkedHashMap<>();
        Throwable failure = null;
        for (Map.Entry<Vuln, Future<Optional<CallStack>>> entry : pending.entrySet()) {
            try {
                stacks.put(entry.getKey(), entry.getValue().get().orElse(null));
            } catch (ExecutionException e) {
                Throwable cause = unwrap(entry.getKey(), e);
                if (failure == null) {
                    failure = cause;
                } else {
                    failure.addSuppressed(cause);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("Interrupted while waiting for witness searches", e);
            }
        }
        if (failure instanceof Error error) {
            throw error;
        }
        if (failure != null) {
            throw (RuntimeException) failure;
        }

        Witnesses witnesses = Witnesses.of(stacks);
        log.info("Searched {} of {} vulnerabilities, {} reachable",
                witnesses.size(), result.vulns().size(), witnesses.reachable().size());
        return witnesses;
    }

    /**
     * Returns the unchecked cause of a failed search, wrapping checked causes.
     */
    private static Throwable unwrap(Vuln vuln, ExecutionException e) {
        Throwable cause = e.getCause();
        if (cause instanceof Error || cause instanceof RuntimeException) {
            return cause;
        }
        return new IllegalStateException("Witness search failed for " + vuln, cause);
    }

    private static final class SearchThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread thread = new Thread(r, "witness-search-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
