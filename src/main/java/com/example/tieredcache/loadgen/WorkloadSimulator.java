package com.example.tieredcache.loadgen;

import com.example.tieredcache.core.CacheKeys;
import com.example.tieredcache.core.CacheManager;
import com.example.tieredcache.core.CacheStats;
import com.example.tieredcache.core.TierConfig;
import com.example.tieredcache.event.EventBus;
import com.example.tieredcache.event.Events;
import com.example.tieredcache.event.payload.QueryExecution;
import org.apache.commons.math3.distribution.ZipfDistribution;
import org.apache.commons.math3.random.Well19937c;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Drives a {@link CacheManager} in-process with a Zipfian read mix over the query tier.
 *
 * <p>Each worker picks a statement by Zipf rank, reads its cached result and stores a fresh
 * one on a miss. A fraction of the operations are writes, published as {@code query.executed}
 * so the manager drops the connection's cached results.
 *
 * Usage: WorkloadSimulator [requests] [threads] [universe] [alpha] [writeRatio] [connections]
 * Example: WorkloadSimulator 200000 8 5000 0.9 0.01 4
 */
public class WorkloadSimulator {

    private static final Logger log = LoggerFactory.getLogger(WorkloadSimulator.class);

    private final CacheManager cacheManager;
    private final EventBus eventBus;

    public WorkloadSimulator(CacheManager cacheManager, EventBus eventBus) {
        this.cacheManager = cacheManager;
        this.eventBus = eventBus;
    }

    public static void main(String[] args) throws Exception {
        int requests = args.length > 0 ? Integer.parseInt(args[0]) : 200_000;
        int threads = args.length > 1 ? Integer.parseInt(args[1]) : 8;
        int universe = args.length > 2 ? Integer.parseInt(args[2]) : 5_000;
        double alpha = args.length > 3 ? Double.parseDouble(args[3]) : 0.9;
        double writeRatio = args.length > 4 ? Double.parseDouble(args[4]) : 0.01;
        int connections = args.length > 5 ? Integer.parseInt(args[5]) : 4;

        EventBus bus = new EventBus();
        CacheManager manager = new CacheManager(TierConfig.defaults(), bus);
        try {
            Workload workload = new Workload(requests, threads, universe, alpha, writeRatio, connections, 42L);
            Result result = new WorkloadSimulator(manager, bus).run(workload);
            System.out.println(result);
        } finally {
            manager.close();
            bus.close();
        }
    }

    public Result run(Workload workload) throws Exception {
        log.info("Starting workload {}", workload);
        cacheManager.clear();

        ExecutorService executor = Executors.newFixedThreadPool(workload.threads);
        AtomicLong writes = new AtomicLong();
        ConcurrentLinkedQueue<Double> latencies = new ConcurrentLinkedQueue<>();
        List<Future<?>> workers = new ArrayList<>();

        try {
            for (int t = 0; t < workload.threads; t++) {
                int share = workload.requests / workload.threads
                    + (t < workload.requests % workload.threads ? 1 : 0);
                long seed = workload.seed + t;
                workers.add(executor.submit(() -> runWorker(workload, share, seed, writes, latencies)));
            }
            for (Future<?> worker : workers) {
                worker.get();
            }
        } finally {
            executor.shutdown();
        }

        DescriptiveStatistics stats = new DescriptiveStatistics();
        latencies.forEach(stats::addValue);

        CacheStats cacheStats = cacheManager.getStats();
        Result result = new Result(cacheStats.getHits(), cacheStats.getMisses(), writes.get(),
            stats.getN() > 0 ? stats.getPercentile(99) : 0.0);
        log.info("Workload finished: {}", result);
        return result;
    }

    private void runWorker(Workload workload, int operations, long seed,
                           AtomicLong writes, ConcurrentLinkedQueue<Double> latencies) {
        Random rand = new Random(seed);
        ZipfDistribution zipf = new ZipfDistribution(new Well19937c(seed), workload.universe, workload.alpha);

        for (int i = 0; i < operations; i++) {
            String connectionId = "conn-" + rand.nextInt(workload.connections);
            if (rand.nextDouble() < workload.writeRatio) {
                String statement = "UPDATE t" + zipf.sample() + " SET v = v + 1";
                eventBus.emit(Events.QUERY_EXECUTED,
                    new QueryExecution(connectionId, statement, Duration.ofMillis(1)));
                writes.incrementAndGet();
                continue;
            }

            String statement = "SELECT * FROM t" + zipf.sample();
            String key = CacheKeys.query(connectionId, CacheKeys.hashQuery(statement));
            long start = System.nanoTime();
            if (cacheManager.get(key).isEmpty()) {
                cacheManager.set(key, "rows-of:" + statement);
            }
            latencies.add((System.nanoTime() - start) / 1_000.0);
        }
    }

    /**
     * Shape of one run.
     */
    public static final class Workload {
        final int requests;
        final int threads;
        final int universe;
        final double alpha;
        final double writeRatio;
        final int connections;
        final long seed;

        public Workload(int requests, int threads, int universe, double alpha,
                        double writeRatio, int connections, long seed) {
            if (requests < 0 || threads <= 0 || universe <= 0 || connections <= 0) {
                throw new IllegalArgumentException("requests must be >= 0; threads, universe and connections > 0");
            }
            if (writeRatio < 0.0 || writeRatio > 1.0) {
                throw new IllegalArgumentException("writeRatio must be within [0, 1]: " + writeRatio);
            }
            this.requests = requests;
            this.threads = threads;
            this.universe = universe;
            this.alpha = alpha;
            this.writeRatio = writeRatio;
            this.connections = connections;
            this.seed = seed;
        }

        @Override
        public String toString() {
            return String.format("Workload(requests=%d, threads=%d, universe=%d, alpha=%.2f, writeRatio=%.3f, connections=%d)",
                requests, threads, universe, alpha, writeRatio, connections);
        }
    }

    public static final class Result {
        private final long hits;
        private final long misses;
        private final long writes;
        private final double p99LookupMicros;

        Result(long hits, long misses, long writes, double p99LookupMicros) {
            this.hits = hits;
            this.misses = misses;
            this.writes = writes;
            this.p99LookupMicros = p99LookupMicros;
        }

        public long getHits() { return hits; }
        public long getMisses() { return misses; }
        public long getWrites() { return writes; }
        public double getP99LookupMicros() { return p99LookupMicros; }

        public double getHitRate() {
            long total = hits + misses;
            return total > 0 ? (double) hits / total : 0.0;
        }

        @Override
        public String toString() {
            return String.format("Result(hits=%d, misses=%d, writes=%d, hitRate=%.3f, p99=%.2fus)",
                hits, misses, writes, getHitRate(), p99LookupMicros);
        }
    }
}
