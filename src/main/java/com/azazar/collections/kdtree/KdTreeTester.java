package com.azazar.collections.kdtree;

import com.azazar.util.ExponentialAverage;
import java.util.Random;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Fills a {@link KdTree} with random points and checks its nearest neighbour
 * answers against a {@link LinearScanIndex}.
 * <p>
 * Usage: {@code KdTreeTester [count [max [dimensions [seed [queries]]]]]}
 *
 * @author Mikhail Yevchenko <spam@azazar.com>
 */
public class KdTreeTester {

    private static final Logger LOG = Logger.getLogger(KdTreeTester.class.getName());

    private static final int DEFAULT_COUNT = 100000;
    private static final int DEFAULT_MAX = 100000;
    private static final int DEFAULT_DIMENSIONS = 2;
    private static final long DEFAULT_SEED = 0;
    private static final int DEFAULT_QUERIES = 1000;

    private static final double[] FIXED_QUERY = {1111, 3234};

    /**
     * Outcome of a {@link #run} call
     */
    public static final class Report {
        private final int inserted;
        private final int queries;
        private final Point fixedQuery;
        private final Point fixedQueryNearest;
        private final double averageQueryNanos;

        Report(int inserted, int queries, Point fixedQuery, Point fixedQueryNearest, double averageQueryNanos) {
            this.inserted = inserted;
            this.queries = queries;
            this.fixedQuery = fixedQuery;
            this.fixedQueryNearest = fixedQueryNearest;
            this.averageQueryNanos = averageQueryNanos;
        }

        public int inserted() {
            return inserted;
        }

        /**
         * @return number of nearest neighbour queries checked, the fixed one included
         */
        public int queries() {
            return queries;
        }

        public Point fixedQuery() {
            return fixedQuery;
        }

        public Point fixedQueryNearest() {
            return fixedQueryNearest;
        }

        public double averageQueryNanos() {
            return averageQueryNanos;
        }
    }

    private static class ProgressReporter {
        final String action;
        final int total;
        long start = System.currentTimeMillis();
        long lastEcho = start;
        int counter;

        ProgressReporter(String action, int total) {
            this.action = action;
            this.total = total;
        }

        void tick() {
            ++counter;
            long now = System.currentTimeMillis();
            if (now > lastEcho + 1000) {
                LOG.log(Level.INFO, "{0}: {1} / {2}", new Object[]{action, counter, total});
                lastEcho = now;
            }
        }

        void report() {
            LOG.log(Level.INFO, "{0}: {1} done in {2} ms",
                    new Object[]{action, counter, System.currentTimeMillis() - start});
        }
    }

    public static Report run(int count, int max, int dimensions, long seed, int queries) {
        if (count < 1) {
            throw new IllegalArgumentException("Point count must be positive: " + count);
        }
        if (max < 1) {
            throw new IllegalArgumentException("Coordinate bound must be positive: " + max);
        }
        if (queries < 0) {
            throw new IllegalArgumentException("Query count can't be negative: " + queries);
        }
        Random random = new Random(seed);
        KdTree tree = new KdTree(dimensions);
        LinearScanIndex<Point> reference = LinearScanIndex.ofPoints();

        LOG.log(Level.INFO, "Adding {0} points of dimension {1}", new Object[]{count, dimensions});
        ProgressReporter progress = new ProgressReporter("Adding", count);
        for (int i = 0; i < count; i++) {
            Point point = randomPoint(random, dimensions, max);
            tree.insert(point);
            reference.insert(point);
            progress.tick();
        }
        progress.report();
        LOG.log(Level.INFO, "Tree height: {0}", tree.height());

        ExponentialAverage queryNanos = new ExponentialAverage();
        Point fixedQuery = fixedQuery(dimensions);
        Point fixedNearest = check(tree, reference, fixedQuery, queryNanos);
        LOG.log(Level.INFO, "Nearest neighbour of {0}: {1}", new Object[]{fixedQuery, fixedNearest});

        progress = new ProgressReporter("Checking", queries);
        for (int i = 0; i < queries; i++) {
            check(tree, reference, randomPoint(random, dimensions, max), queryNanos);
            progress.tick();
        }
        progress.report();
        LOG.log(Level.INFO, "Average nearest neighbour query: {0} ns", Math.round(queryNanos.value()));

        return new Report(count, queries + 1, fixedQuery, fixedNearest, queryNanos.value());
    }

    private static Point check(KdTree tree, LinearScanIndex<Point> reference, Point query, ExponentialAverage queryNanos) {
        long start = System.nanoTime();
        Neighbor<Point> found = tree.findNearest(query).orElseThrow();
        queryNanos.add(System.nanoTime() - start);

        Neighbor<Point> expected = reference.findNearest(query).orElseThrow();
        if (found.distance() != expected.distance()) {
            throw new IllegalStateException("Bad result for " + query + ": got " + found
                    + ", linear scan found " + expected);
        }
        return found.value();
    }

    static Point fixedQuery(int dimensions) {
        double[] coordinates = new double[dimensions];
        System.arraycopy(FIXED_QUERY, 0, coordinates, 0, Math.min(dimensions, FIXED_QUERY.length));
        return new Point(coordinates);
    }

    private static Point randomPoint(Random random, int dimensions, int max) {
        double[] coordinates = new double[dimensions];
        for (int i = 0; i < dimensions; i++) {
            coordinates[i] = random.nextInt(max);
        }
        return new Point(coordinates);
    }

    /**
     * @param args optional point count, coordinate bound, dimensions, seed and query count
     */
    public static void main(String[] args) {
        int count = args.length > 0 ? Integer.parseInt(args[0]) : DEFAULT_COUNT;
        int max = args.length > 1 ? Integer.parseInt(args[1]) : DEFAULT_MAX;
        int dimensions = args.length > 2 ? Integer.parseInt(args[2]) : DEFAULT_DIMENSIONS;
        long seed = args.length > 3 ? Long.parseLong(args[3]) : DEFAULT_SEED;
        int queries = args.length > 4 ? Integer.parseInt(args[4]) : DEFAULT_QUERIES;

        Report report = run(count, max, dimensions, seed, queries);
        System.out.println("Nearest neighbour of " + report.fixedQuery() + ": " + report.fixedQueryNearest());
    }

}
