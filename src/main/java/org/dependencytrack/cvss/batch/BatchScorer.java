package org.dependencytrack.cvss.batch;

import org.dependencytrack.cvss.api.ScoreResult;
import org.dependencytrack.cvss.engine.CvssCalculator;
import org.dependencytrack.cvss.vector.InvalidVectorException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static java.util.Objects.requireNonNull;

/**
 * Scores many vectors concurrently.
 * <p>
 * A row that cannot be scored is reported as such and never aborts the batch.
 */
public final class BatchScorer {

    private static final Logger LOGGER = LoggerFactory.getLogger(BatchScorer.class);

    private final CvssCalculator calculator;
    private final int parallelism;

    public BatchScorer(final CvssCalculator calculator, final int parallelism) {
        this.calculator = requireNonNull(calculator, "calculator must not be null");
        if (parallelism < 1) {
            throw new IllegalArgumentException("parallelism must be at least 1, but is " + parallelism);
        }
        this.parallelism = parallelism;
    }

    /**
     * @param vectors The vector strings to score; {@code null} or blank entries are skipped
     * @return One {@link BatchEntry} per input, in input order
     */
    public List<BatchEntry> score(final List<String> vectors) throws InterruptedException {
        requireNonNull(vectors, "vectors must not be null");
        if (vectors.isEmpty()) {
            return List.of();
        }

        final var futures = new ArrayList<Future<BatchEntry>>(vectors.size());
        final ExecutorService executorService = Executors.newFixedThreadPool(Math.min(parallelism, vectors.size()));
        try {
            for (int i = 0; i < vectors.size(); i++) {
                futures.add(executorService.submit(new ScoreTask(calculator, i + 1, vectors.get(i))));
            }

            final var entries = new ArrayList<BatchEntry>(futures.size());
            for (int i = 0; i < futures.size(); i++) {
                try {
                    entries.add(futures.get(i).get());
                } catch (ExecutionException e) {
                    LOGGER.error("Scoring of row {} failed unexpectedly", i + 1, e.getCause());
                    entries.add(BatchEntry.failed(i + 1, vectors.get(i), String.valueOf(e.getCause())));
                }
            }

            return entries;
        } finally {
            executorService.shutdownNow();
        }
    }

    private static final class ScoreTask implements Callable<BatchEntry> {

        private final CvssCalculator calculator;
        private final int row;
        private final String vector;

        private ScoreTask(final CvssCalculator calculator, final int row, final String vector) {
            this.calculator = calculator;
            this.row = row;
            this.vector = vector;
        }

        @Override
        public BatchEntry call() {
            try (var ignoredMdcRow = MDC.putCloseable("row", String.valueOf(row))) {
                if (vector == null || vector.isBlank()) {
                    LOGGER.debug("No vector provided; Skipping");
                    return BatchEntry.skipped(row, vector);
                }

                try {
                    final ScoreResult result = calculator.calculate(vector);
                    LOGGER.debug("Scored {} as {}", result.vectorString(), result.baseScore());
                    return BatchEntry.scored(row, vector, result);
                } catch (InvalidVectorException e) {
                    LOGGER.warn("Failed to score vector {}: {}", vector, e.getMessage());
                    return BatchEntry.failed(row, vector, e.getMessage());
                }
            }
        }

    }

}
