package org.dependencytrack.cvss.batch;

import org.dependencytrack.cvss.api.ScoreResult;
import org.jspecify.annotations.Nullable;

import static java.util.Objects.requireNonNull;

/**
 * Outcome of scoring a single row of a batch.
 *
 * @param row    One-based number of the row in its input
 * @param input  The vector string as provided
 * @param status The {@link Status} of the row
 * @param result The {@link ScoreResult}, if the row was {@link Status#SCORED}
 * @param error  Why the row could not be scored, if it {@link Status#FAILED}
 */
public record BatchEntry(
        int row,
        @Nullable String input,
        Status status,
        @Nullable ScoreResult result,
        @Nullable String error) {

    public enum Status {
        SCORED,
        SKIPPED,
        FAILED
    }

    public BatchEntry {
        requireNonNull(status, "status must not be null");
        if (status == Status.SCORED && result == null) {
            throw new IllegalArgumentException("Scored entries must carry a result");
        }
        if (status == Status.FAILED && error == null) {
            throw new IllegalArgumentException("Failed entries must carry an error");
        }
    }

    static BatchEntry scored(final int row, final String input, final ScoreResult result) {
        return new BatchEntry(row, input, Status.SCORED, result, null);
    }

    static BatchEntry skipped(final int row, final @Nullable String input) {
        return new BatchEntry(row, input, Status.SKIPPED, null, null);
    }

    static BatchEntry failed(final int row, final @Nullable String input, final String error) {
        return new BatchEntry(row, input, Status.FAILED, null, error);
    }

}
