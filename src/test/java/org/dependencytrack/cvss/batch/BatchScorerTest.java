package org.dependencytrack.cvss.batch;

import org.dependencytrack.cvss.batch.BatchEntry.Status;
import org.dependencytrack.cvss.engine.CvssCalculator;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatExceptionOfType;

class BatchScorerTest {

    @Test
    void scoreShouldReportEveryRowInInputOrder() throws Exception {
        final List<String> vectors = Arrays.asList(
                "CVSS:3.1/AV:N/AC:L/PR:N/UI:N/S:U/C:H/I:H/A:H",
                "",
                "CVSS:3.1/AV:N/AC:L/PR:N/UI:N/S:U/C:H/I:H/A:Z",
                null,
                "CVSS:4.0/AV:N/AC:L/AT:N/PR:N/UI:N/VC:H/VI:H/VA:H/SC:H/SI:H/SA:H",
                "   ");

        final List<BatchEntry> entries = new BatchScorer(new CvssCalculator(), 4).score(vectors);

        assertThat(entries).satisfiesExactly(
                entry -> {
                    assertThat(entry.row()).isEqualTo(1);
                    assertThat(entry.status()).isEqualTo(Status.SCORED);
                    assertThat(entry.result()).isNotNull();
                    assertThat(entry.result().baseScore()).isEqualTo(9.8);
                    assertThat(entry.error()).isNull();
                },
                entry -> {
                    assertThat(entry.row()).isEqualTo(2);
                    assertThat(entry.status()).isEqualTo(Status.SKIPPED);
                    assertThat(entry.result()).isNull();
                },
                entry -> {
                    assertThat(entry.row()).isEqualTo(3);
                    assertThat(entry.status()).isEqualTo(Status.FAILED);
                    assertThat(entry.input()).isEqualTo("CVSS:3.1/AV:N/AC:L/PR:N/UI:N/S:U/C:H/I:H/A:Z");
                    assertThat(entry.error()).isEqualTo("Invalid value Z for metric A of CVSS 3.1; expected one of H, L, N");
                },
                entry -> {
                    assertThat(entry.row()).isEqualTo(4);
                    assertThat(entry.status()).isEqualTo(Status.SKIPPED);
                    assertThat(entry.input()).isNull();
                },
                entry -> {
                    assertThat(entry.row()).isEqualTo(5);
                    assertThat(entry.status()).isEqualTo(Status.SCORED);
                    assertThat(entry.result().baseScore()).isEqualTo(10.0);
                },
                entry -> {
                    assertThat(entry.row()).isEqualTo(6);
                    assertThat(entry.status()).isEqualTo(Status.SKIPPED);
                });
    }

    @Test
    void scoreShouldYieldSameEntriesRegardlessOfParallelism() throws Exception {
        final var vectors = new ArrayList<String>();
        for (int i = 0; i < 200; i++) {
            vectors.add(switch (i % 4) {
                case 0 -> "CVSS:3.1/AV:N/AC:L/PR:N/UI:N/S:U/C:H/I:H/A:H/E:P";
                case 1 -> "CVSS:4.0/AV:N/AC:L/AT:N/PR:N/UI:N/VC:H/VI:H/VA:H/SC:N/SI:N/SA:N/CR:L";
                case 2 -> "CVSS:3.1/AV:N";
                default -> "";
            });
        }

        final List<BatchEntry> sequentialEntries = new BatchScorer(new CvssCalculator(), 1).score(vectors);
        final List<BatchEntry> parallelEntries = new BatchScorer(new CvssCalculator(), 8).score(vectors);

        assertThat(parallelEntries).containsExactlyElementsOf(sequentialEntries);
        assertThat(parallelEntries).extracting(BatchEntry::row).doesNotHaveDuplicates();
        assertThat(parallelEntries).filteredOn(entry -> entry.status() == Status.FAILED).hasSize(50);
    }

    @Test
    void scoreShouldReturnEmptyListForEmptyInput() throws Exception {
        assertThat(new BatchScorer(new CvssCalculator(), 2).score(List.of())).isEmpty();
    }

    @Test
    void constructorShouldThrowWhenParallelismIsNotPositive() {
        assertThatExceptionOfType(IllegalArgumentException.class)
                .isThrownBy(() -> new BatchScorer(new CvssCalculator(), 0))
                .withMessage("parallelism must be at least 1, but is 0");
    }

}
