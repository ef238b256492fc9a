package org.dependencytrack.cvss.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.dependencytrack.cvss.batch.BatchEntry;
import org.dependencytrack.cvss.batch.BatchScorer;
import org.dependencytrack.cvss.engine.CvssCalculator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.BufferedWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.Callable;

@Command(name = "batch", description = "Score a file of CVSS vectors, one per line.")
public class BatchCommand implements Callable<Integer> {

    private static final Logger LOGGER = LoggerFactory.getLogger(BatchCommand.class);

    private static final String COMMENT_PREFIX = "#";

    @Option(names = {"-o", "--output"}, description = "File to write JSON Lines results to (default: <input>.scored.jsonl)")
    Path outputFilePath;

    @Option(names = {"-t", "--threads"}, description = "Number of worker threads (default: number of processors)")
    Integer threads;

    @Parameters(description = "File with one vector per line; blank lines are skipped, lines starting with # are ignored")
    Path inputFilePath;

    @Override
    public Integer call() throws Exception {
        if (!Files.isRegularFile(inputFilePath)) {
            throw new IllegalArgumentException("Input file %s does not exist".formatted(inputFilePath));
        }
        if (outputFilePath == null) {
            outputFilePath = inputFilePath.resolveSibling(inputFilePath.getFileName() + ".scored.jsonl");
        }
        if (threads == null) {
            threads = Runtime.getRuntime().availableProcessors();
        }

        final var vectors = new ArrayList<String>();
        final var lineNumbers = new ArrayList<Integer>();
        final List<String> lines = Files.readAllLines(inputFilePath, StandardCharsets.UTF_8);
        for (int i = 0; i < lines.size(); i++) {
            if (lines.get(i).strip().startsWith(COMMENT_PREFIX)) {
                continue;
            }

            vectors.add(lines.get(i));
            lineNumbers.add(i + 1);
        }

        LOGGER.info("Scoring {} rows of {} with {} threads", vectors.size(), inputFilePath, threads);
        final List<BatchEntry> entries = new BatchScorer(new CvssCalculator(), threads).score(vectors);

        final var objectMapper = new ObjectMapper();
        int rowsScored = 0;
        int rowsSkipped = 0;
        int rowsFailed = 0;
        try (final BufferedWriter writer = Files.newBufferedWriter(outputFilePath, StandardCharsets.UTF_8)) {
            for (final BatchEntry entry : entries) {
                final ObjectNode node = objectMapper.createObjectNode();
                node.put("line", lineNumbers.get(entry.row() - 1));
                node.put("input", entry.input());
                node.put("status", entry.status().name().toLowerCase(Locale.ROOT));
                switch (entry.status()) {
                    case SCORED -> {
                        node.set("result", ScoreResultJson.toJson(objectMapper, entry.result()));
                        rowsScored++;
                    }
                    case SKIPPED -> rowsSkipped++;
                    case FAILED -> {
                        node.put("error", entry.error());
                        rowsFailed++;
                    }
                }

                writer.write(objectMapper.writeValueAsString(node));
                writer.newLine();
            }
        }

        LOGGER.info("Processed {} rows: {} scored, {} skipped, {} failed; Results written to {}",
                entries.size(), rowsScored, rowsSkipped, rowsFailed, outputFilePath);
        return rowsFailed == 0 ? 0 : 1;
    }

}
