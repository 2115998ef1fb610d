package io.lakebench.core.pgbench;

import io.lakebench.api.workload.SqlPlaceholders;
import io.lakebench.api.workload.WeightedQuery;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;

/**
 * Temporary directory holding one script file per query for a single pgbench run.
 * The tool runs with this directory as its working directory, so its transaction logs land
 * here too. Everything is deleted on close.
 */
public class ScriptWorkspace implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ScriptWorkspace.class);

    static final String LOG_PREFIX = "pgbench_log.";

    private final Path directory;
    private final List<Script> scripts;

    private ScriptWorkspace(Path directory, List<Script> scripts) {
        this.directory = directory;
        this.scripts = scripts;
    }

    /**
     * A script file registered with the tool {@code weight} times.
     */
    public record Script(String fileName, String queryIdentifier, int weight) {}

    /**
     * Create a fresh workspace with {@code query_<i>.sql} per query.
     *
     * @throws IllegalArgumentException if a query uses bound-parameter placeholders, which the tool cannot fill
     */
    public static ScriptWorkspace create(List<WeightedQuery> queries) {
        for (WeightedQuery weighted : queries) {
            if (SqlPlaceholders.count(weighted.query().sqlText()) > 0) {
                throw new IllegalArgumentException("Query '" + weighted.query().identifier()
                        + "' uses " + SqlPlaceholders.PLACEHOLDER + " placeholders, which pgbench scripts cannot bind");
            }
        }
        Path directory;
        try {
            directory = Files.createTempDirectory("pgbench_");
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create pgbench workspace", e);
        }
        ScriptWorkspace workspace = new ScriptWorkspace(directory, new ArrayList<>());
        try {
            for (int i = 0; i < queries.size(); i++) {
                WeightedQuery weighted = queries.get(i);
                String fileName = "query_" + i + ".sql";
                Files.writeString(directory.resolve(fileName), weighted.query().sqlText().strip() + "\n");
                workspace.scripts.add(new Script(fileName, weighted.query().identifier(), weighted.weight()));
                log.debug("Created pgbench script {} for '{}' (weight {})",
                        fileName, weighted.query().identifier(), weighted.weight());
            }
        } catch (IOException e) {
            workspace.close();
            throw new UncheckedIOException("Cannot write pgbench scripts", e);
        }
        return workspace;
    }

    public Path directory() {
        return directory;
    }

    public List<Script> scripts() {
        return Collections.unmodifiableList(scripts);
    }

    /**
     * Query identifier of every script slot in registration order. A script with weight
     * {@code w} occupies {@code w} consecutive slots; the tool numbers slots from 0.
     */
    public List<String> scriptSlots() {
        List<String> slots = new ArrayList<>();
        for (Script script : scripts) {
            for (int w = 0; w < script.weight(); w++) {
                slots.add(script.queryIdentifier());
            }
        }
        return slots;
    }

    /**
     * @return per-transaction log files the tool wrote, sorted by name
     */
    public List<Path> transactionLogs() {
        List<Path> logs = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory, LOG_PREFIX + "*")) {
            stream.forEach(logs::add);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot list transaction logs in " + directory, e);
        }
        logs.sort(Comparator.naturalOrder());
        return logs;
    }

    public boolean exists() {
        return Files.exists(directory);
    }

    @Override
    public void close() {
        if (!Files.exists(directory)) {
            return;
        }
        try (Stream<Path> paths = Files.walk(directory)) {
            for (Path path : paths.sorted(Comparator.reverseOrder()).toList()) {
                Files.deleteIfExists(path);
            }
        } catch (IOException e) {
            log.warn("Failed to delete pgbench workspace {}: {}", directory, e.getMessage());
        }
    }
}
