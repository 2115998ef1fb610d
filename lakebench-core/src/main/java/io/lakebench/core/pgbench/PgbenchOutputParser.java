package io.lakebench.core.pgbench;

import io.lakebench.api.report.ProgressSample;
import io.lakebench.api.report.StatementLatency;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses pgbench's summary output, progress lines and per-transaction log files.
 */
public class PgbenchOutputParser {

    private static final Logger log = LoggerFactory.getLogger(PgbenchOutputParser.class);

    private static final Pattern TPS = Pattern.compile("(?m)^tps = ([\\d.]+)");
    private static final Pattern LATENCY_AVERAGE = Pattern.compile("(?m)^latency average = ([\\d.]+) ms");
    private static final Pattern LATENCY_STDDEV = Pattern.compile("(?m)^latency stddev = ([\\d.]+) ms");
    private static final Pattern PROCESSED = Pattern.compile("(?m)^number of transactions actually processed: (\\d+)");
    private static final Pattern FAILED = Pattern.compile("(?m)^number of failed transactions: (\\d+)");
    private static final Pattern TRANSACTION_TYPE = Pattern.compile("(?m)^transaction type: (.+)$");

    private static final Pattern SCRIPT_HEADER = Pattern.compile("^SQL script (\\d+): (.+)$");
    private static final Pattern SCRIPT_TRANSACTIONS = Pattern.compile("^ - (\\d+) transactions");
    private static final Pattern SCRIPT_FAILED = Pattern.compile("^ - number of failed transactions: (\\d+)");
    private static final Pattern SCRIPT_LATENCY = Pattern.compile("^ - latency average = ([\\d.]+) ms");
    private static final Pattern STATEMENT_HEADER = Pattern.compile("statement latencies in milliseconds( and failures)?:");
    private static final Pattern STATEMENT_WITH_FAILURES = Pattern.compile("^\\s+([\\d.]+)\\s+(\\d+)\\s+(.+)$");
    private static final Pattern STATEMENT = Pattern.compile("^\\s+([\\d.]+)\\s+(.+)$");

    private static final Pattern PROGRESS = Pattern.compile(
            "^progress: ([\\d.]+) s, ([\\d.]+) tps(?:, lat ([\\d.]+) ms(?: stddev ([\\d.]+))?)?");

    static final String MULTIPLE_SCRIPTS = "multiple scripts";

    /**
     * Parse the final summary from stdout; progress lines are collected from both streams
     * since the tool reports progress on stderr.
     */
    public PgbenchSummary parse(String stdout, String stderr) {
        String transactionType = group(TRANSACTION_TYPE, stdout);
        List<PgbenchSummary.ScriptSummary> scripts = new ArrayList<>();
        List<StatementLatency> statements = new ArrayList<>();

        String currentScript = transactionType != null && !MULTIPLE_SCRIPTS.equals(transactionType)
                ? transactionType.strip() : null;
        int scriptNumber = 0;
        Long scriptTransactions = null;
        Long scriptFailed = null;
        Double scriptLatency = null;
        boolean inStatements = false;
        boolean withFailures = false;

        for (String line : stdout.split("\\R")) {
            if (inStatements) {
                Matcher m = (withFailures ? STATEMENT_WITH_FAILURES : STATEMENT).matcher(line);
                if (m.find()) {
                    statements.add(withFailures
                            ? new StatementLatency(currentScript, m.group(3).strip(), Double.parseDouble(m.group(1)), Long.parseLong(m.group(2)))
                            : new StatementLatency(currentScript, m.group(2).strip(), Double.parseDouble(m.group(1)), 0));
                    continue;
                }
                inStatements = false;
            }
            Matcher m = SCRIPT_HEADER.matcher(line);
            if (m.find()) {
                if (scriptNumber > 0) {
                    scripts.add(new PgbenchSummary.ScriptSummary(scriptNumber, currentScript,
                            scriptTransactions, scriptFailed, scriptLatency));
                }
                scriptNumber = Integer.parseInt(m.group(1));
                currentScript = m.group(2).strip();
                scriptTransactions = null;
                scriptFailed = null;
                scriptLatency = null;
                continue;
            }
            if (scriptNumber > 0) {
                if ((m = SCRIPT_TRANSACTIONS.matcher(line)).find()) {
                    scriptTransactions = Long.parseLong(m.group(1));
                    continue;
                }
                if ((m = SCRIPT_FAILED.matcher(line)).find()) {
                    scriptFailed = Long.parseLong(m.group(1));
                    continue;
                }
                if ((m = SCRIPT_LATENCY.matcher(line)).find()) {
                    scriptLatency = Double.parseDouble(m.group(1));
                    continue;
                }
            }
            m = STATEMENT_HEADER.matcher(line);
            if (m.find()) {
                inStatements = true;
                withFailures = m.group(1) != null;
            }
        }
        if (scriptNumber > 0) {
            scripts.add(new PgbenchSummary.ScriptSummary(scriptNumber, currentScript,
                    scriptTransactions, scriptFailed, scriptLatency));
        }

        List<ProgressSample> progress = new ArrayList<>();
        collectProgress(stdout, progress);
        collectProgress(stderr, progress);

        return new PgbenchSummary(
                transactionType,
                doubleGroup(TPS, stdout),
                doubleGroup(LATENCY_AVERAGE, stdout),
                doubleGroup(LATENCY_STDDEV, stdout),
                longGroup(PROCESSED, stdout),
                longGroup(FAILED, stdout),
                scripts,
                statements,
                progress
        );
    }

    /**
     * Parse one progress line such as {@code progress: 5.0 s, 1234.5 tps, lat 6.481 ms stddev 1.234, 0 failed}.
     */
    public Optional<ProgressSample> parseProgress(String line) {
        Matcher m = PROGRESS.matcher(line.strip());
        if (!m.find()) {
            return Optional.empty();
        }
        return Optional.of(new ProgressSample(
                Double.parseDouble(m.group(1)),
                Double.parseDouble(m.group(2)),
                m.group(3) != null ? Double.parseDouble(m.group(3)) : null,
                m.group(4) != null ? Double.parseDouble(m.group(4)) : null));
    }

    /**
     * Read per-transaction samples. The log line format is
     * {@code client_id transaction_no time script_no time_epoch time_us [...]} where {@code time}
     * is the transaction's elapsed time in microseconds, or {@code failed} / {@code skipped}.
     */
    public List<TransactionSample> readTransactionLog(List<Path> logFiles) {
        List<TransactionSample> samples = new ArrayList<>();
        for (Path file : logFiles) {
            int malformed = 0;
            try (BufferedReader reader = Files.newBufferedReader(file)) {
                String line;
                while ((line = reader.readLine()) != null) {
                    String[] parts = line.strip().split("\\s+");
                    if (parts.length < 4) {
                        malformed++;
                        continue;
                    }
                    try {
                        int slot = Integer.parseInt(parts[3]);
                        if ("failed".equals(parts[2])) {
                            samples.add(new TransactionSample(slot, null));
                        } else if (!"skipped".equals(parts[2])) {
                            samples.add(new TransactionSample(slot, Double.parseDouble(parts[2]) / 1000.0));
                        }
                    } catch (NumberFormatException e) {
                        malformed++;
                    }
                }
            } catch (IOException e) {
                log.warn("Failed to read transaction log {}: {}", file, e.getMessage());
                continue;
            }
            if (malformed > 0) {
                log.warn("Skipped {} unparsable lines in {}", malformed, file.getFileName());
            }
        }
        log.debug("Read {} transaction samples from {} log files", samples.size(), logFiles.size());
        return samples;
    }

    private void collectProgress(String text, List<ProgressSample> into) {
        if (text == null || text.isEmpty()) {
            return;
        }
        for (String line : text.split("\\R")) {
            parseProgress(line).ifPresent(into::add);
        }
    }

    private static String group(Pattern pattern, String text) {
        Matcher m = pattern.matcher(text);
        return m.find() ? m.group(1) : null;
    }

    private static Double doubleGroup(Pattern pattern, String text) {
        String value = group(pattern, text);
        return value != null ? Double.valueOf(value) : null;
    }

    private static Long longGroup(Pattern pattern, String text) {
        String value = group(pattern, text);
        return value != null ? Long.valueOf(value) : null;
    }
}
