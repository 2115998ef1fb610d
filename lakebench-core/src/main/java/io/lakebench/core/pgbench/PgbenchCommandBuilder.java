package io.lakebench.core.pgbench;

import io.lakebench.api.credential.Credential;
import io.lakebench.api.credential.DatabaseTarget;
import io.lakebench.api.pgbench.PgbenchRunConfig;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds the pgbench command line and process environment.
 * <p>
 * The command line is a pure function of the configuration and the script list and never
 * carries connection secrets; those travel in the environment only.
 */
public final class PgbenchCommandBuilder {

    static final String SSL_MODE = "require";

    private PgbenchCommandBuilder() {}

    public static List<String> command(PgbenchRunConfig config, List<ScriptWorkspace.Script> scripts) {
        config.validate();
        List<String> cmd = new ArrayList<>();
        cmd.add(config.executable());
        cmd.add("-n");
        cmd.add("-c");
        cmd.add(String.valueOf(config.clients()));
        cmd.add("-j");
        cmd.add(String.valueOf(config.jobs()));
        if (config.transactionBounded()) {
            cmd.add("-t");
            cmd.add(String.valueOf(config.transactionsPerClient()));
        } else {
            cmd.add("-T");
            cmd.add(String.valueOf(config.duration().toSeconds()));
        }
        if (config.progressIntervalSeconds() != null) {
            cmd.add("-P");
            cmd.add(String.valueOf(config.progressIntervalSeconds()));
        }
        cmd.add("-M");
        cmd.add(config.protocol().flagValue());
        if (config.targetRate() != null) {
            cmd.add("-R");
            cmd.add(String.valueOf(config.targetRate()));
        }
        if (config.perStatementLatency()) {
            cmd.add("-r");
        }
        if (config.detailedLogging()) {
            cmd.add("-l");
        }
        if (config.reconnectPerTransaction()) {
            cmd.add("-C");
        }
        for (ScriptWorkspace.Script script : scripts) {
            for (int w = 0; w < script.weight(); w++) {
                cmd.add("-f");
                cmd.add(script.fileName());
            }
        }
        return cmd;
    }

    /**
     * Connection variables libpq reads, including the current credential as password.
     */
    public static Map<String, String> environment(DatabaseTarget target, Credential credential) {
        Map<String, String> env = new LinkedHashMap<>();
        env.put("PGHOST", target.host());
        env.put("PGPORT", String.valueOf(target.port()));
        env.put("PGDATABASE", target.database());
        env.put("PGUSER", target.user());
        env.put("PGPASSWORD", credential.token());
        env.put("PGSSLMODE", SSL_MODE);
        return env;
    }
}
