package com.acme.finops.ossaudit.ci;

import com.acme.finops.ossaudit.policy.PolicyEntry;
import com.acme.finops.ossaudit.util.AuditDefaults;
import com.acme.finops.ossaudit.util.AuditEnvKeys;
import com.acme.finops.ossaudit.util.EnvVars;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Command line and environment settings of one audit run.
 *
 * <pre>
 * oss-audit &lt;graph-file&gt; [--target LABEL] [--output_dir DIR] [--output_file_prefix PREFIX]
 *           [--approved_list_path FILE] [--denied_list_path FILE] [--suppress COORD]...
 *           [--strict] [--debug] [--threads N]
 * </pre>
 *
 * @param target       label to audit; {@code null} means the snapshot's root
 * @param outputPrefix {@code null} means derive it from the target label
 */
public record AuditOptions(
    Path graphFile,
    String target,
    Path outputDir,
    String outputPrefix,
    Path approvedList,
    Path deniedList,
    List<String> suppress,
    boolean strict,
    boolean debug,
    int threads,
    int httpTimeoutMillis,
    int httpTries,
    int httpRetryDelayMillis
) {
    public static final String USAGE = "usage: oss-audit <graph-file> [--target LABEL] [--output_dir DIR]"
        + " [--output_file_prefix PREFIX] [--approved_list_path FILE] [--denied_list_path FILE]"
        + " [--suppress COORD]... [--strict] [--debug] [--threads N]";

    public AuditOptions {
        suppress = List.copyOf(suppress);
    }

    /**
     * @throws IllegalArgumentException on unknown flags, missing values or a missing graph file argument
     */
    public static AuditOptions parse(String[] args, Map<String, String> env) {
        Path graphFile = null;
        String target = null;
        Path outputDir = Path.of(".");
        String prefix = null;
        Path approved = null;
        Path denied = null;
        List<String> suppress = new ArrayList<>(EnvVars.getList(env, AuditEnvKeys.OSS_AUDIT_SUPPRESS));
        boolean strict = EnvVars.getBoolean(env, AuditEnvKeys.OSS_AUDIT_STRICT, false);
        boolean debug = EnvVars.getBoolean(env, AuditEnvKeys.OSS_AUDIT_DEBUG, false);
        int threads = EnvVars.getIntClamped(env, AuditEnvKeys.OSS_AUDIT_RESOLVER_THREADS,
            AuditDefaults.defaultResolverThreads(), 1, AuditDefaults.MAX_RESOLVER_THREADS);

        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            String inline = null;
            int eq = arg.indexOf('=');
            if (arg.startsWith("--") && eq > 0) {
                inline = arg.substring(eq + 1);
                arg = arg.substring(0, eq);
            }
            switch (arg) {
                case "--strict" -> strict = inline == null || parseBoolean(inline, arg);
                case "--debug" -> debug = inline == null || parseBoolean(inline, arg);
                case "--target" -> target = inline != null ? inline : value(args, ++i, arg);
                case "--output_dir" -> outputDir = Path.of(inline != null ? inline : value(args, ++i, arg));
                case "--output_file_prefix" -> prefix = inline != null ? inline : value(args, ++i, arg);
                case "--approved_list_path" -> approved = Path.of(inline != null ? inline : value(args, ++i, arg));
                case "--denied_list_path" -> denied = Path.of(inline != null ? inline : value(args, ++i, arg));
                case "--suppress" -> suppress.add(inline != null ? inline : value(args, ++i, arg));
                case "--threads" -> threads = parseThreads(inline != null ? inline : value(args, ++i, arg));
                default -> {
                    if (arg.startsWith("--")) {
                        throw new IllegalArgumentException("unknown option: " + arg);
                    }
                    if (graphFile != null) {
                        throw new IllegalArgumentException("unexpected argument: " + arg);
                    }
                    graphFile = Path.of(arg);
                }
            }
        }
        if (graphFile == null) {
            throw new IllegalArgumentException("missing graph file argument");
        }
        for (String s : suppress) {
            if (PolicyEntry.normalize(s).isEmpty()) {
                throw new IllegalArgumentException("empty suppress coordinate: '" + s + "'");
            }
        }
        return new AuditOptions(
            graphFile,
            target,
            outputDir,
            prefix,
            approved,
            denied,
            suppress,
            strict,
            debug,
            threads,
            EnvVars.getIntClamped(env, AuditEnvKeys.OSS_AUDIT_HTTP_TIMEOUT_MS, AuditDefaults.DEFAULT_RESPONSE_TIMEOUT_MS, 100, 120_000),
            EnvVars.getIntClamped(env, AuditEnvKeys.OSS_AUDIT_HTTP_RETRIES, AuditDefaults.DEFAULT_FETCH_TRIES, 1, 10),
            EnvVars.getIntClamped(env, AuditEnvKeys.OSS_AUDIT_HTTP_RETRY_DELAY_MS, AuditDefaults.DEFAULT_RETRY_DELAY_MS, 0, 60_000)
        );
    }

    private static String value(String[] args, int index, String flag) {
        if (index >= args.length || args[index].startsWith("--")) {
            throw new IllegalArgumentException("missing value for " + flag);
        }
        return args[index];
    }

    private static boolean parseBoolean(String raw, String flag) {
        String value = raw.trim();
        if ("true".equalsIgnoreCase(value)) {
            return true;
        }
        if ("false".equalsIgnoreCase(value)) {
            return false;
        }
        throw new IllegalArgumentException(flag + " expects true or false, got: " + raw);
    }

    private static int parseThreads(String raw) {
        try {
            int parsed = Integer.parseInt(raw.trim());
            return Math.max(1, Math.min(parsed, AuditDefaults.MAX_RESOLVER_THREADS));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("--threads expects a number, got: " + raw, e);
        }
    }
}
