package com.acme.finops.ossaudit.ci;

import com.acme.finops.ossaudit.license.NettyPomFetcher;
import com.acme.finops.ossaudit.license.PomLicenseResolver;
import com.acme.finops.ossaudit.util.AuditExitCodes;

import java.util.Map;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.Logger;

public final class OssAuditMain {
    private static final Logger LOG = Logger.getLogger(OssAuditMain.class.getName());
    private static final String BASE_LOGGER = "com.acme.finops.ossaudit";

    private OssAuditMain() {
    }

    public static void main(String[] args) {
        System.exit(run(args, System.getenv()));
    }

    static int run(String[] args, Map<String, String> env) {
        AuditOptions options;
        try {
            options = AuditOptions.parse(args, env);
        } catch (IllegalArgumentException e) {
            System.err.println(e.getMessage());
            System.err.println(AuditOptions.USAGE);
            return AuditExitCodes.USAGE;
        }
        if (options.debug()) {
            enableDebugLogging();
        }
        try (NettyPomFetcher fetcher = new NettyPomFetcher(
            options.httpTimeoutMillis(), options.httpTries(), options.httpRetryDelayMillis())) {
            OssAuditRunner runner = new OssAuditRunner(new PomLicenseResolver(fetcher), options.threads());
            return run(runner, options);
        }
    }

    static int run(OssAuditRunner runner, AuditOptions options) {
        try {
            OssAuditRunner.RunReport report = runner.execute(options);
            boolean pass = report.result().verdict().passed();
            System.out.println("auditResult=" + (pass ? "pass" : "fail")
                + " issues=" + report.result().issues().size()
                + " bom=" + report.files().bom());
            return pass ? AuditExitCodes.OK : AuditExitCodes.POLICY_VIOLATION;
        } catch (AuditException e) {
            LOG.log(Level.SEVERE, "audit failed: " + e.getMessage(), e);
            return AuditExitCodes.AUDIT_FAILED;
        }
    }

    private static void enableDebugLogging() {
        Logger.getLogger(BASE_LOGGER).setLevel(Level.FINE);
        for (Handler handler : Logger.getLogger("").getHandlers()) {
            handler.setLevel(Level.FINE);
        }
    }
}
