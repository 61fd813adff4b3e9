package com.linkresolver.resolver.config;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Process-wide tuning derived once at startup: whether we run in a paid cloud environment
 * where proxy and browser usage should be kept low.
 */
public final class CostEnvironment {

    static final List<String> CLOUD_MARKERS = List.of(
            "APIFY_ACTOR_ID",
            "AWS_LAMBDA_FUNCTION_NAME",
            "GOOGLE_CLOUD_PROJECT",
            "AZURE_FUNCTIONS_WORKER_RUNTIME",
            "VERCEL",
            "NETLIFY",
            "HEROKU_APP_NAME"
    );

    private static final List<String> STAGE_VARIABLES = List.of("NODE_ENV", "APP_ENV");
    private static final String PRODUCTION = "production";

    private static final int CLOUD_RPC_ATTEMPTS = 3;
    private static final int LOCAL_RPC_ATTEMPTS = 5;
    private static final Duration CLOUD_BATCH_TIMEOUT = Duration.ofSeconds(5);
    private static final Duration LOCAL_BATCH_TIMEOUT = Duration.ofSeconds(20);

    private final boolean cloud;

    private CostEnvironment(boolean cloud) {
        this.cloud = cloud;
    }

    public static CostEnvironment cloud() {
        return new CostEnvironment(true);
    }

    public static CostEnvironment local() {
        return new CostEnvironment(false);
    }

    /**
     * @param override explicit setting, wins over detection when non-null
     * @param env process environment (normally {@link System#getenv()})
     */
    public static CostEnvironment detect(Boolean override, Map<String, String> env) {
        if (override != null) {
            return new CostEnvironment(override);
        }
        Objects.requireNonNull(env, "env");
        boolean markerPresent = CLOUD_MARKERS.stream().anyMatch(name -> hasText(env.get(name)));
        boolean production = STAGE_VARIABLES.stream().anyMatch(name -> PRODUCTION.equalsIgnoreCase(env.get(name)));
        return new CostEnvironment(markerPresent || production);
    }

    public boolean isCloud() {
        return cloud;
    }

    public int rpcMaxAttempts() {
        return cloud ? CLOUD_RPC_ATTEMPTS : LOCAL_RPC_ATTEMPTS;
    }

    public Duration batchTimeout() {
        return cloud ? CLOUD_BATCH_TIMEOUT : LOCAL_BATCH_TIMEOUT;
    }

    /**
     * Cheap offline extraction goes first when outbound calls cost money.
     */
    public boolean heuristicFirst() {
        return cloud;
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }

    @Override
    public String toString() {
        return cloud ? "cloud" : "local";
    }
}
