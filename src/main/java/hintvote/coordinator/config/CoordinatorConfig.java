package hintvote.coordinator.config;

/**
 * Configuration holder for coordinator settings.
 * All settings have sensible defaults.
 */
public final class CoordinatorConfig {

    // Server settings
    private int serverPort = 8080;
    private String serverHost = "0.0.0.0";

    // Scheduler settings
    private int schedulerThreads = 1;

    // Sessions owned by uids at or above this value count as app sessions
    private int appUidStart = 10_000;

    // Auth settings (optional)
    private String clientKey = null; // If set, POST requests must carry X-Hintvote-Key

    private ControlProfile controlProfile = ControlProfile.defaults();

    private CoordinatorConfig() {
    }

    public static CoordinatorConfig defaults() {
        return new CoordinatorConfig();
    }

    public static CoordinatorConfig fromEnv() {
        CoordinatorConfig config = new CoordinatorConfig();

        // Override from environment variables
        String port = System.getenv("HINTVOTE_PORT");
        if (port != null && !port.isBlank()) {
            config.serverPort = Integer.parseInt(port);
        }

        String host = System.getenv("HINTVOTE_HOST");
        if (host != null && !host.isBlank()) {
            config.serverHost = host;
        }

        String threads = System.getenv("HINTVOTE_SCHEDULER_THREADS");
        if (threads != null && !threads.isBlank()) {
            config.schedulerThreads = Integer.parseInt(threads);
        }

        String appUid = System.getenv("HINTVOTE_APP_UID_START");
        if (appUid != null && !appUid.isBlank()) {
            config.appUidStart = Integer.parseInt(appUid);
        }

        String clientKey = System.getenv("HINTVOTE_CLIENT_KEY");
        if (clientKey != null && !clientKey.isBlank()) {
            config.clientKey = clientKey;
        }

        ControlProfile.Builder profile = config.controlProfile.toBuilder();
        String pidOn = System.getenv("HINTVOTE_PID_ON");
        if (pidOn != null && !pidOn.isBlank()) {
            profile.pidOn(Boolean.parseBoolean(pidOn));
        }
        String heuristicBoost = System.getenv("HINTVOTE_HEURISTIC_BOOST_ON");
        if (heuristicBoost != null && !heuristicBoost.isBlank()) {
            profile.heuristicBoostOn(Boolean.parseBoolean(heuristicBoost));
        }
        config.controlProfile = profile.build();

        return config;
    }

    // Getters
    public int serverPort() {
        return serverPort;
    }

    public String serverHost() {
        return serverHost;
    }

    public int schedulerThreads() {
        return schedulerThreads;
    }

    public int appUidStart() {
        return appUidStart;
    }

    public String clientKey() {
        return clientKey;
    }

    public boolean hasClientKey() {
        return clientKey != null && !clientKey.isBlank();
    }

    public ControlProfile controlProfile() {
        return controlProfile;
    }

    // Fluent setters for testing/customization
    public CoordinatorConfig withServerPort(int port) {
        this.serverPort = port;
        return this;
    }

    public CoordinatorConfig withServerHost(String host) {
        this.serverHost = host;
        return this;
    }

    public CoordinatorConfig withSchedulerThreads(int threads) {
        this.schedulerThreads = threads;
        return this;
    }

    public CoordinatorConfig withAppUidStart(int uid) {
        this.appUidStart = uid;
        return this;
    }

    public CoordinatorConfig withClientKey(String key) {
        this.clientKey = key;
        return this;
    }

    public CoordinatorConfig withControlProfile(ControlProfile profile) {
        this.controlProfile = profile;
        return this;
    }

    @Override
    public String toString() {
        return "CoordinatorConfig{" +
                "serverHost='" + serverHost + '\'' +
                ", serverPort=" + serverPort +
                ", schedulerThreads=" + schedulerThreads +
                ", appUidStart=" + appUidStart +
                ", clientKeySet=" + hasClientKey() +
                ", " + controlProfile +
                '}';
    }
}
