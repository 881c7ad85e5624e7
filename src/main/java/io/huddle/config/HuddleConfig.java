package io.huddle.config;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;

/**
 * Process-wide settings, resolved once at startup and passed to every component.
 *
 * <p>Environment lookups happen only in {@link #fromEnvironment}; nothing else in the
 * code base reads {@code System.getenv}.
 */
public final class HuddleConfig {
    public static final String ENV_HOME = "HUDDLE_HOME";
    public static final String ENV_DB_FILE = "HUDDLE_DB_FILE";
    public static final String ENV_INSTANCE_FILE = "HUDDLE_INSTANCE_FILE";
    public static final String ENV_FLAG_FILE = "HUDDLE_FLAG_FILE";
    public static final String ENV_ENABLED = "HUDDLE_ENABLED";

    public static final String BROADCAST_TARGET = "@all";
    public static final long ACTIVE_WINDOW_MS = 30L * 60L * 1_000L;
    public static final long STALE_AFTER_MS = 2L * 60L * 60L * 1_000L;
    public static final long MESSAGE_TTL_MS = 24L * 60L * 60L * 1_000L;
    public static final long SESSION_LOG_RETENTION_MS = 90L * 24L * 60L * 60L * 1_000L;
    public static final long STATUS_MESSAGE_WINDOW_MS = 24L * 60L * 60L * 1_000L;
    public static final long STATUS_ACTIVITY_WINDOW_MS = 7L * 24L * 60L * 60L * 1_000L;
    public static final int STATUS_MESSAGE_LIMIT = 20;
    public static final int STATUS_ACTIVITY_LIMIT = 10;
    public static final int INBOX_PAGE_SIZE = 50;
    public static final int DEFAULT_RECALL_LIMIT = 20;
    public static final int BUSY_TIMEOUT_MS = 5_000;

    private final Path rootDir;
    private final Path dbFile;
    private final Path identityFile;
    private final Path flagFile;
    private final boolean enabled;

    public HuddleConfig(Path rootDir, Path dbFile, Path identityFile, Path flagFile, boolean enabled) {
        this.rootDir = rootDir;
        this.dbFile = dbFile;
        this.identityFile = identityFile;
        this.flagFile = flagFile;
        this.enabled = enabled;
    }

    public static HuddleConfig fromRoot(String root) {
        return fromEnvironment(Map.of(), root, null, null);
    }

    /**
     * Resolves settings with precedence: explicit override, then environment, then defaults under the root.
     */
    public static HuddleConfig fromEnvironment(Map<String, String> env, String rootOverride, String dbOverride,
                                               String identityOverride) {
        Map<String, String> vars = env == null ? Map.of() : env;
        Path root = firstNonBlank(rootOverride, vars.get(ENV_HOME)) == null
                ? Paths.get(System.getProperty("user.home"), ".huddle")
                : Paths.get(firstNonBlank(rootOverride, vars.get(ENV_HOME)));
        root = root.toAbsolutePath().normalize();

        String db = firstNonBlank(dbOverride, vars.get(ENV_DB_FILE));
        String identity = firstNonBlank(identityOverride, vars.get(ENV_INSTANCE_FILE));
        String flag = vars.get(ENV_FLAG_FILE);

        Path dbFile = db == null ? root.resolve("huddle.db") : Paths.get(db).toAbsolutePath().normalize();
        Path identityFile = identity == null ? root.resolve("instance.json") : Paths.get(identity).toAbsolutePath().normalize();
        Path flagFile = flag == null || flag.isBlank() ? root.resolve("enabled") : Paths.get(flag).toAbsolutePath().normalize();

        boolean enabled = "1".equals(trimmed(vars.get(ENV_ENABLED))) || GateFlag.read(flagFile);
        return new HuddleConfig(root, dbFile, identityFile, flagFile, enabled);
    }

    public HuddleConfig withIdentityFile(Path file) {
        return new HuddleConfig(rootDir, dbFile, file, flagFile, enabled);
    }

    private static String firstNonBlank(String a, String b) {
        if (a != null && !a.isBlank()) {
            return a.trim();
        }
        if (b != null && !b.isBlank()) {
            return b.trim();
        }
        return null;
    }

    private static String trimmed(String raw) {
        return raw == null ? "" : raw.trim();
    }

    public Path rootDir() {
        return rootDir;
    }

    public Path dbFile() {
        return dbFile;
    }

    public Path identityFile() {
        return identityFile;
    }

    public Path flagFile() {
        return flagFile;
    }

    public boolean enabled() {
        return enabled;
    }

    public Path auditFile() {
        return rootDir.resolve("audit").resolve("audit.log");
    }
}
