package org.talentia.engine.config;

import io.github.cdimascio.dotenv.Dotenv;

import java.util.Locale;
import java.util.Objects;
import java.util.function.Function;
import java.util.logging.Logger;

/**
 * Immutable configuration for the allocation engine.
 * Values come from environment variables, then a {@code .env} file in the
 * working directory or its parent, then defaults.
 */
public final class EngineConfig {

    private static final Logger LOG = Logger.getLogger(EngineConfig.class.getName());

    public static final int DEFAULT_HTTP_PORT = 8090;
    public static final int DEFAULT_HTTP_THREADS = 8;
    public static final String DEFAULT_DB_URL = "jdbc:h2:file:./data/allocation;LOCK_TIMEOUT=10000";
    public static final String DEFAULT_DB_USER = "sa";
    public static final int DEFAULT_RECRUITER_CAPACITY = 13;
    public static final int DEFAULT_SUGGESTION_COUNT = 3;
    public static final String DEFAULT_LOCALE = "es";
    public static final String DEFAULT_LOG_FILE = "logs/engine/engine.log";

    // HTTP server
    private final int httpPort;
    private final int httpThreads;

    // Database
    private final String dbUrl;
    private final String dbUser;
    private final String dbPassword;
    private final boolean initSchema;

    // Allocation
    private final int defaultRecruiterCapacity;
    private final int suggestionCount;
    private final Locale locale;

    // Logging
    private final String logFilePath;
    private final boolean fileLoggingEnabled;

    private EngineConfig(Builder builder) {
        this.httpPort = builder.httpPort;
        this.httpThreads = builder.httpThreads;
        this.dbUrl = builder.dbUrl;
        this.dbUser = builder.dbUser;
        this.dbPassword = builder.dbPassword;
        this.initSchema = builder.initSchema;
        this.defaultRecruiterCapacity = builder.defaultRecruiterCapacity;
        this.suggestionCount = builder.suggestionCount;
        this.locale = builder.locale;
        this.logFilePath = builder.logFilePath;
        this.fileLoggingEnabled = builder.fileLoggingEnabled;
    }

    /**
     * Creates configuration from environment variables with {@code .env} fallback.
     */
    public static EngineConfig fromEnvironment() {
        Dotenv local = Dotenv.configure().ignoreIfMissing().load();
        Dotenv parent = Dotenv.configure().directory("../").ignoreIfMissing().load();
        return fromSource(key -> firstNonBlank(System.getenv(key), local.get(key), parent.get(key)));
    }

    /**
     * Creates configuration from an arbitrary key lookup.
     */
    static EngineConfig fromSource(Function<String, String> source) {
        return new Builder()
                .httpPort(getInt(source, "ENGINE_HTTP_PORT", DEFAULT_HTTP_PORT))
                .httpThreads(getInt(source, "ENGINE_HTTP_THREADS", DEFAULT_HTTP_THREADS))
                .dbUrl(get(source, "DB_URL", DEFAULT_DB_URL))
                .dbUser(get(source, "DB_USER", DEFAULT_DB_USER))
                .dbPassword(get(source, "DB_PASSWORD", ""))
                .initSchema(getBoolean(source, "DB_INIT_SCHEMA", true))
                .defaultRecruiterCapacity(getInt(source, "RECRUITER_DEFAULT_CAPACITY", DEFAULT_RECRUITER_CAPACITY))
                .suggestionCount(getInt(source, "SUGGESTION_COUNT", DEFAULT_SUGGESTION_COUNT))
                .locale(Locale.forLanguageTag(get(source, "ENGINE_LOCALE", DEFAULT_LOCALE)))
                .logFilePath(get(source, "ENGINE_LOG_FILE", DEFAULT_LOG_FILE))
                .fileLoggingEnabled(getBoolean(source, "ENGINE_FILE_LOGGING_ENABLED", false))
                .build();
    }

    public int getHttpPort() {
        return httpPort;
    }

    public int getHttpThreads() {
        return httpThreads;
    }

    public String getDbUrl() {
        return dbUrl;
    }

    public String getDbUser() {
        return dbUser;
    }

    public String getDbPassword() {
        return dbPassword;
    }

    public boolean isInitSchema() {
        return initSchema;
    }

    public int getDefaultRecruiterCapacity() {
        return defaultRecruiterCapacity;
    }

    public int getSuggestionCount() {
        return suggestionCount;
    }

    public Locale getLocale() {
        return locale;
    }

    public String getLogFilePath() {
        return logFilePath;
    }

    public boolean isFileLoggingEnabled() {
        return fileLoggingEnabled;
    }

    private static String firstNonBlank(String... values) {
        for (String value : values) {
            if (value != null && !value.trim().isEmpty()) {
                return value.trim();
            }
        }
        return null;
    }

    private static String get(Function<String, String> source, String key, String defaultValue) {
        String value = source.apply(key);
        if (value == null || value.trim().isEmpty()) {
            LOG.fine(() -> String.format("Using default for %s: %s", key, defaultValue));
            return defaultValue;
        }
        return value.trim();
    }

    private static int getInt(Function<String, String> source, String key, int defaultValue) {
        String value = source.apply(key);
        if (value == null || value.trim().isEmpty()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            LOG.warning(() -> String.format("Invalid integer for %s: %s, using default: %d", key, value, defaultValue));
            return defaultValue;
        }
    }

    private static boolean getBoolean(Function<String, String> source, String key, boolean defaultValue) {
        String value = source.apply(key);
        if (value == null || value.trim().isEmpty()) {
            return defaultValue;
        }
        return "true".equalsIgnoreCase(value.trim()) || "1".equals(value.trim());
    }

    // Password omitted
    @Override
    public String toString() {
        return "EngineConfig{" +
                "httpPort=" + httpPort +
                ", httpThreads=" + httpThreads +
                ", dbUrl='" + dbUrl + '\'' +
                ", dbUser='" + dbUser + '\'' +
                ", initSchema=" + initSchema +
                ", defaultRecruiterCapacity=" + defaultRecruiterCapacity +
                ", suggestionCount=" + suggestionCount +
                ", locale=" + locale.toLanguageTag() +
                ", fileLoggingEnabled=" + fileLoggingEnabled +
                '}';
    }

    /**
     * Builder for EngineConfig.
     */
    public static final class Builder {
        private int httpPort = DEFAULT_HTTP_PORT;
        private int httpThreads = DEFAULT_HTTP_THREADS;
        private String dbUrl = DEFAULT_DB_URL;
        private String dbUser = DEFAULT_DB_USER;
        private String dbPassword = "";
        private boolean initSchema = true;
        private int defaultRecruiterCapacity = DEFAULT_RECRUITER_CAPACITY;
        private int suggestionCount = DEFAULT_SUGGESTION_COUNT;
        private Locale locale = Locale.forLanguageTag(DEFAULT_LOCALE);
        private String logFilePath = DEFAULT_LOG_FILE;
        private boolean fileLoggingEnabled;

        public Builder httpPort(int httpPort) {
            if (httpPort < 0 || httpPort > 65535) {
                throw new IllegalArgumentException("httpPort must be between 0 and 65535");
            }
            this.httpPort = httpPort;
            return this;
        }

        public Builder httpThreads(int httpThreads) {
            if (httpThreads < 1) {
                throw new IllegalArgumentException("httpThreads must be at least 1");
            }
            this.httpThreads = httpThreads;
            return this;
        }

        public Builder dbUrl(String dbUrl) {
            this.dbUrl = Objects.requireNonNull(dbUrl, "dbUrl must not be null");
            return this;
        }

        public Builder dbUser(String dbUser) {
            this.dbUser = Objects.requireNonNull(dbUser, "dbUser must not be null");
            return this;
        }

        public Builder dbPassword(String dbPassword) {
            this.dbPassword = dbPassword != null ? dbPassword : "";
            return this;
        }

        public Builder initSchema(boolean initSchema) {
            this.initSchema = initSchema;
            return this;
        }

        public Builder defaultRecruiterCapacity(int defaultRecruiterCapacity) {
            if (defaultRecruiterCapacity < 1) {
                throw new IllegalArgumentException("defaultRecruiterCapacity must be at least 1");
            }
            this.defaultRecruiterCapacity = defaultRecruiterCapacity;
            return this;
        }

        public Builder suggestionCount(int suggestionCount) {
            if (suggestionCount < 1) {
                throw new IllegalArgumentException("suggestionCount must be at least 1");
            }
            this.suggestionCount = suggestionCount;
            return this;
        }

        public Builder locale(Locale locale) {
            this.locale = Objects.requireNonNull(locale, "locale must not be null");
            return this;
        }

        public Builder logFilePath(String logFilePath) {
            this.logFilePath = Objects.requireNonNull(logFilePath, "logFilePath must not be null");
            return this;
        }

        public Builder fileLoggingEnabled(boolean fileLoggingEnabled) {
            this.fileLoggingEnabled = fileLoggingEnabled;
            return this;
        }

        public EngineConfig build() {
            return new EngineConfig(this);
        }
    }
}
