package com.mts.common.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

/**
 * Master 进程配置。
 * <p>
 * 取值优先级（从高到低）：
 * <ol>
 *   <li>{@link Builder} 中显式设置的值</li>
 *   <li>JVM 系统属性，例如 {@code -Dmts.master.port=7051}</li>
 *   <li>classpath 上的 {@code master.properties}</li>
 *   <li>{@link SystemConfig} 中的默认值</li>
 * </ol>
 */
public final class MasterOptions {
    private static final Logger logger = LoggerFactory.getLogger(MasterOptions.class);
    private static final String PROPERTIES_FILE = "master.properties";

    static final String PROP_MASTER_PORT = "mts.master.port";
    static final String PROP_HEARTBEAT_TIMEOUT = "mts.heartbeat.timeout-ms";
    static final String PROP_SWEEP_INTERVAL = "mts.sweep.interval-ms";
    static final String PROP_RPC_WORKERS = "mts.rpc.workers";
    static final String PROP_RPC_DEFAULT_TIMEOUT = "mts.rpc.default-timeout-ms";
    static final String PROP_CATALOG_BACKEND = "mts.catalog.backend";
    static final String PROP_MUTATION_THREADS = "mts.catalog.mutation-threads";
    static final String PROP_ZK_CONNECT = "mts.zk.connect";
    static final String PROP_ZK_SESSION_TIMEOUT = "mts.zk.session-timeout-ms";
    static final String PROP_ZK_CATALOG_PATH = "mts.zk.catalog-path";
    static final String PROP_MYSQL_URL = "mts.mysql.url";
    static final String PROP_MYSQL_USER = "mts.mysql.user";
    static final String PROP_MYSQL_PASSWORD = "mts.mysql.password";
    static final String PROP_PLACEMENT_POLICY = "mts.placement.policy";
    static final String PROP_SHUTDOWN_TIMEOUT = "mts.shutdown.timeout-ms";

    private final int masterPort;
    private final long heartbeatTimeoutMs;
    private final long sweepIntervalMs;
    private final int rpcWorkers;
    private final long rpcDefaultTimeoutMs;
    private final String catalogBackend;
    private final int mutationThreads;
    private final String zkConnectString;
    private final int zkSessionTimeoutMs;
    private final String zkCatalogPath;
    private final String mysqlUrl;
    private final String mysqlUser;
    private final String mysqlPassword;
    private final String placementPolicy;
    private final long shutdownTimeoutMs;

    private MasterOptions(Builder builder) {
        this.masterPort = builder.masterPort;
        this.heartbeatTimeoutMs = builder.heartbeatTimeoutMs;
        this.sweepIntervalMs = builder.sweepIntervalMs;
        this.rpcWorkers = builder.rpcWorkers;
        this.rpcDefaultTimeoutMs = builder.rpcDefaultTimeoutMs;
        this.catalogBackend = builder.catalogBackend;
        this.mutationThreads = builder.mutationThreads;
        this.zkConnectString = builder.zkConnectString;
        this.zkSessionTimeoutMs = builder.zkSessionTimeoutMs;
        this.zkCatalogPath = builder.zkCatalogPath;
        this.mysqlUrl = builder.mysqlUrl;
        this.mysqlUser = builder.mysqlUser;
        this.mysqlPassword = builder.mysqlPassword;
        this.placementPolicy = builder.placementPolicy;
        this.shutdownTimeoutMs = builder.shutdownTimeoutMs;
    }

    public static Builder builder() {
        return new Builder(loadPropertiesFile());
    }

    /** 只使用系统属性和默认值，忽略 classpath 上的配置文件。 */
    public static Builder builderWithoutFile() {
        return new Builder(new Properties());
    }

    public static MasterOptions load() {
        return builder().build();
    }

    public int getMasterPort() {
        return masterPort;
    }

    public long getHeartbeatTimeoutMs() {
        return heartbeatTimeoutMs;
    }

    public long getSweepIntervalMs() {
        return sweepIntervalMs;
    }

    public int getRpcWorkers() {
        return rpcWorkers;
    }

    public long getRpcDefaultTimeoutMs() {
        return rpcDefaultTimeoutMs;
    }

    public String getCatalogBackend() {
        return catalogBackend;
    }

    public int getMutationThreads() {
        return mutationThreads;
    }

    public String getZkConnectString() {
        return zkConnectString;
    }

    public int getZkSessionTimeoutMs() {
        return zkSessionTimeoutMs;
    }

    public String getZkCatalogPath() {
        return zkCatalogPath;
    }

    public String getMysqlUrl() {
        return mysqlUrl;
    }

    public String getMysqlUser() {
        return mysqlUser;
    }

    public String getMysqlPassword() {
        return mysqlPassword;
    }

    public String getPlacementPolicy() {
        return placementPolicy;
    }

    public long getShutdownTimeoutMs() {
        return shutdownTimeoutMs;
    }

    @Override
    public String toString() {
        return "MasterOptions{" +
                "masterPort=" + masterPort +
                ", heartbeatTimeoutMs=" + heartbeatTimeoutMs +
                ", sweepIntervalMs=" + sweepIntervalMs +
                ", rpcWorkers=" + rpcWorkers +
                ", rpcDefaultTimeoutMs=" + rpcDefaultTimeoutMs +
                ", catalogBackend='" + catalogBackend + '\'' +
                ", mutationThreads=" + mutationThreads +
                ", zkConnectString='" + zkConnectString + '\'' +
                ", zkCatalogPath='" + zkCatalogPath + '\'' +
                ", mysqlUrl='" + mysqlUrl + '\'' +
                ", placementPolicy='" + placementPolicy + '\'' +
                ", shutdownTimeoutMs=" + shutdownTimeoutMs +
                '}';
    }

    private static Properties loadPropertiesFile() {
        Properties props = new Properties();
        try (InputStream in = MasterOptions.class.getClassLoader().getResourceAsStream(PROPERTIES_FILE)) {
            if (in != null) {
                props.load(in);
                logger.debug("已加载配置文件: {}", PROPERTIES_FILE);
            }
        } catch (IOException e) {
            logger.warn("读取配置文件 {} 失败，使用默认配置: {}", PROPERTIES_FILE, e.getMessage());
        }
        return props;
    }

    public static final class Builder {
        private final Properties fileProperties;

        private int masterPort;
        private long heartbeatTimeoutMs;
        private long sweepIntervalMs;
        private int rpcWorkers;
        private long rpcDefaultTimeoutMs;
        private String catalogBackend;
        private int mutationThreads;
        private String zkConnectString;
        private int zkSessionTimeoutMs;
        private String zkCatalogPath;
        private String mysqlUrl;
        private String mysqlUser;
        private String mysqlPassword;
        private String placementPolicy;
        private long shutdownTimeoutMs;

        private Builder(Properties fileProperties) {
            this.fileProperties = fileProperties;
            this.masterPort = resolveInt(PROP_MASTER_PORT, SystemConfig.MASTER_PORT);
            this.heartbeatTimeoutMs = resolveLong(PROP_HEARTBEAT_TIMEOUT, SystemConfig.HEARTBEAT_TIMEOUT);
            this.sweepIntervalMs = resolveLong(PROP_SWEEP_INTERVAL, SystemConfig.SWEEP_INTERVAL);
            this.rpcWorkers = resolveInt(PROP_RPC_WORKERS, SystemConfig.RPC_WORKERS);
            this.rpcDefaultTimeoutMs = resolveLong(PROP_RPC_DEFAULT_TIMEOUT, SystemConfig.RPC_DEFAULT_TIMEOUT);
            this.catalogBackend = resolve(PROP_CATALOG_BACKEND, SystemConfig.BACKEND_ZOOKEEPER);
            this.mutationThreads = resolveInt(PROP_MUTATION_THREADS, SystemConfig.CATALOG_MUTATION_THREADS);
            this.zkConnectString = resolve(PROP_ZK_CONNECT, SystemConfig.ZK_CONNECT_STRING);
            this.zkSessionTimeoutMs = resolveInt(PROP_ZK_SESSION_TIMEOUT, SystemConfig.ZK_SESSION_TIMEOUT);
            this.zkCatalogPath = resolve(PROP_ZK_CATALOG_PATH, SystemConfig.ZK_CATALOG_PATH);
            this.mysqlUrl = resolve(PROP_MYSQL_URL, SystemConfig.MYSQL_URL);
            this.mysqlUser = resolve(PROP_MYSQL_USER, SystemConfig.MYSQL_USER);
            this.mysqlPassword = resolve(PROP_MYSQL_PASSWORD, SystemConfig.MYSQL_PASSWORD);
            this.placementPolicy = resolve(PROP_PLACEMENT_POLICY, SystemConfig.PLACEMENT_LEAST_LOADED);
            this.shutdownTimeoutMs = resolveLong(PROP_SHUTDOWN_TIMEOUT, SystemConfig.SHUTDOWN_TIMEOUT);
        }

        public Builder masterPort(int masterPort) {
            this.masterPort = masterPort;
            return this;
        }

        public Builder heartbeatTimeoutMs(long heartbeatTimeoutMs) {
            this.heartbeatTimeoutMs = heartbeatTimeoutMs;
            return this;
        }

        public Builder sweepIntervalMs(long sweepIntervalMs) {
            this.sweepIntervalMs = sweepIntervalMs;
            return this;
        }

        public Builder rpcWorkers(int rpcWorkers) {
            this.rpcWorkers = rpcWorkers;
            return this;
        }

        public Builder rpcDefaultTimeoutMs(long rpcDefaultTimeoutMs) {
            this.rpcDefaultTimeoutMs = rpcDefaultTimeoutMs;
            return this;
        }

        public Builder catalogBackend(String catalogBackend) {
            this.catalogBackend = catalogBackend;
            return this;
        }

        public Builder mutationThreads(int mutationThreads) {
            this.mutationThreads = mutationThreads;
            return this;
        }

        public Builder zkConnectString(String zkConnectString) {
            this.zkConnectString = zkConnectString;
            return this;
        }

        public Builder zkSessionTimeoutMs(int zkSessionTimeoutMs) {
            this.zkSessionTimeoutMs = zkSessionTimeoutMs;
            return this;
        }

        public Builder zkCatalogPath(String zkCatalogPath) {
            this.zkCatalogPath = zkCatalogPath;
            return this;
        }

        public Builder mysqlUrl(String mysqlUrl) {
            this.mysqlUrl = mysqlUrl;
            return this;
        }

        public Builder mysqlUser(String mysqlUser) {
            this.mysqlUser = mysqlUser;
            return this;
        }

        public Builder mysqlPassword(String mysqlPassword) {
            this.mysqlPassword = mysqlPassword;
            return this;
        }

        public Builder placementPolicy(String placementPolicy) {
            this.placementPolicy = placementPolicy;
            return this;
        }

        public Builder shutdownTimeoutMs(long shutdownTimeoutMs) {
            this.shutdownTimeoutMs = shutdownTimeoutMs;
            return this;
        }

        public MasterOptions build() {
            if (masterPort < 0 || masterPort > 65535) {
                throw new IllegalArgumentException("Invalid master port: " + masterPort);
            }
            if (heartbeatTimeoutMs <= 0 || sweepIntervalMs <= 0) {
                throw new IllegalArgumentException("Heartbeat timeout and sweep interval must be positive");
            }
            if (rpcWorkers <= 0 || mutationThreads <= 0) {
                throw new IllegalArgumentException("Thread pool sizes must be positive");
            }
            return new MasterOptions(this);
        }

        private String resolve(String key, String defaultValue) {
            String value = System.getProperty(key);
            if (value == null) {
                value = fileProperties.getProperty(key);
            }
            return value != null ? value.trim() : defaultValue;
        }

        private int resolveInt(String key, int defaultValue) {
            String value = resolve(key, null);
            if (value == null) {
                return defaultValue;
            }
            try {
                return Integer.parseInt(value);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid integer for " + key + ": " + value, e);
            }
        }

        private long resolveLong(String key, long defaultValue) {
            String value = resolve(key, null);
            if (value == null) {
                return defaultValue;
            }
            try {
                return Long.parseLong(value);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid long for " + key + ": " + value, e);
            }
        }
    }
}
