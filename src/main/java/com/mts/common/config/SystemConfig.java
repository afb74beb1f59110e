package com.mts.common.config;

public class SystemConfig {
    // ZooKeeper配置
    public static final String ZK_CONNECT_STRING = "localhost:2181";
    public static final int ZK_SESSION_TIMEOUT = 5000;
    public static final int ZK_RETRY_TIMES = 3;
    public static final int ZK_RETRY_INTERVAL = 1000;
    public static final String ZK_ROOT_PATH = "/mini-tablet-store";
    public static final String ZK_CATALOG_PATH = ZK_ROOT_PATH + "/catalog";

    // MySQL配置
    public static final String MYSQL_URL = "jdbc:mysql://localhost:3306/mini_tablet_store?createDatabaseIfNotExist=true&useSSL=false&allowPublicKeyRetrieval=true";
    public static final String MYSQL_USER = "root";
    public static final String MYSQL_PASSWORD = "123456";

    // 系统配置
    public static final int MASTER_PORT = 7051;             // 主节点默认端口
    public static final long HEARTBEAT_TIMEOUT = 10000;     // 心跳超时（毫秒）
    public static final long SWEEP_INTERVAL = 3000;         // 超时扫描间隔（毫秒）
    public static final int RPC_WORKERS = 16;               // 请求处理线程数
    public static final long RPC_DEFAULT_TIMEOUT = 10000;   // 请求默认超时（毫秒）
    public static final int CATALOG_MUTATION_THREADS = 4;   // 目录写操作线程数
    public static final long SHUTDOWN_TIMEOUT = 30000;      // 关闭时等待写操作完成的时间（毫秒）

    // 目录存储后端
    public static final String BACKEND_ZOOKEEPER = "zookeeper";
    public static final String BACKEND_MYSQL = "mysql";
    public static final String BACKEND_MEMORY = "memory";

    // 副本放置策略
    public static final String PLACEMENT_LEAST_LOADED = "least-loaded";
    public static final String PLACEMENT_ROUND_ROBIN = "round-robin";
}
