package com.mts.master;

import com.mts.common.config.MasterOptions;
import com.mts.common.config.SystemConfig;
import com.mts.common.util.ZookeeperUtil;
import com.mts.master.catalog.CatalogRecoveryException;
import com.mts.master.persist.CatalogPersistence;
import com.mts.master.persist.InMemoryCatalogPersistence;
import com.mts.master.persist.JdbcCatalogPersistence;
import com.mts.master.persist.PersistenceException;
import com.mts.master.persist.ZkCatalogPersistence;
import org.apache.curator.framework.CuratorFramework;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class MasterMain {
    private static final Logger logger = LoggerFactory.getLogger(MasterMain.class);

    public static void main(String[] args) {
        MasterOptions options = MasterOptions.load();
        logger.info("正在启动 Master 节点: {}", options);

        CuratorFramework zkClient = null;
        CatalogPersistence persistence = null;
        Coordinator coordinator = null;
        MasterServer server = null;

        try {
            String backend = options.getCatalogBackend();
            if (SystemConfig.BACKEND_ZOOKEEPER.equalsIgnoreCase(backend)) {
                zkClient = ZookeeperUtil.connect(options.getZkConnectString(), options.getZkSessionTimeoutMs());
                persistence = new ZkCatalogPersistence(zkClient, options.getZkCatalogPath());
            } else if (SystemConfig.BACKEND_MYSQL.equalsIgnoreCase(backend)) {
                JdbcCatalogPersistence jdbc = new JdbcCatalogPersistence(
                        options.getMysqlUrl(), options.getMysqlUser(), options.getMysqlPassword());
                jdbc.init();
                persistence = jdbc;
            } else {
                logger.warn("使用内存目录存储, 进程退出后目录数据丢失");
                persistence = new InMemoryCatalogPersistence();
            }
            logger.info("目录存储后端: {}", backend);

            coordinator = new Coordinator(options, persistence);
            coordinator.init();
            coordinator.start();

            server = new MasterServer(options.getMasterPort(), options.getRpcWorkers(), new AdminFacade(coordinator));
            server.start();
        } catch (CatalogRecoveryException e) {
            logger.error("目录恢复失败, 数据可能已损坏, Master 无法启动: {}", e.getMessage(), e);
            release(null, coordinator, persistence, zkClient);
            System.exit(1);
        } catch (PersistenceException e) {
            logger.error("初始化目录存储失败: {}", e.getMessage(), e);
            release(server, coordinator, persistence, zkClient);
            System.exit(1);
        } catch (Exception e) {
            logger.error("Master 节点启动异常: {}", e.getMessage(), e);
            release(server, coordinator, persistence, zkClient);
            System.exit(1);
        }

        // 添加关闭钩子
        final MasterServer finalServer = server;
        final Coordinator finalCoordinator = coordinator;
        final CatalogPersistence finalPersistence = persistence;
        final CuratorFramework finalZkClient = zkClient;
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            logger.info("正在关闭 Master 节点...");
            release(finalServer, finalCoordinator, finalPersistence, finalZkClient);
            logger.info("Master 节点已安全关闭");
        }, "master-shutdown"));

        logger.info("Master 节点已就绪: {}", coordinator.status());
        try {
            // 保持程序运行
            Thread.currentThread().join();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static void release(MasterServer server, Coordinator coordinator, CatalogPersistence persistence,
            CuratorFramework zkClient) {
        if (server != null) {
            server.stop();
        }
        if (coordinator != null) {
            coordinator.shutdown();
        }
        if (persistence != null) {
            try {
                persistence.close();
            } catch (Exception e) {
                logger.error("关闭目录存储失败: {}", e.getMessage(), e);
            }
        }
        if (zkClient != null) {
            zkClient.close();
        }
    }
}
