package com.mts.common.util;

import com.mts.common.config.SystemConfig;
import org.apache.curator.framework.CuratorFramework;
import org.apache.curator.framework.CuratorFrameworkFactory;
import org.apache.curator.retry.ExponentialBackoffRetry;
import org.apache.zookeeper.KeeperException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.TimeUnit;

public class ZookeeperUtil {
    private static final Logger logger = LoggerFactory.getLogger(ZookeeperUtil.class);

    private ZookeeperUtil() {
    }

    /**
     * 创建并启动 Curator 客户端，阻塞直到连接建立。
     */
    public static CuratorFramework connect(String connectString, int sessionTimeoutMs) throws InterruptedException {
        CuratorFramework client = CuratorFrameworkFactory.builder()
                .connectString(connectString)
                .sessionTimeoutMs(sessionTimeoutMs)
                .retryPolicy(new ExponentialBackoffRetry(SystemConfig.ZK_RETRY_INTERVAL, SystemConfig.ZK_RETRY_TIMES))
                .build();
        client.start();
        logger.info("ZooKeeper 客户端已启动: {}", connectString);

        // 等待连接建立
        if (!client.blockUntilConnected(sessionTimeoutMs, TimeUnit.MILLISECONDS)) {
            client.close();
            throw new IllegalStateException("连接 ZooKeeper 超时: " + connectString);
        }
        return client;
    }

    /**
     * 确保持久节点存在（包括父节点）。
     */
    public static void ensurePath(CuratorFramework client, String path) throws Exception {
        if (client.checkExists().forPath(path) != null) {
            return;
        }
        try {
            client.create().creatingParentsIfNeeded().forPath(path);
        } catch (KeeperException.NodeExistsException e) {
            logger.debug("节点已存在: {}", path);
        }
    }
}
