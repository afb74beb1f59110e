package com.mts.master.persist;

import com.mts.common.util.ZookeeperUtil;
import org.apache.curator.framework.CuratorFramework;
import org.apache.curator.framework.api.transaction.CuratorOp;
import org.apache.zookeeper.KeeperException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * ZooKeeper 实现：每条记录对应 {@code basePath/<key>} 下的一个持久节点，
 * 一次提交使用一个 multi-op 事务。
 */
public class ZkCatalogPersistence implements CatalogPersistence {
    private static final Logger logger = LoggerFactory.getLogger(ZkCatalogPersistence.class);

    private final CuratorFramework client;
    private final String basePath;

    public ZkCatalogPersistence(CuratorFramework client, String basePath) throws PersistenceException {
        this.client = client;
        this.basePath = basePath.endsWith("/") ? basePath.substring(0, basePath.length() - 1) : basePath;
        try {
            // 确保基础路径存在
            ZookeeperUtil.ensurePath(client, this.basePath);
        } catch (Exception e) {
            throw new PersistenceException("初始化ZK目录路径失败: " + this.basePath, e);
        }
    }

    @Override
    public void atomicCommit(Map<String, byte[]> writes) throws PersistenceException {
        if (writes.isEmpty()) {
            return;
        }
        try {
            List<CuratorOp> ops = new ArrayList<>();
            for (Map.Entry<String, byte[]> entry : writes.entrySet()) {
                String path = toPath(entry.getKey());
                // 目录节点在事务外创建，空目录节点不影响读
                ZookeeperUtil.ensurePath(client, parentOf(path));
                if (client.checkExists().forPath(path) == null) {
                    ops.add(client.transactionOp().create().forPath(path, entry.getValue()));
                } else {
                    ops.add(client.transactionOp().setData().forPath(path, entry.getValue()));
                }
            }
            client.transaction().forOperations(ops);
            logger.debug("ZK 事务提交成功，写入 {} 条记录", ops.size());
        } catch (Exception e) {
            throw new PersistenceException("ZK 事务提交失败: " + e.getMessage(), e);
        }
    }

    @Override
    public List<Map.Entry<String, byte[]>> scanPrefix(String prefix) throws PersistenceException {
        int slash = prefix.lastIndexOf('/');
        String dirKey = slash >= 0 ? prefix.substring(0, slash) : "";
        String namePrefix = prefix.substring(slash + 1);
        String dirPath = dirKey.isEmpty() ? basePath : basePath + "/" + dirKey;

        try {
            List<String> children;
            try {
                children = new ArrayList<>(client.getChildren().forPath(dirPath));
            } catch (KeeperException.NoNodeException e) {
                return Collections.emptyList();
            }
            Collections.sort(children);

            List<Map.Entry<String, byte[]>> result = new ArrayList<>();
            for (String child : children) {
                if (!child.startsWith(namePrefix)) {
                    continue;
                }
                byte[] data = client.getData().forPath(dirPath + "/" + child);
                String key = dirKey.isEmpty() ? child : dirKey + "/" + child;
                result.add(Map.entry(key, data == null ? new byte[0] : data));
            }
            return result;
        } catch (Exception e) {
            throw new PersistenceException("ZK 扫描失败: " + dirPath, e);
        }
    }

    private String toPath(String key) throws PersistenceException {
        if (key == null || key.isEmpty() || key.startsWith("/") || key.endsWith("/")) {
            throw new PersistenceException("Invalid catalog key: " + key);
        }
        return basePath + "/" + key;
    }

    private static String parentOf(String path) {
        return path.substring(0, path.lastIndexOf('/'));
    }
}
