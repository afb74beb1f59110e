package com.mts.master.persist;

import com.mts.common.util.MySQLUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * MySQL 实现：所有记录存放在一张 key-value 表中，一次提交对应一个 JDBC 事务。
 */
public class JdbcCatalogPersistence implements CatalogPersistence {
    private static final Logger logger = LoggerFactory.getLogger(JdbcCatalogPersistence.class);

    static final String CREATE_TABLE_SQL = """
            CREATE TABLE IF NOT EXISTS catalog_entries (
                entry_key VARCHAR(255) NOT NULL,
                entry_value LONGBLOB NOT NULL,
                PRIMARY KEY (entry_key)
            )
            """;
    static final String UPSERT_SQL = "INSERT INTO catalog_entries (entry_key, entry_value) VALUES (?, ?) "
            + "ON DUPLICATE KEY UPDATE entry_value = VALUES(entry_value)";
    static final String SCAN_SQL = "SELECT entry_key, entry_value FROM catalog_entries "
            + "WHERE entry_key LIKE ? ORDER BY entry_key";

    /** 获取数据库连接，便于测试时替换。 */
    @FunctionalInterface
    public interface ConnectionFactory {
        Connection open() throws SQLException;
    }

    private final ConnectionFactory connectionFactory;

    public JdbcCatalogPersistence(String url, String user, String password) {
        this(() -> MySQLUtil.getConnection(url, user, password));
    }

    public JdbcCatalogPersistence(ConnectionFactory connectionFactory) {
        this.connectionFactory = connectionFactory;
    }

    // 建表 catalog_entries
    public void init() throws PersistenceException {
        try (Connection conn = connectionFactory.open();
             Statement stmt = conn.createStatement()) {
            stmt.execute(CREATE_TABLE_SQL);
            logger.info("表 catalog_entries 初始化完成");
        } catch (SQLException e) {
            throw new PersistenceException("初始化表 catalog_entries 失败: " + e.getMessage(), e);
        }
    }

    @Override
    public void atomicCommit(Map<String, byte[]> writes) throws PersistenceException {
        if (writes.isEmpty()) {
            return;
        }
        Connection conn = null;
        try {
            conn = connectionFactory.open();
            conn.setAutoCommit(false);
            try (PreparedStatement pstmt = conn.prepareStatement(UPSERT_SQL)) {
                for (Map.Entry<String, byte[]> entry : writes.entrySet()) {
                    pstmt.setString(1, entry.getKey());
                    pstmt.setBytes(2, entry.getValue());
                    pstmt.addBatch();
                }
                pstmt.executeBatch();
            }
            conn.commit();
            logger.debug("MySQL 事务提交成功，写入 {} 条记录", writes.size());
        } catch (SQLException e) {
            MySQLUtil.rollbackQuietly(conn);
            throw new PersistenceException("MySQL 事务提交失败: " + e.getMessage(), e);
        } finally {
            closeQuietly(conn);
        }
    }

    @Override
    public List<Map.Entry<String, byte[]>> scanPrefix(String prefix) throws PersistenceException {
        List<Map.Entry<String, byte[]>> result = new ArrayList<>();
        try (Connection conn = connectionFactory.open();
             PreparedStatement pstmt = conn.prepareStatement(SCAN_SQL)) {
            pstmt.setString(1, MySQLUtil.escapeLike(prefix) + "%");
            try (ResultSet rs = pstmt.executeQuery()) {
                while (rs.next()) {
                    result.add(Map.entry(rs.getString(1), rs.getBytes(2)));
                }
            }
            return result;
        } catch (SQLException e) {
            throw new PersistenceException("MySQL 扫描失败: " + prefix, e);
        }
    }

    private static void closeQuietly(Connection conn) {
        if (conn == null) {
            return;
        }
        try {
            conn.close();
        } catch (SQLException e) {
            logger.error("关闭MySQL数据库连接失败: {}", e.getMessage(), e);
        }
    }
}
