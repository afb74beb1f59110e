package com.mts.common.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;

public class MySQLUtil {
    private static final Logger logger = LoggerFactory.getLogger(MySQLUtil.class);
    private static final String DRIVER = "com.mysql.cj.jdbc.Driver";

    static {
        try {
            logger.debug("正在加载MySQL驱动: {}", DRIVER);
            Class.forName(DRIVER);
        } catch (ClassNotFoundException e) {
            logger.error("MySQL驱动加载失败: {}", e.getMessage(), e);
        }
    }

    private MySQLUtil() {
    }

    public static Connection getConnection(String url, String user, String password) throws SQLException {
        logger.debug("正在连接MySQL数据库: {}", url);
        try {
            return DriverManager.getConnection(url, user, password);
        } catch (SQLException e) {
            logger.error("MySQL数据库连接失败: {}", e.getMessage(), e);
            throw e;
        }
    }

    // 回滚失败只记录日志，原始异常由调用方抛出
    public static void rollbackQuietly(Connection conn) {
        if (conn == null) {
            return;
        }
        try {
            conn.rollback();
        } catch (SQLException e) {
            logger.error("事务回滚失败: {}", e.getMessage(), e);
        }
    }

    /** 转义 LIKE 模式中的通配符。 */
    public static String escapeLike(String value) {
        return value.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_");
    }
}
