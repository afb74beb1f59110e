package com.mts.master.catalog;

/**
 * 启动时目录恢复失败（持久化数据损坏或无法读取）。进程无法继续运行。
 */
public class CatalogRecoveryException extends RuntimeException {

    public CatalogRecoveryException(String message) {
        super(message);
    }

    public CatalogRecoveryException(String message, Throwable cause) {
        super(message, cause);
    }
}
