package com.mts.master.persist;

import java.util.List;
import java.util.Map;

/**
 * 目录记录的持久化存储，key 形如 {@code tables/<id>}。
 */
public interface CatalogPersistence extends AutoCloseable {

    /**
     * 原子提交：要么全部写入，要么失败且什么都不写。空 map 不做任何事。
     */
    void atomicCommit(Map<String, byte[]> writes) throws PersistenceException;

    /** 按 key 排序返回前缀下的全部记录。 */
    List<Map.Entry<String, byte[]>> scanPrefix(String prefix) throws PersistenceException;

    @Override
    default void close() throws Exception {
    }
}
