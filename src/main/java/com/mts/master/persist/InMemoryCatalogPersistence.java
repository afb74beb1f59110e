package com.mts.master.persist;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * 内存实现，用于测试和本地运行；进程退出后数据丢失。
 */
public class InMemoryCatalogPersistence implements CatalogPersistence {
    private final TreeMap<String, byte[]> records = new TreeMap<>();

    @Override
    public synchronized void atomicCommit(Map<String, byte[]> writes) throws PersistenceException {
        for (String key : writes.keySet()) {
            if (key == null || key.isEmpty()) {
                throw new PersistenceException("Empty key in commit");
            }
        }
        writes.forEach((key, value) -> records.put(key, value.clone()));
    }

    @Override
    public synchronized List<Map.Entry<String, byte[]>> scanPrefix(String prefix) {
        List<Map.Entry<String, byte[]>> result = new ArrayList<>();
        for (Map.Entry<String, byte[]> entry : records.tailMap(prefix, true).entrySet()) {
            if (!entry.getKey().startsWith(prefix)) {
                break;
            }
            result.add(Map.entry(entry.getKey(), entry.getValue().clone()));
        }
        return result;
    }

    public synchronized int size() {
        return records.size();
    }
}
