package org.muma.mini.kv.store;

public interface StorageEngine {

    /**
     * 读取 key，不存在或已过期返回 null
     */
    String get(String key);

    // 写入，覆盖旧值并清除旧的过期时间
    void set(String key, String value);

    // 写入并在 ttlMillis 毫秒后过期
    void set(String key, String value, long ttlMillis);

    /**
     * 当前物理存储的 key 数量 (可能包含尚未被清理的过期 key)
     */
    int size();

    // 停止后台清理任务
    void shutdown();
}
