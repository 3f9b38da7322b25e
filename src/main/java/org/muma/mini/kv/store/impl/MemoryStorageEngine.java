package org.muma.mini.kv.store.impl;

import org.muma.mini.kv.store.Entry;
import org.muma.mini.kv.store.StorageEngine;
import org.muma.mini.kv.utils.ThreadUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * 进程内唯一的共享存储
 * 所有 map 读写都在同一把锁内完成，锁内不做任何 IO。
 * 过期策略: 读时惰性删除 + 单线程定期抽样清理。
 */
public class MemoryStorageEngine implements StorageEngine {

    private static final Logger log = LoggerFactory.getLogger(MemoryStorageEngine.class);

    public static final long DEFAULT_EXPIRE_CYCLE_MS = 100;

    // 每轮最多扫描的 key 数量 (防止长时间持锁)
    static final int ACTIVE_EXPIRE_SAMPLE_SIZE = 20;

    private final Object lock = new Object();

    // 1. 数据存储 (Key -> Entry)
    private final Map<String, Entry> memoryDb = new HashMap<>();

    // 2. 过期时间索引 (Key -> ExpireAt)，每个 key 最多一条，始终与 memoryDb 中的 Entry 一致。
    // 按插入顺序遍历，扫描过但未过期的 key 移到队尾，保证每个 key 轮流被抽到
    private final Map<String, Long> ttlMap = new LinkedHashMap<>();

    private final ScheduledExecutorService cleanupExecutor;

    public MemoryStorageEngine() {
        this(DEFAULT_EXPIRE_CYCLE_MS);
    }

    /**
     * @param expireCycleMs 定期清理间隔，<= 0 时不启动清理线程 (只依赖惰性删除)
     */
    public MemoryStorageEngine(long expireCycleMs) {
        if (expireCycleMs > 0) {
            this.cleanupExecutor = Executors.newSingleThreadScheduledExecutor(
                    ThreadUtils.namedThreadFactory("kv-active-expire"));
            cleanupExecutor.scheduleAtFixedRate(this::safeExpireCycle, expireCycleMs, expireCycleMs, TimeUnit.MILLISECONDS);
        } else {
            this.cleanupExecutor = null;
        }
    }

    @Override
    public String get(String key) {
        long now = System.currentTimeMillis();
        synchronized (lock) {
            Entry entry = memoryDb.get(key);
            if (entry == null) {
                return null;
            }
            // 惰性删除：清理线程还没跑到的过期 key 在这里拦住
            if (entry.isExpired(now)) {
                memoryDb.remove(key);
                ttlMap.remove(key);
                return null;
            }
            return entry.value();
        }
    }

    @Override
    public void set(String key, String value) {
        put(key, Entry.persistent(value));
    }

    @Override
    public void set(String key, String value, long ttlMillis) {
        if (ttlMillis <= 0) {
            throw new IllegalArgumentException("invalid expire time in set");
        }
        put(key, Entry.expiringAfter(value, ttlMillis, System.currentTimeMillis()));
    }

    private void put(String key, Entry entry) {
        synchronized (lock) {
            memoryDb.put(key, entry);
            // 覆盖写入时替换旧的过期时间；由有过期变为无过期时移除索引
            if (entry.hasExpire()) {
                ttlMap.put(key, entry.expireAt());
            } else {
                ttlMap.remove(key);
            }
        }
    }

    @Override
    public int size() {
        synchronized (lock) {
            return memoryDb.size();
        }
    }

    /**
     * 定期删除 (简化版 Redis activeExpireCycle)
     * 每轮从索引头部抽取最多 {@link #ACTIVE_EXPIRE_SAMPLE_SIZE} 个 key，删除已过期的，
     * 未过期的移到索引尾部，下一轮从别的 key 开始。
     *
     * @return 本轮删除的 key 数量
     */
    int activeExpireCycle() {
        long now = System.currentTimeMillis();
        int scanned = 0;
        int expired = 0;
        synchronized (lock) {
            List<Map.Entry<String, Long>> alive = new ArrayList<>();
            Iterator<Map.Entry<String, Long>> iterator = ttlMap.entrySet().iterator();
            while (iterator.hasNext() && scanned < ACTIVE_EXPIRE_SAMPLE_SIZE) {
                Map.Entry<String, Long> ttl = iterator.next();
                scanned++;
                if (now > ttl.getValue()) {
                    memoryDb.remove(ttl.getKey());
                    expired++;
                } else {
                    alive.add(Map.entry(ttl.getKey(), ttl.getValue()));
                }
                iterator.remove();
            }
            for (Map.Entry<String, Long> ttl : alive) {
                ttlMap.put(ttl.getKey(), ttl.getValue());
            }
        }

        if (expired > 0) {
            log.debug("Active cleanup: scanned {}, expired {}", scanned, expired);
        }
        return expired;
    }

    private void safeExpireCycle() {
        try {
            activeExpireCycle();
        } catch (RuntimeException e) {
            // 抛出异常会让 ScheduledExecutor 停掉后续调度
            log.error("Active expire cycle failed", e);
        }
    }

    // 测试用
    int pendingExpireSlots() {
        synchronized (lock) {
            return ttlMap.size();
        }
    }

    @Override
    public void shutdown() {
        if (cleanupExecutor != null) {
            cleanupExecutor.shutdownNow();
            log.info("Active expire cleanup stopped. Keys in memory: {}", size());
        }
    }
}
