package org.muma.mini.kv.utils;

import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 线程工厂
 */
public final class ThreadUtils {

    private ThreadUtils() {
    }

    public static ThreadFactory namedThreadFactory(String prefix) {
        return new KvThreadFactory(prefix);
    }

    private static class KvThreadFactory implements ThreadFactory {
        private final String prefix;
        private final AtomicInteger counter = new AtomicInteger(1);

        KvThreadFactory(String prefix) {
            this.prefix = prefix;
        }

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, prefix + "-" + counter.getAndIncrement());
            t.setDaemon(true); // 后台线程，不阻止 JVM 退出
            return t;
        }
    }
}
