package org.muma.mini.kv.store;

/**
 * 一个 key 对应的存储值
 *
 * @param value    字符串值
 * @param expireAt 过期时间戳 (毫秒)，-1 表示不过期
 */
public record Entry(String value, long expireAt) {

    public static final long NO_EXPIRE = -1;

    public static Entry persistent(String value) {
        return new Entry(value, NO_EXPIRE);
    }

    public static Entry expiringAfter(String value, long ttlMillis, long now) {
        return new Entry(value, now + ttlMillis);
    }

    public boolean hasExpire() {
        return expireAt != NO_EXPIRE;
    }

    public boolean isExpired(long now) {
        return hasExpire() && now > expireAt;
    }
}
