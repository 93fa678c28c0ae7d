package com.example.polystoresync.kv;

import java.time.Duration;
import java.util.List;

/**
 * Minimal key-value operations the cache store needs.
 */
public interface KvClient {
    void set(String key, String value, Duration ttl);
    /**
     * @return whether a key was actually removed
     */
    boolean del(String key);
    boolean exists(String key);
    List<String> scan(String prefix, int limit);
    boolean ping();
}
