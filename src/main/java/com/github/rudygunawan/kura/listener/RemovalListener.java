package com.github.rudygunawan.kura.listener;

import com.github.rudygunawan.kura.policy.RemovalCause;

/**
 * A listener that receives notification when an entry is removed from a cache.
 *
 * <p>The cache always invokes the listener after releasing its internal lock, so a listener may
 * safely call back into the same cache (for example to re-insert a downgraded value).
 *
 * <pre>{@code
 * Cache<String, BufferedImage> images = CacheBuilder.newBuilder()
 *     .removalListener((String url, BufferedImage image, RemovalCause cause) -> image.flush())
 *     .build();
 * }</pre>
 *
 * @param <K> the type of keys
 * @param <V> the type of values
 */
@FunctionalInterface
public interface RemovalListener<K, V> {

    /**
     * Notifies the listener that a removal occurred.
     *
     * <p>Exceptions thrown by the listener are logged and otherwise ignored.
     *
     * @param key the key of the removed entry
     * @param value the value of the removed entry
     * @param cause the reason for the removal
     */
    void onRemoval(K key, V value, RemovalCause cause);
}
