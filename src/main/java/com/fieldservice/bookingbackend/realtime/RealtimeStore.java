package com.fieldservice.bookingbackend.realtime;

import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Hierarchical key/value tree mirrored to live clients.
 * Paths are slash-separated, e.g. {@code locations/p1/current}.
 */
public interface RealtimeStore {

    void write(String path, Object value);

    /**
     * Value stored at {@code path}. When only descendants exist the result is a map of child name to subtree.
     */
    Optional<Object> read(String path);

    /**
     * Removes the node and everything beneath it.
     */
    void remove(String path);

    /**
     * Writes all entries together, keyed by absolute path.
     */
    void batchWrite(Map<String, Object> values);

    boolean exists(String path);

    Set<String> children(String path);
}
