package com.fieldservice.bookingbackend.realtime;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * {@link RealtimeStore} on Redis. Each node's value lives at {@code rt:{path}};
 * the names of a node's children are kept in the set {@code rt-children:{path}}.
 */
@Slf4j
@Component
public class RedisRealtimeStore implements RealtimeStore {

    static final String VALUE_PREFIX = "rt:";
    static final String CHILDREN_PREFIX = "rt-children:";

    private final RedisTemplate<String, Object> redisTemplate;

    @Autowired
    public RedisRealtimeStore(RedisTemplate<String, Object> redisTemplate) {
        this.redisTemplate = redisTemplate;
    }

    @Override
    public void write(String path, Object value) {
        redisTemplate.opsForValue().set(VALUE_PREFIX + path, value);
        registerAncestors(path);
    }

    @Override
    public Optional<Object> read(String path) {
        Object value = redisTemplate.opsForValue().get(VALUE_PREFIX + path);
        if (value != null) {
            return Optional.of(value);
        }

        Set<String> children = children(path);
        if (children.isEmpty()) {
            return Optional.empty();
        }

        Map<String, Object> subtree = new LinkedHashMap<>();
        for (String child : children) {
            read(path + "/" + child).ifPresent(v -> subtree.put(child, v));
        }
        return subtree.isEmpty() ? Optional.empty() : Optional.of(subtree);
    }

    @Override
    public void remove(String path) {
        for (String child : children(path)) {
            remove(path + "/" + child);
        }
        redisTemplate.delete(VALUE_PREFIX + path);
        redisTemplate.delete(CHILDREN_PREFIX + path);

        String parent = RealtimePaths.parent(path);
        if (parent != null) {
            redisTemplate.opsForSet().remove(CHILDREN_PREFIX + parent, RealtimePaths.lastSegment(path));
        }
    }

    @Override
    public void batchWrite(Map<String, Object> values) {
        if (values.isEmpty()) {
            return;
        }
        Map<String, Object> keyed = new HashMap<>();
        values.forEach((path, value) -> keyed.put(VALUE_PREFIX + path, value));
        redisTemplate.opsForValue().multiSet(keyed);

        values.keySet().forEach(this::registerAncestors);
        log.debug("Batch wrote {} realtime nodes", values.size());
    }

    @Override
    public boolean exists(String path) {
        return Boolean.TRUE.equals(redisTemplate.hasKey(VALUE_PREFIX + path))
                || Boolean.TRUE.equals(redisTemplate.hasKey(CHILDREN_PREFIX + path));
    }

    @Override
    public Set<String> children(String path) {
        Set<Object> members = redisTemplate.opsForSet().members(CHILDREN_PREFIX + path);
        if (members == null || members.isEmpty()) {
            return Collections.emptySet();
        }
        Set<String> names = new TreeSet<>();
        members.forEach(m -> names.add(String.valueOf(m)));
        return names;
    }

    private void registerAncestors(String path) {
        String child = path;
        String parent = RealtimePaths.parent(child);
        while (parent != null) {
            redisTemplate.opsForSet().add(CHILDREN_PREFIX + parent, RealtimePaths.lastSegment(child));
            child = parent;
            parent = RealtimePaths.parent(child);
        }
    }
}
