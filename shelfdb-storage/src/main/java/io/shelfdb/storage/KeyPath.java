package io.shelfdb.storage;

import io.shelfdb.common.exception.StorageException;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;

public record KeyPath(String path, List<String> segments) {

    private static final Pattern SEPARATOR = Pattern.compile("\\.");

    public KeyPath {
        Objects.requireNonNull(path, "path must not be null");
        segments = List.copyOf(segments);
        if (segments.isEmpty()) {
            throw new IllegalArgumentException("key path must not be empty");
        }
    }

    public static KeyPath of(String path) {
        Objects.requireNonNull(path, "path must not be null");
        if (path.isBlank()) {
            throw new IllegalArgumentException("key path must not be blank");
        }
        List<String> segments = List.of(SEPARATOR.split(path, -1));
        for (String segment : segments) {
            if (segment.isEmpty()) {
                throw new IllegalArgumentException("Malformed key path: " + path);
            }
        }
        return new KeyPath(path, segments);
    }

    public Optional<Object> extract(Object record) {
        Object current = record;
        for (String segment : segments) {
            if (!(current instanceof Map<?, ?> map) || !map.containsKey(segment)) {
                return Optional.empty();
            }
            current = map.get(segment);
        }
        return Optional.ofNullable(current);
    }

    @SuppressWarnings("unchecked")
    public void inject(Object record, Object key) {
        if (!(record instanceof Map<?, ?>)) {
            throw new StorageException.DataError("Cannot inject key at '" + path + "' into a non-map record");
        }
        Map<String, Object> current = (Map<String, Object>) record;
        for (int i = 0; i < segments.size() - 1; i++) {
            Object next = current.get(segments.get(i));
            if (next == null) {
                next = new LinkedHashMap<String, Object>();
                current.put(segments.get(i), next);
            } else if (!(next instanceof Map<?, ?>)) {
                throw new StorageException.DataError("Cannot inject key at '" + path + "': segment '"
                    + segments.get(i) + "' is not a map");
            }
            current = (Map<String, Object>) next;
        }
        current.put(segments.get(segments.size() - 1), key);
    }

    @Override
    public String toString() {
        return path;
    }
}
