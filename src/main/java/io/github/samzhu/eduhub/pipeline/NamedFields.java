package io.github.samzhu.eduhub.pipeline;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 保留宣告順序的具名欄位集合，用於 group 累加器、addFields 與物件運算式。
 *
 * @param <T> 欄位值型別
 */
public final class NamedFields<T> {

    private final LinkedHashMap<String, T> fields = new LinkedHashMap<>();

    private NamedFields() {
    }

    public static <T> NamedFields<T> of(String name, T value) {
        return new NamedFields<T>().and(name, value);
    }

    public NamedFields<T> and(String name, T value) {
        if (fields.containsKey(name)) {
            throw new IllegalArgumentException("Duplicate field name: " + name);
        }
        fields.put(name, value);
        return this;
    }

    public Map<String, T> toMap() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }
}
