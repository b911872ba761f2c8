package com.modflow.mf6io.io.value;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Decoded contents of one block instance: parameter values keyed by lower-case parameter name, in
 * the order the block declares them.
 *
 * <p>Values are {@link Boolean} for keywords, {@link Integer}, {@link Double}, {@link String},
 * {@link java.nio.file.Path} for file names, {@link java.util.List} for list-valued scalars,
 * {@link com.modflow.mf6io.io.array.MfArray}, {@link RecordValue} and {@link TableValue}.
 * Records that can occur several times in a repeating block are held as a list of
 * {@link RecordValue}s.
 */
public final class BlockValue {
    private final String name;
    private final Integer index;
    private final Map<String, Object> values;

    public BlockValue(String name, Integer index, Map<String, ?> values) {
        this.name = name.toLowerCase(Locale.ROOT);
        this.index = index;
        Map<String, Object> copy = new LinkedHashMap<>();
        for (Map.Entry<String, ?> entry : values.entrySet()) {
            copy.put(entry.getKey().toLowerCase(Locale.ROOT), Objects.requireNonNull(entry.getValue(), entry.getKey()));
        }
        this.values = Collections.unmodifiableMap(copy);
    }

    public String getName() {
        return name;
    }

    public Integer getIndex() {
        return index;
    }

    public Object get(String param) {
        return values.get(param.toLowerCase(Locale.ROOT));
    }

    public boolean contains(String param) {
        return values.containsKey(param.toLowerCase(Locale.ROOT));
    }

    public Map<String, Object> getValues() {
        return values;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof BlockValue)) {
            return false;
        }
        BlockValue other = (BlockValue) obj;
        return name.equals(other.name) && Objects.equals(index, other.index) && values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, index, values);
    }

    @Override
    public String toString() {
        return (index == null ? name : name + " " + index) + values;
    }
}
