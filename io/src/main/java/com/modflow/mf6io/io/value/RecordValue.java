package com.modflow.mf6io.io.value;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Values of a record, a keystring or a table row, keyed by component name in declaration order.
 * Components that were omitted from the input are absent. A keystring value holds exactly one
 * entry: the alternative that was selected.
 */
public final class RecordValue {
    private final Map<String, Object> values;

    public RecordValue(Map<String, ?> values) {
        Map<String, Object> copy = new LinkedHashMap<>();
        for (Map.Entry<String, ?> entry : values.entrySet()) {
            copy.put(entry.getKey().toLowerCase(Locale.ROOT), Objects.requireNonNull(entry.getValue(), entry.getKey()));
        }
        this.values = Collections.unmodifiableMap(copy);
    }

    /** A single-entry value, as produced for a keystring. */
    public static RecordValue of(String name, Object value) {
        return new RecordValue(Map.of(name, value));
    }

    public Object get(String name) {
        return values.get(name.toLowerCase(Locale.ROOT));
    }

    public boolean contains(String name) {
        return values.containsKey(name.toLowerCase(Locale.ROOT));
    }

    public Map<String, Object> getValues() {
        return values;
    }

    public List<String> names() {
        return List.copyOf(values.keySet());
    }

    public int size() {
        return values.size();
    }

    /** Name of the first entry; for a keystring, the selected alternative. */
    public String selected() {
        return values.isEmpty() ? null : values.keySet().iterator().next();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof RecordValue)) {
            return false;
        }
        return values.equals(((RecordValue) obj).values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
