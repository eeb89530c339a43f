package io.hearthwarrio.outlinium.core.ax;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Typed accessibility value: {@code {type, value, sources}}.
 * <p>
 * {@code value} is kept as delivered (String, Boolean, Number, or null).
 */
public final class AxValue {

    private static final AxValue EMPTY = new AxValue("", null, List.of());

    private final String type;
    private final Object value;
    private final List<Object> sources;

    public AxValue(String type, Object value, List<Object> sources) {
        this.type = type == null ? "" : type;
        this.value = value;
        this.sources = sources == null ? List.of() : Collections.unmodifiableList(sources);
    }

    public static AxValue empty() {
        return EMPTY;
    }

    public static AxValue of(String type, Object value) {
        return new AxValue(type, value, List.of());
    }

    public String getType() {
        return type;
    }

    public Object getValue() {
        return value;
    }

    public List<Object> getSources() {
        return sources;
    }

    /**
     * @return value as text, or empty string when there is no value
     */
    public String asText() {
        return value == null ? "" : String.valueOf(value);
    }

    public boolean isEmpty() {
        return asText().isEmpty();
    }

    @Override
    public String toString() {
        return "AxValue{" +
                "type='" + type + '\'' +
                ", value=" + value +
                '}';
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AxValue)) return false;
        AxValue that = (AxValue) o;
        return type.equals(that.type) && Objects.equals(value, that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, value);
    }
}
