package io.hearthwarrio.outlinium.core.ax;

import java.util.Objects;

/**
 * Named accessibility property, e.g. {@code focusable=true} or {@code level=2}.
 */
public final class AxProperty {

    private final String name;
    private final AxValue value;

    public AxProperty(String name, AxValue value) {
        this.name = name == null ? "" : name;
        this.value = value == null ? AxValue.empty() : value;
    }

    public String getName() {
        return name;
    }

    public AxValue getValue() {
        return value;
    }

    @Override
    public String toString() {
        return name + "=" + value.getValue();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AxProperty)) return false;
        AxProperty that = (AxProperty) o;
        return name.equals(that.name) && value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, value);
    }
}
