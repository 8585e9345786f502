package com.astrazeneca.tbltransfer.data;

import java.util.Objects;

/**
 * Feature qualifier, e.g. "product" - "nucleoprotein". Value is null for flag qualifiers such as "pseudo".
 */
public final class Qualifier {
    public final String name;
    public final String value;

    public Qualifier(String name, String value) {
        this.name = name;
        this.value = value;
    }

    public Qualifier withValue(String newValue) {
        return new Qualifier(name, newValue);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Qualifier qualifier = (Qualifier) o;
        return Objects.equals(name, qualifier.name) &&
                Objects.equals(value, qualifier.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, value);
    }

    @Override
    public String toString() {
        return value == null ? name : name + "=" + value;
    }
}
