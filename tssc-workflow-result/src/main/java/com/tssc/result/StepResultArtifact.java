package com.tssc.result;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * A named output value of a step, with a type hint for consumers (e.g. {@code str}, {@code file}).
 */
public final class StepResultArtifact {

    /** Type used when none is given. */
    public static final String DEFAULT_TYPE = "str";

    private final String name;
    private final Object value;
    private final String type;

    @JsonCreator
    public StepResultArtifact(
            @JsonProperty("name") String name,
            @JsonProperty("value") Object value,
            @JsonProperty("type") String type) {
        this.name = Objects.requireNonNull(name, "name");
        this.value = value;
        this.type = type != null ? type : DEFAULT_TYPE;
    }

    @JsonProperty("name")
    public String getName() {
        return name;
    }

    @JsonProperty("value")
    public Object getValue() {
        return value;
    }

    @JsonProperty("type")
    public String getType() {
        return type;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        StepResultArtifact that = (StepResultArtifact) o;
        return name.equals(that.name)
                && Objects.equals(value, that.value)
                && type.equals(that.type);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, value, type);
    }

    @Override
    public String toString() {
        return "StepResultArtifact{name=" + name + ", value=" + value + ", type=" + type + "}";
    }
}
