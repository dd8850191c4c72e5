package tech.regionguard.failover.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Objects;

/**
 * Opaque region identifier. Deployments use {@link #PRIMARY} and {@link #SECONDARY},
 * but any non-blank value is accepted so further regions can be added.
 */
public record RegionId(String value) {

    public static final RegionId PRIMARY = new RegionId("PRIMARY");
    public static final RegionId SECONDARY = new RegionId("SECONDARY");

    public RegionId {
        Objects.requireNonNull(value, "value");
        if (value.isBlank()) {
            throw new IllegalArgumentException("Region id must not be blank");
        }
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static RegionId of(String value) {
        return new RegionId(value);
    }

    @JsonValue
    @Override
    public String value() {
        return value;
    }

    @Override
    public String toString() {
        return value;
    }
}
