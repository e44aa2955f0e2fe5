package com.sarcodec.xml;

import lombok.Value;

import java.util.Objects;

/**
 * Free-form name/value pair, stored as {@code <Parameter name="...">value</Parameter>}.
 */
@Value
public class Parameter {
    String name;
    String value;

    public Parameter(String name, String value) {
        this.name = Objects.requireNonNull(name, "Parameter name cannot be null");
        this.value = Objects.requireNonNull(value, "Parameter value cannot be null");
    }
}
