package io.orderedjson.core;

/**
 * Kinds of value an {@link OrderedMap} entry can hold.
 */
public enum JsonValueType {
    OBJECT,
    ARRAY,
    STRING,
    NUMBER,
    BOOLEAN,
    NULL
}
