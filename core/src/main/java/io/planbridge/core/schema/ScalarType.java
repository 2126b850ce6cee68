// file: core/src/main/java/io/planbridge/core/schema/ScalarType.java
package io.planbridge.core.schema;

/** Primitive types a {@link SchemaNode} of kind SCALAR may declare. */
public enum ScalarType {
    STRING,
    NUMBER,
    BOOL
}
