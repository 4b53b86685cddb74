package com.hartwig.wdl2cwl.ir;

import java.util.Optional;

import org.immutables.value.Value;

/**
 * Declared type of a parameter. Arrays and optionals wrap an inner type, so {@code Array[File?]?} is an optional of an
 * array of optional files.
 */
@Value.Immutable
@Value.Style(jdkOnly = true)
public interface ParameterType {
    enum Kind {
        FILE,
        STRING,
        INT,
        FLOAT,
        BOOLEAN,
        ARRAY,
        OPTIONAL,
        STRUCT,
        UNSUPPORTED
    }

    Kind kind();

    /**
     * Element type of an array, wrapped type of an optional.
     */
    Optional<ParameterType> inner();

    /**
     * Struct name, or the verbatim source text of an unsupported type.
     */
    Optional<String> name();

    /**
     * {@code Array[T]+}
     */
    @Value.Default
    default boolean nonEmpty() {
        return false;
    }

    @Value.Check
    default void check() {
        var wrapping = kind() == Kind.ARRAY || kind() == Kind.OPTIONAL;
        if (wrapping != inner().isPresent()) {
            throw new IllegalStateException(String.format("Type of kind %s %s an inner type", kind(), wrapping ? "needs" : "cannot have"));
        }
        var named = kind() == Kind.STRUCT || kind() == Kind.UNSUPPORTED;
        if (named != name().isPresent()) {
            throw new IllegalStateException(String.format("Type of kind %s %s a name", kind(), named ? "needs" : "cannot have"));
        }
    }

    default boolean isOptional() {
        return kind() == Kind.OPTIONAL;
    }

    /**
     * This type without an outer optional.
     */
    default ParameterType required() {
        return isOptional() ? inner().orElseThrow() : this;
    }

    default boolean isArray() {
        return required().kind() == Kind.ARRAY;
    }

    default boolean isFile() {
        return required().kind() == Kind.FILE;
    }

    default ParameterType elementType() {
        if (!isArray()) {
            throw new IllegalStateException("Type " + describe() + " is not an array");
        }
        return required().inner().orElseThrow();
    }

    /**
     * WDL notation of this type.
     */
    default String describe() {
        switch (kind()) {
            case FILE:
                return "File";
            case STRING:
                return "String";
            case INT:
                return "Int";
            case FLOAT:
                return "Float";
            case BOOLEAN:
                return "Boolean";
            case ARRAY:
                return "Array[" + inner().orElseThrow().describe() + "]" + (nonEmpty() ? "+" : "");
            case OPTIONAL:
                return inner().orElseThrow().describe() + "?";
            default:
                return name().orElseThrow();
        }
    }

    static ParameterType of(Kind kind) {
        return ImmutableParameterType.builder().kind(kind).build();
    }

    static ParameterType file() {
        return of(Kind.FILE);
    }

    static ParameterType string() {
        return of(Kind.STRING);
    }

    static ParameterType integer() {
        return of(Kind.INT);
    }

    static ParameterType floating() {
        return of(Kind.FLOAT);
    }

    static ParameterType bool() {
        return of(Kind.BOOLEAN);
    }

    static ParameterType arrayOf(ParameterType element) {
        return ImmutableParameterType.builder().kind(Kind.ARRAY).inner(element).build();
    }

    static ParameterType optionalOf(ParameterType type) {
        if (type.isOptional()) {
            return type;
        }
        return ImmutableParameterType.builder().kind(Kind.OPTIONAL).inner(type).build();
    }

    static ParameterType struct(String name) {
        return ImmutableParameterType.builder().kind(Kind.STRUCT).name(name).build();
    }

    static ParameterType unsupported(String sourceText) {
        return ImmutableParameterType.builder().kind(Kind.UNSUPPORTED).name(sourceText).build();
    }
}
