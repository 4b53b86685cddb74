package com.hartwig.wdl2cwl.ir;

import java.math.BigInteger;

import org.immutables.value.Value;

@Value.Immutable
@Value.Style(jdkOnly = true)
public interface Literal extends Expression {
    enum Type {
        STRING,
        INT,
        FLOAT,
        BOOLEAN,
        NULL
    }

    Type type();

    /**
     * Canonical text of the value. Strings are stored unquoted and unescaped.
     */
    String text();

    @Override
    default Kind kind() {
        return Kind.LITERAL;
    }

    /**
     * The value as a Java object: {@link String}, {@link Long} ({@link BigInteger} beyond its range), {@link Double},
     * {@link Boolean} or null.
     */
    default Object value() {
        switch (type()) {
            case INT:
                var number = new BigInteger(text());
                return number.bitLength() < Long.SIZE ? (Object) number.longValue() : number;
            case FLOAT:
                return Double.parseDouble(text());
            case BOOLEAN:
                return Boolean.parseBoolean(text());
            case NULL:
                return null;
            default:
                return text();
        }
    }

    default boolean isNumeric() {
        return type() == Type.INT || type() == Type.FLOAT;
    }

    static Literal string(String value) {
        return ImmutableLiteral.builder().type(Type.STRING).text(value).build();
    }

    static Literal integer(long value) {
        return ImmutableLiteral.builder().type(Type.INT).text(Long.toString(value)).build();
    }

    static Literal floating(String text) {
        return ImmutableLiteral.builder().type(Type.FLOAT).text(text).build();
    }

    static Literal bool(boolean value) {
        return ImmutableLiteral.builder().type(Type.BOOLEAN).text(Boolean.toString(value)).build();
    }

    static Literal none() {
        return ImmutableLiteral.builder().type(Type.NULL).text("None").build();
    }
}
