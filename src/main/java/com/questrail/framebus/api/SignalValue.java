package com.questrail.framebus.api;

import com.questrail.framebus.error.SignalTypeMismatchException;

import java.util.Arrays;
import java.util.Objects;

/**
 * SignalValue
 * -----------------------------------------------------------------------------
 * Type-erased value exchanged through signal accessors and method tables.
 *
 * <p>This is a <em>closed</em> variant: one record per {@link SignalType}. A
 * value never converts implicitly into another kind. The typed accessors
 * ({@link #asInt32()}, {@link #asFloat64()}, ...) fail with
 * {@link SignalTypeMismatchException} when the kind does not match, which
 * keeps mismatch handling exhaustive and checkable with a {@code switch}.</p>
 */
public sealed interface SignalValue
        permits SignalValue.Bool,
                SignalValue.Int8,
                SignalValue.Int16,
                SignalValue.Int32,
                SignalValue.Int64,
                SignalValue.Float32,
                SignalValue.Float64,
                SignalValue.Bytes,
                SignalValue.Text,
                SignalValue.None
{
    /**
     * The kind of this value.
     */
    SignalType type();

    /**
     * Returns this value as the matching boxed Java object ({@code Integer}
     * for {@link SignalType#INT32}, {@code byte[]} copy for
     * {@link SignalType#BYTES}, {@code null} for {@link SignalType#NONE}).
     */
    Object boxed();

    // -------------------------------------------------------------------------
    // Factories
    // -------------------------------------------------------------------------

    static SignalValue of(boolean value) {
        return new Bool(value);
    }

    static SignalValue of(byte value) {
        return new Int8(value);
    }

    static SignalValue of(short value) {
        return new Int16(value);
    }

    static SignalValue of(int value) {
        return new Int32(value);
    }

    static SignalValue of(long value) {
        return new Int64(value);
    }

    static SignalValue of(float value) {
        return new Float32(value);
    }

    static SignalValue of(double value) {
        return new Float64(value);
    }

    static SignalValue of(byte[] value) {
        return new Bytes(value);
    }

    static SignalValue of(String value) {
        return new Text(value);
    }

    static SignalValue none() {
        return None.INSTANCE;
    }

    // -------------------------------------------------------------------------
    // Typed accessors
    // -------------------------------------------------------------------------

    default boolean asBool() {
        return expect(SignalType.BOOL, Bool.class).value();
    }

    default byte asInt8() {
        return expect(SignalType.INT8, Int8.class).value();
    }

    default short asInt16() {
        return expect(SignalType.INT16, Int16.class).value();
    }

    default int asInt32() {
        return expect(SignalType.INT32, Int32.class).value();
    }

    default long asInt64() {
        return expect(SignalType.INT64, Int64.class).value();
    }

    default float asFloat32() {
        return expect(SignalType.FLOAT32, Float32.class).value();
    }

    default double asFloat64() {
        return expect(SignalType.FLOAT64, Float64.class).value();
    }

    default byte[] asBytes() {
        return expect(SignalType.BYTES, Bytes.class).value();
    }

    default String asText() {
        return expect(SignalType.TEXT, Text.class).value();
    }

    private <V extends SignalValue> V expect(SignalType expected, Class<V> type) {
        if (type() != expected) {
            throw new SignalTypeMismatchException("value", expected, type());
        }
        return type.cast(this);
    }

    // -------------------------------------------------------------------------
    // Variants
    // -------------------------------------------------------------------------

    record Bool(boolean value) implements SignalValue {
        @Override public SignalType type() { return SignalType.BOOL; }
        @Override public Object boxed() { return value; }
    }

    record Int8(byte value) implements SignalValue {
        @Override public SignalType type() { return SignalType.INT8; }
        @Override public Object boxed() { return value; }
    }

    record Int16(short value) implements SignalValue {
        @Override public SignalType type() { return SignalType.INT16; }
        @Override public Object boxed() { return value; }
    }

    record Int32(int value) implements SignalValue {
        @Override public SignalType type() { return SignalType.INT32; }
        @Override public Object boxed() { return value; }
    }

    record Int64(long value) implements SignalValue {
        @Override public SignalType type() { return SignalType.INT64; }
        @Override public Object boxed() { return value; }
    }

    record Float32(float value) implements SignalValue {
        @Override public SignalType type() { return SignalType.FLOAT32; }
        @Override public Object boxed() { return value; }
    }

    record Float64(double value) implements SignalValue {
        @Override public SignalType type() { return SignalType.FLOAT64; }
        @Override public Object boxed() { return value; }
    }

    /**
     * Byte block value. The array is copied on the way in and on the way out.
     */
    record Bytes(byte[] value) implements SignalValue {
        public Bytes {
            value = Objects.requireNonNull(value, "value").clone();
        }

        @Override
        public byte[] value() {
            return value.clone();
        }

        public int length() {
            return value.length;
        }

        @Override public SignalType type() { return SignalType.BYTES; }
        @Override public Object boxed() { return value.clone(); }

        @Override
        public boolean equals(Object o) {
            return o instanceof Bytes other && Arrays.equals(value, other.value);
        }

        @Override
        public int hashCode() {
            return Arrays.hashCode(value);
        }

        @Override
        public String toString() {
            return "Bytes" + Arrays.toString(value);
        }
    }

    /**
     * Text value; method-table use only.
     */
    record Text(String value) implements SignalValue {
        public Text {
            Objects.requireNonNull(value, "value");
        }

        @Override public SignalType type() { return SignalType.TEXT; }
        @Override public Object boxed() { return value; }
    }

    /**
     * Absence of a value; returned by methods that produce nothing.
     */
    final class None implements SignalValue {
        static final None INSTANCE = new None();

        private None() {}

        @Override public SignalType type() { return SignalType.NONE; }
        @Override public Object boxed() { return null; }

        @Override
        public String toString() {
            return "None";
        }
    }
}
