package com.questrail.framebus.layout;

import com.questrail.framebus.api.SignalType;
import com.questrail.framebus.api.SignalValue;
import com.questrail.framebus.error.SignalTypeMismatchException;
import com.questrail.framebus.error.SizeMismatchException;

import java.nio.ByteBuffer;
import java.util.Objects;

/**
 * SignalField
 * -----------------------------------------------------------------------------
 * One named field of a {@link FrameLayout}: a storable {@link SignalType} at a
 * fixed byte offset.
 *
 * <p>Reads and writes use absolute positions, so they never disturb the
 * buffer's position or limit. Callers are responsible for holding the
 * payload lock.</p>
 */
public record SignalField(String name, SignalType type, int offset, int length)
{
    public SignalField {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(type, "type");
        if (name.isBlank()) {
            throw new IllegalArgumentException("Signal name must not be blank");
        }
        if (!type.isStorable()) {
            throw new IllegalArgumentException("Signal '" + name + "': " + type + " cannot be stored in a payload");
        }
        if (offset < 0) {
            throw new IllegalArgumentException("Signal '" + name + "': negative offset " + offset);
        }
        if (length <= 0 || (type != SignalType.BYTES && length != type.width())) {
            throw new IllegalArgumentException("Signal '" + name + "': illegal length " + length + " for " + type);
        }
    }

    /**
     * Offset of the first byte after this field.
     */
    public int end() {
        return offset + length;
    }

    /**
     * Decodes this field from {@code payload}.
     */
    public SignalValue read(ByteBuffer payload) {
        return switch (type) {
            case BOOL -> SignalValue.of(payload.get(offset) != 0);
            case INT8 -> SignalValue.of(payload.get(offset));
            case INT16 -> SignalValue.of(payload.getShort(offset));
            case INT32 -> SignalValue.of(payload.getInt(offset));
            case INT64 -> SignalValue.of(payload.getLong(offset));
            case FLOAT32 -> SignalValue.of(payload.getFloat(offset));
            case FLOAT64 -> SignalValue.of(payload.getDouble(offset));
            case BYTES -> {
                byte[] block = new byte[length];
                payload.get(offset, block);
                yield SignalValue.of(block);
            }
            case TEXT, NONE -> throw new IllegalStateException("Unstorable field type " + type);
        };
    }

    /**
     * Encodes {@code value} into {@code payload}.
     *
     * @throws SignalTypeMismatchException if {@code value.type() != type()}
     * @throws SizeMismatchException       if a {@code BYTES} value has the wrong length
     */
    public void write(ByteBuffer payload, SignalValue value) {
        Objects.requireNonNull(value, "value");
        if (value.type() != type) {
            throw new SignalTypeMismatchException("signal '" + name + "'", type, value.type());
        }
        switch (type) {
            case BOOL -> payload.put(offset, (byte) (value.asBool() ? 1 : 0));
            case INT8 -> payload.put(offset, value.asInt8());
            case INT16 -> payload.putShort(offset, value.asInt16());
            case INT32 -> payload.putInt(offset, value.asInt32());
            case INT64 -> payload.putLong(offset, value.asInt64());
            case FLOAT32 -> payload.putFloat(offset, value.asFloat32());
            case FLOAT64 -> payload.putDouble(offset, value.asFloat64());
            case BYTES -> {
                byte[] block = value.asBytes();
                if (block.length != length) {
                    throw new SizeMismatchException("signal '" + name + "'", length, block.length);
                }
                payload.put(offset, block);
            }
            case TEXT, NONE -> throw new IllegalStateException("Unstorable field type " + type);
        }
    }
}
