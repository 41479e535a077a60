package com.questrail.framebus.layout;

import com.questrail.framebus.api.SignalType;

import java.nio.ByteOrder;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * FrameLayout
 * -----------------------------------------------------------------------------
 * The static, flat layout of a frame payload: an ordered list of
 * {@link SignalField}s at fixed byte offsets, a total size and a byte order.
 *
 * <h2>Why this exists</h2>
 * A payload must be bit-copyable: copying its bytes must always produce an
 * equivalent value. A layout can only be built from fixed-width primitive
 * kinds and fixed-length byte blocks, so a reference-carrying payload cannot
 * be declared at all. Layouts are usually held in a {@code static final}
 * field of the concrete frame type.
 *
 * <h2>Packing</h2>
 * Fields are packed back to back in declaration order with no implicit
 * alignment padding. Gaps that a wire format or a C structure requires must be
 * declared explicitly with {@link Builder#reserved(int)}. The default byte
 * order is little-endian.
 *
 * <h2>Identity</h2>
 * Field names are unique within a layout; a duplicate declaration fails when
 * the layout is built.
 */
public final class FrameLayout
{
    private final List<SignalField> fields;
    private final Map<String, SignalField> fieldsByName;
    private final int size;
    private final ByteOrder order;

    private FrameLayout(List<SignalField> fields, int size, ByteOrder order) {
        Map<String, SignalField> byName = new LinkedHashMap<>();
        for (SignalField field : fields) {
            SignalField prev = byName.put(field.name(), field);
            if (prev != null) {
                throw new IllegalArgumentException("Duplicate signal name in layout: " + field.name());
            }
        }
        this.fields = List.copyOf(fields);
        this.fieldsByName = Collections.unmodifiableMap(byName);
        this.size = size;
        this.order = order;
    }

    /**
     * Total payload size in bytes.
     */
    public int size() {
        return size;
    }

    public ByteOrder order() {
        return order;
    }

    /**
     * Fields in declaration order.
     */
    public List<SignalField> fields() {
        return fields;
    }

    /**
     * Field names in declaration order.
     */
    public Set<String> names() {
        return fieldsByName.keySet();
    }

    public Optional<SignalField> field(String name) {
        return Optional.ofNullable(fieldsByName.get(name));
    }

    public boolean contains(String name) {
        return fieldsByName.containsKey(name);
    }

    @Override
    public String toString() {
        return "FrameLayout" + fields + " size=" + size + " order=" + order;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private final List<SignalField> fields = new ArrayList<>();
        private ByteOrder order = ByteOrder.LITTLE_ENDIAN;
        private int cursor;

        public Builder order(ByteOrder order) {
            this.order = Objects.requireNonNull(order, "order");
            return this;
        }

        public Builder bool(String name) {
            return field(name, SignalType.BOOL, SignalType.BOOL.width());
        }

        public Builder int8(String name) {
            return field(name, SignalType.INT8, SignalType.INT8.width());
        }

        public Builder int16(String name) {
            return field(name, SignalType.INT16, SignalType.INT16.width());
        }

        public Builder int32(String name) {
            return field(name, SignalType.INT32, SignalType.INT32.width());
        }

        public Builder int64(String name) {
            return field(name, SignalType.INT64, SignalType.INT64.width());
        }

        public Builder float32(String name) {
            return field(name, SignalType.FLOAT32, SignalType.FLOAT32.width());
        }

        public Builder float64(String name) {
            return field(name, SignalType.FLOAT64, SignalType.FLOAT64.width());
        }

        public Builder bytes(String name, int length) {
            return field(name, SignalType.BYTES, length);
        }

        /**
         * Skips {@code length} bytes that belong to no signal.
         */
        public Builder reserved(int length) {
            if (length <= 0) {
                throw new IllegalArgumentException("reserved length must be positive");
            }
            cursor += length;
            return this;
        }

        private Builder field(String name, SignalType type, int length) {
            SignalField field = new SignalField(name, type, cursor, length);
            fields.add(field);
            cursor = field.end();
            return this;
        }

        public FrameLayout build() {
            if (cursor == 0) {
                throw new IllegalStateException("A layout needs at least one byte");
            }
            return new FrameLayout(fields, cursor, order);
        }
    }
}
