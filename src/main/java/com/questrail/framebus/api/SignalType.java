package com.questrail.framebus.api;

/**
 * SignalType
 * -----------------------------------------------------------------------------
 * The closed set of value kinds that can flow through the frame bus.
 *
 * <h2>Storable vs transient kinds</h2>
 * <ul>
 *   <li>Fixed-width primitives ({@link #BOOL} through {@link #FLOAT64}) and
 *       fixed-length {@link #BYTES} blocks can be declared as payload fields</li>
 *   <li>{@link #TEXT} and {@link #NONE} exist only as method-table arguments
 *       and results; they can never be stored in a payload</li>
 * </ul>
 *
 * Restricting payload fields to these kinds is what makes every payload
 * flat and bit-copyable: there is no way to declare a reference-typed field.
 */
public enum SignalType
{
    BOOL(1),
    INT8(1),
    INT16(2),
    INT32(4),
    INT64(8),
    FLOAT32(4),
    FLOAT64(8),

    /**
     * A fixed-length byte block. The length is declared per field.
     */
    BYTES(0),

    TEXT(-1),
    NONE(-1);

    private final int width;

    SignalType(int width) {
        this.width = width;
    }

    /**
     * Returns the encoded width in bytes for fixed-width kinds, {@code 0} for
     * {@link #BYTES} (width is declared per field) and {@code -1} for kinds
     * that cannot be stored.
     */
    public int width() {
        return width;
    }

    /**
     * Returns {@code true} if a payload field may be declared with this kind.
     */
    public boolean isStorable() {
        return width >= 0;
    }
}
