package com.questrail.framebus.error;

import com.questrail.framebus.api.SignalType;

/**
 * Indicates that a {@code SignalValue} of one kind was used where a field or
 * accessor of another kind was expected.
 *
 * <p>There is no implicit widening: an {@code INT32} value written into a
 * {@code FLOAT64} field fails with this exception.</p>
 */
public final class SignalTypeMismatchException extends FrameBusException
{
    private final SignalType expected;
    private final SignalType actual;

    public SignalTypeMismatchException(String target, SignalType expected, SignalType actual) {
        super(ErrorKind.TYPE_MISMATCH,
                "Type mismatch for " + target + ": expected " + expected + ", got " + actual);
        this.expected = expected;
        this.actual = actual;
    }

    public SignalTypeMismatchException(String target, Class<?> requested, SignalType actual) {
        super(ErrorKind.TYPE_MISMATCH,
                "Type mismatch for " + target + ": requested " + requested.getSimpleName() + ", got " + actual);
        this.expected = null;
        this.actual = actual;
    }

    /**
     * The expected kind, or {@code null} when a Java type was requested.
     */
    public SignalType expected() {
        return expected;
    }

    public SignalType actual() {
        return actual;
    }
}
