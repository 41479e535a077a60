package com.questrail.framebus.error;

/**
 * Indicates that a byte block did not have the exact length its target
 * requires, e.g. a default deserialize of the wrong length. Nothing is
 * written when this is thrown; input is never truncated or padded.
 */
public final class SizeMismatchException extends FrameBusException
{
    private final int expected;
    private final int actual;

    public SizeMismatchException(String target, int expected, int actual) {
        super(ErrorKind.SIZE_MISMATCH,
                target + ": size mismatch: got " + actual + ", expected " + expected);
        this.expected = expected;
        this.actual = actual;
    }

    public int expected() {
        return expected;
    }

    public int actual() {
        return actual;
    }
}
