package com.questrail.framebus.error;

/**
 * Thrown by {@code invoke} when no function is bound to the requested name.
 */
public final class UnknownMethodException extends FrameBusException
{
    public UnknownMethodException(String message) {
        super(ErrorKind.UNKNOWN_METHOD, message);
    }
}
