package com.questrail.framebus.error;

/**
 * Thrown when a signal name is not declared by the frame's layout.
 */
public final class UnknownSignalException extends FrameBusException
{
    public UnknownSignalException(String message) {
        super(ErrorKind.UNKNOWN_SIGNAL, message);
    }
}
