package com.questrail.framebus.error;

/**
 * Thrown when a threaded callback is registered through the direct registration path.
 */
public final class InvalidPolicyException extends FrameBusException
{
    public InvalidPolicyException(String message) {
        super(ErrorKind.INVALID_POLICY, message);
    }
}
