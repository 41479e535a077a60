package com.questrail.framebus.error;

/**
 * Wraps a checked exception thrown by a function bound in a method table.
 * Unchecked exceptions are propagated to the caller unchanged.
 */
public final class MethodInvocationException extends FrameBusException
{
    public MethodInvocationException(String methodName, Throwable cause) {
        super(ErrorKind.INVOCATION_FAILED, "Method '" + methodName + "' failed: " + cause.getMessage(), cause);
    }
}
