package com.questrail.framebus.error;

/**
 * ErrorKind
 * -----------------------------------------------------------------------------
 * Closed taxonomy of failures signalled by the frame bus core.
 *
 * <p>Every {@link FrameBusException} carries exactly one kind so that callers
 * can switch over failures exhaustively instead of inspecting messages.</p>
 */
public enum ErrorKind
{
    /** A signal name is not declared by the frame's layout. */
    UNKNOWN_SIGNAL,

    /** A method name is not bound in a method table. */
    UNKNOWN_METHOD,

    /** A value's kind does not equal the static kind of the target field. */
    TYPE_MISMATCH,

    /** A byte block does not have the exact size the target requires. */
    SIZE_MISMATCH,

    /** A callback was registered with a policy the call does not accept. */
    INVALID_POLICY,

    /** A frame name could not be resolved. */
    NOT_FOUND,

    /** A bound method failed with a checked exception. */
    INVOCATION_FAILED
}
