package com.questrail.framebus.error;

import java.util.Objects;

/**
 * Base type of every failure the frame bus core signals to its callers.
 *
 * <p>Frame-level operations throw subclasses of this exception precisely.
 * Port-level operations translate them into boolean results so transport
 * loops can treat "not connected" and "value rejected" uniformly.</p>
 */
public abstract class FrameBusException extends RuntimeException
{
    private final ErrorKind kind;

    protected FrameBusException(ErrorKind kind, String message) {
        super(message);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    protected FrameBusException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public final ErrorKind kind() {
        return kind;
    }
}
