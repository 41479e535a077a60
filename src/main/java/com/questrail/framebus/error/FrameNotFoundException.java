package com.questrail.framebus.error;

/**
 * Indicates that a frame name could not be resolved, either in the frame bus
 * or among a port's local connections.
 */
public final class FrameNotFoundException extends FrameBusException
{
    private final String frameName;

    public FrameNotFoundException(String frameName) {
        super(ErrorKind.NOT_FOUND, "Frame not found: " + frameName);
        this.frameName = frameName;
    }

    public String frameName() {
        return frameName;
    }
}
