package com.questrail.framebus.test;

import com.questrail.framebus.api.Frame;
import com.questrail.framebus.api.SignalValue;
import com.questrail.framebus.config.FrameBusConfig;
import com.questrail.framebus.core.AbstractFrame;
import com.questrail.framebus.layout.FrameLayout;
import com.questrail.framebus.observability.FrameBusObservabilitySink;
import com.questrail.framebus.registry.TypeDescriptor;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;

/**
 * Sample frame: an int32 reading plus a float64 timestamp, 12 bytes packed.
 */
public final class SensorFrame extends AbstractFrame
{
    public static final String TYPE_NAME = "SensorFrame";

    public static final FrameLayout LAYOUT = FrameLayout.builder()
            .int32("value")
            .float64("timestamp")
            .build();

    public static final TypeDescriptor<Frame> TYPE = TypeDescriptor.of(TYPE_NAME,
            (name, context) -> new SensorFrame(name, context.config(), context.observability()));

    public SensorFrame(String instanceName) {
        super(instanceName, LAYOUT);
    }

    public SensorFrame(String instanceName, FrameBusConfig config, FrameBusObservabilitySink sink) {
        super(instanceName, LAYOUT, config, sink);
    }

    @Override
    public String typeName() {
        return TYPE_NAME;
    }

    public int value() {
        return getSignal("value").asInt32();
    }

    public void setValue(int value) {
        setSignal("value", SignalValue.of(value));
    }

    public void publishValue(int value) {
        setSignalWithPublish("value", SignalValue.of(value));
    }

    /**
     * Reads "value" out of a serialized snapshot.
     */
    public static int valueOf(byte[] snapshot) {
        return ByteBuffer.wrap(snapshot).order(ByteOrder.LITTLE_ENDIAN).getInt(0);
    }

    public static byte[] payload(int value, double timestamp) {
        return ByteBuffer.allocate(LAYOUT.size())
                .order(ByteOrder.LITTLE_ENDIAN)
                .putInt(value)
                .putDouble(timestamp)
                .array();
    }
}
