package com.questrail.framebus.config;

import org.junit.jupiter.api.Test;

import java.net.InetSocketAddress;

import static org.junit.jupiter.api.Assertions.*;

class ConfigBuilderTests
{
    @Test
    void frameBusDefaults() {
        FrameBusConfig config = FrameBusConfig.defaults();

        assertEquals(SnapshotQueuePolicy.DEFAULT_CAPACITY, config.snapshotQueuePolicy().capacity());
        assertEquals(OverflowPolicy.DROP_OLDEST, config.snapshotQueuePolicy().overflow());
        assertEquals("framebus", config.workerNamePrefix());
        assertTrue(config.daemonWorkers());
    }

    @Test
    void frameBusBuilderOverridesEachField() {
        FrameBusConfig config = FrameBusConfig.builder()
                .withSnapshotQueuePolicy(SnapshotQueuePolicy.bounded(8, OverflowPolicy.BLOCK_PUBLISHER))
                .withWorkerNamePrefix("cab")
                .withDaemonWorkers(false)
                .build();

        assertEquals(new SnapshotQueuePolicy(8, OverflowPolicy.BLOCK_PUBLISHER), config.snapshotQueuePolicy());
        assertEquals("cab", config.workerNamePrefix());
        assertFalse(config.daemonWorkers());
    }

    @Test
    void queuePolicyValidation() {
        assertThrows(IllegalArgumentException.class, () -> SnapshotQueuePolicy.bounded(0, OverflowPolicy.DROP_NEWEST));
        assertThrows(NullPointerException.class, () -> SnapshotQueuePolicy.bounded(1, null));
        assertTrue(SnapshotQueuePolicy.unbounded().isUnbounded());
        assertFalse(SnapshotQueuePolicy.defaults().isUnbounded());
    }

    @Test
    void udpPortDefaultsToAnEphemeralReceiveOnlyPort() {
        UdpPortConfig config = UdpPortConfig.defaults();

        assertEquals(0, config.bindAddress().getPort());
        assertTrue(config.remote().isEmpty());

        InetSocketAddress remote = new InetSocketAddress("127.0.0.1", 47000);
        assertEquals(remote, UdpPortConfig.builder().withRemoteAddress(remote).build().remote().orElseThrow());
        assertThrows(NullPointerException.class, () -> UdpPortConfig.builder().withBindAddress(null).build());
    }
}
