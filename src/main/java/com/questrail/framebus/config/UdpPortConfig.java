package com.questrail.framebus.config;

import java.net.InetSocketAddress;
import java.util.Objects;
import java.util.Optional;

/**
 * Addresses of a UDP frame port.
 *
 * @param bindAddress   local address the endpoint binds to
 * @param remoteAddress destination of exported frames; {@code null} for a
 *                      receive-only port
 */
public record UdpPortConfig(
    InetSocketAddress bindAddress,
    InetSocketAddress remoteAddress
) {
    public UdpPortConfig {
        Objects.requireNonNull(bindAddress, "bindAddress");
    }

    public Optional<InetSocketAddress> remote() {
        return Optional.ofNullable(remoteAddress);
    }

    /**
     * Ephemeral local port, no remote.
     */
    public static UdpPortConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private InetSocketAddress bindAddress = new InetSocketAddress(0);
        private InetSocketAddress remoteAddress;

        public Builder withBindAddress(InetSocketAddress bindAddress) {
            this.bindAddress = bindAddress;
            return this;
        }

        public Builder withRemoteAddress(InetSocketAddress remoteAddress) {
            this.remoteAddress = remoteAddress;
            return this;
        }

        public UdpPortConfig build() {
            return new UdpPortConfig(bindAddress, remoteAddress);
        }
    }
}
