package com.questrail.muxbridge.config;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Aggregated configuration for one bridge session.
 *
 * @param privileged       the bridge itself runs as root; {@code Current} is {@code root}
 *                         and superuser channels open locally
 * @param superuserBridges candidate peers, in {@code Bridges} order
 * @param environment      the process environment, source of login messages and
 *                         the base environment of spawned peers
 */
public record BridgeRuntimeConfig(
    boolean privileged,
    List<SuperuserBridgeConfig> superuserBridges,
    Map<String, String> environment
) {
    public BridgeRuntimeConfig {
        superuserBridges = List.copyOf(Objects.requireNonNull(superuserBridges, "superuserBridges"));
        environment = Map.copyOf(Objects.requireNonNull(environment, "environment"));
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private boolean privileged;
        private List<SuperuserBridgeConfig> superuserBridges = List.of();
        private Map<String, String> environment = Map.of();

        public Builder withPrivileged(boolean privileged) {
            this.privileged = privileged;
            return this;
        }

        public Builder withSuperuserBridges(List<SuperuserBridgeConfig> bridges) {
            this.superuserBridges = bridges;
            return this;
        }

        public Builder withEnvironment(Map<String, String> environment) {
            this.environment = environment;
            return this;
        }

        public BridgeRuntimeConfig build() {
            return new BridgeRuntimeConfig(privileged, superuserBridges, environment);
        }
    }
}
