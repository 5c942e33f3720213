package org.scoringapi.gateway.config;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GatewayConfigTest {

    @Test
    void defaultsWhenNothingSet() {
        GatewayConfig config = GatewayConfig.fromLookup(key -> null);

        assertThat(config.getHost()).isEqualTo(GatewayConfig.DEFAULT_HOST);
        assertThat(config.getPort()).isEqualTo(8080);
        assertThat(config.getWorkerThreads()).isEqualTo(4);
        assertThat(config.isFileLoggingEnabled()).isFalse();
        assertThat(config.getStoreMaxEntries()).isEqualTo(GatewayConfig.DEFAULT_STORE_MAX_ENTRIES);
    }

    @Test
    void readsValues() {
        Map<String, String> env = Map.of(
                "GATEWAY_HOST", " 0.0.0.0 ",
                "GATEWAY_PORT", "9090",
                "GATEWAY_WORKER_THREADS", "8",
                "GATEWAY_FILE_LOGGING_ENABLED", "1",
                "GATEWAY_LOG_FILE", "/tmp/gw.log");

        GatewayConfig config = GatewayConfig.fromLookup(env::get);

        assertThat(config.getHost()).isEqualTo("0.0.0.0");
        assertThat(config.getPort()).isEqualTo(9090);
        assertThat(config.getWorkerThreads()).isEqualTo(8);
        assertThat(config.isFileLoggingEnabled()).isTrue();
        assertThat(config.getLogFilePath()).isEqualTo("/tmp/gw.log");
    }

    @Test
    void invalidNumberFallsBackToDefault() {
        GatewayConfig config = GatewayConfig.fromLookup(Map.of("GATEWAY_PORT", "eighty")::get);

        assertThat(config.getPort()).isEqualTo(GatewayConfig.DEFAULT_PORT);
    }

    @Test
    void builderRejectsOutOfRangeValues() {
        assertThatThrownBy(() -> new GatewayConfig.Builder().port(70000))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new GatewayConfig.Builder().workerThreads(0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
