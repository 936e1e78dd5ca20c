package org.caureq.selfrepair.service.health.probe;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.net.InetAddress;
import java.net.ServerSocket;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("TcpProbe")
class TcpProbeTest {

    @Test
    @DisplayName("A listening port is healthy")
    void listening() throws Exception {
        try (var server = new ServerSocket(0, 1, InetAddress.getLoopbackAddress())) {
            var probe = new TcpProbe("127.0.0.1", server.getLocalPort());

            assertThat(probe.check(Duration.ofSeconds(1)).healthy()).isTrue();
        }
    }

    @Test
    @DisplayName("A closed port is unhealthy")
    void closed() throws Exception {
        int port;
        try (var server = new ServerSocket(0, 1, InetAddress.getLoopbackAddress())) {
            port = server.getLocalPort();
        }

        var result = new TcpProbe("127.0.0.1", port).check(Duration.ofSeconds(1));

        assertThat(result.healthy()).isFalse();
        assertThat(result.detail()).contains("unreachable");
    }

    @Test
    @DisplayName("The target must be host:port")
    void parse() {
        assertThatThrownBy(() -> TcpProbe.parse("localhost")).isInstanceOf(IllegalArgumentException.class);
    }
}
