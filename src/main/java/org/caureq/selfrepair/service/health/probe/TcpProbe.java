package org.caureq.selfrepair.service.health.probe;

import org.caureq.selfrepair.service.health.HealthProbe;
import org.caureq.selfrepair.service.health.ProbeResult;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.time.Duration;

/** Healthy when a TCP connection to host:port opens within the timeout. */
public class TcpProbe implements HealthProbe {
    private final String host;
    private final int port;

    public TcpProbe(String host, int port) {
        this.host = host;
        this.port = port;
    }

    public static TcpProbe parse(String target) {
        if (target == null || !target.contains(":")) throw new IllegalArgumentException("tcp probe target must be host:port, got " + target);
        int idx = target.lastIndexOf(':');
        return new TcpProbe(target.substring(0, idx), Integer.parseInt(target.substring(idx + 1)));
    }

    @Override
    public ProbeResult check(Duration timeout) {
        try (var socket = new Socket()) {
            socket.connect(new InetSocketAddress(host, port), (int) Math.max(1, timeout.toMillis()));
            return ProbeResult.healthy("tcp %s:%d reachable".formatted(host, port));
        } catch (IOException e) {
            return ProbeResult.unhealthy("tcp %s:%d unreachable: %s".formatted(host, port, e.getMessage()));
        }
    }
}
