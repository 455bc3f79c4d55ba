package com.fleetdeck.fleet;

import com.fleetdeck.core.model.RelayScope;
import com.fleetdeck.core.tunnel.RelayCapability;
import com.fleetdeck.core.tunnel.TunnelException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Opens relay tunnels by launching an external tunnel command, one process per
 * tunnel, listening on a free local port. The command template is filled in
 * per tunnel; the tunnel counts as up once its local port accepts connections.
 */
public class ProcessRelayCapability implements RelayCapability {

    private static final Logger log = LoggerFactory.getLogger(ProcessRelayCapability.class);

    static final String LOCALHOST = "127.0.0.1";
    private static final long POLL_INTERVAL_MS = 200;

    private final String commandTemplate;
    private final Duration readyTimeout;
    private final ConcurrentHashMap<String, Process> tunnels = new ConcurrentHashMap<>();

    public ProcessRelayCapability(String commandTemplate, Duration readyTimeout) {
        this.commandTemplate = commandTemplate;
        this.readyTimeout = readyTimeout;
    }

    @Override
    public String createRelay(String nodeId, RelayScope scope) {
        int port = freePort();
        List<String> command = render(nodeId, scope, port);
        log.debug("Starting relay tunnel: {}", String.join(" ", command));

        Process process;
        try {
            process = new ProcessBuilder(command)
                    .redirectErrorStream(true)
                    .redirectOutput(ProcessBuilder.Redirect.DISCARD)
                    .start();
        } catch (IOException e) {
            throw new TunnelException("Could not start relay command for " + nodeId + ": " + e.getMessage(), e);
        }

        String endpoint = LOCALHOST + ":" + port;
        long deadline = System.nanoTime() + readyTimeout.toNanos();
        try {
            while (!accepts(port)) {
                if (!process.isAlive()) {
                    throw new TunnelException("Relay command for " + nodeId + " via " + scope
                            + " exited with code " + process.exitValue());
                }
                if (System.nanoTime() > deadline) {
                    process.destroyForcibly();
                    throw new TunnelException("Relay tunnel for " + nodeId + " not listening after "
                            + readyTimeout.toSeconds() + "s");
                }
                Thread.sleep(POLL_INTERVAL_MS);
            }
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            throw new TunnelException("Interrupted starting relay tunnel for " + nodeId, e);
        }

        tunnels.put(endpoint, process);
        log.info("Relay tunnel for {} via {} listening on {}", nodeId, scope, endpoint);
        return endpoint;
    }

    @Override
    public void destroyRelay(String endpoint) {
        Process process = tunnels.remove(endpoint);
        if (process != null && process.isAlive()) {
            log.debug("Stopping relay tunnel {}", endpoint);
            process.destroy();
        }
    }

    @Override
    public boolean isAlive(String endpoint) {
        Process process = tunnels.get(endpoint);
        return process != null && process.isAlive();
    }

    List<String> render(String nodeId, RelayScope scope, int port) {
        return Arrays.stream(commandTemplate.trim().split("\\s+"))
                .map(token -> token
                        .replace("{relay}", scope.relayName())
                        .replace("{region}", scope.region() == null ? "" : scope.region())
                        .replace("{node}", nodeId)
                        .replace("{port}", String.valueOf(port)))
                .toList();
    }

    private static boolean accepts(int port) {
        try (var socket = new Socket()) {
            socket.connect(new InetSocketAddress(LOCALHOST, port), (int) POLL_INTERVAL_MS);
            return true;
        } catch (IOException e) {
            return false;
        }
    }

    private static int freePort() {
        try (var socket = new ServerSocket(0, 1, InetAddress.getByName(LOCALHOST))) {
            socket.setReuseAddress(true);
            return socket.getLocalPort();
        } catch (IOException e) {
            throw new TunnelException("No free local port for relay tunnel", e);
        }
    }
}
