package com.fleetdeck.fleet;

import com.fleetdeck.core.dispatch.Connection;
import com.fleetdeck.core.dispatch.ConnectionException;
import com.fleetdeck.core.dispatch.ConnectionProvider;
import com.fleetdeck.core.health.HealthProbe;
import com.fleetdeck.core.health.HealthStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Opens connections by shelling out to the OpenSSH client. Direct connections
 * target the node's address; relayed ones target the local tunnel endpoint.
 */
public class SshConnectionProvider implements ConnectionProvider, HealthProbe {

    private static final Logger log = LoggerFactory.getLogger(SshConnectionProvider.class);

    private final FleetProperties.Ssh settings;
    private final ExecutorService streamReaders;

    public SshConnectionProvider(FleetProperties.Ssh settings) {
        this.settings = settings;
        var counter = new AtomicInteger();
        this.streamReaders = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "ssh-stream-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @Override
    public Connection openDirect(String endpoint) {
        return open(endpoint);
    }

    @Override
    public Connection openRelayed(String relayEndpoint) {
        return open(relayEndpoint);
    }

    /** Reports whether the configured ssh client can be started. */
    @Override
    public HealthStatus check() {
        try {
            Process process = new ProcessBuilder(settings.getBinary(), "-V")
                    .redirectErrorStream(true)
                    .start();
            String version = new String(process.getInputStream().readAllBytes()).trim();
            if (!process.waitFor(5, TimeUnit.SECONDS)) {
                process.destroyForcibly();
                return new HealthStatus("ssh", HealthStatus.Status.DEGRADED,
                        "ssh -V did not finish", Map.of());
            }
            return new HealthStatus("ssh", HealthStatus.Status.UP, version, Map.of("binary", settings.getBinary()));
        } catch (IOException e) {
            return new HealthStatus("ssh", HealthStatus.Status.DOWN,
                    "ssh client not available: " + e.getMessage(), Map.of());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return new HealthStatus("ssh", HealthStatus.Status.DOWN, "interrupted", Map.of());
        }
    }

    public void shutdown() {
        streamReaders.shutdownNow();
    }

    List<String> baseCommand(String host, int port) {
        var command = new ArrayList<String>();
        command.add(settings.getBinary());
        command.addAll(List.of(
                "-o", "StrictHostKeyChecking=no",
                "-o", "UserKnownHostsFile=/dev/null",
                "-o", "LogLevel=ERROR",
                "-o", "BatchMode=yes",
                "-o", "ConnectTimeout=" + settings.getConnectTimeoutSeconds(),
                "-p", String.valueOf(port)));
        if (settings.getKeyPath() != null && !settings.getKeyPath().isBlank()) {
            command.add("-i");
            command.add(settings.getKeyPath());
        }
        String user = settings.getUser();
        command.add(user == null || user.isBlank() ? host : user + "@" + host);
        return command;
    }

    private Connection open(String endpoint) {
        int colon = endpoint == null ? -1 : endpoint.lastIndexOf(':');
        if (colon <= 0) {
            throw new ConnectionException("Invalid endpoint: " + endpoint);
        }
        String host = endpoint.substring(0, colon);
        int port;
        try {
            port = Integer.parseInt(endpoint.substring(colon + 1));
        } catch (NumberFormatException e) {
            throw new ConnectionException("Invalid port in endpoint: " + endpoint, e);
        }
        log.debug("Opening ssh connection to {}:{}", host, port);
        return new SshConnection(endpoint, baseCommand(host, port), streamReaders);
    }
}
