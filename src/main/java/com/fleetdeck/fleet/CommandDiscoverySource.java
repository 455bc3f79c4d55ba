package com.fleetdeck.fleet;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fleetdeck.core.directory.DiscoveryException;
import com.fleetdeck.core.directory.DiscoverySource;
import com.fleetdeck.core.model.NodeRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * Discovers the fleet by running a shell command that prints a JSON array of
 * nodes, e.g. a cloud CLI query. Each element needs a {@code name}; the
 * optional fields are {@code publicAddress}, {@code privateAddress},
 * {@code region}, {@code relayEligible} (default true) and {@code state}.
 */
public class CommandDiscoverySource implements DiscoverySource {

    private static final Logger log = LoggerFactory.getLogger(CommandDiscoverySource.class);

    private final String command;
    private final Duration timeout;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public CommandDiscoverySource(String command, Duration timeout) {
        if (command == null || command.isBlank()) {
            throw new IllegalArgumentException("fleetdeck.discovery.command must be set for command discovery");
        }
        this.command = command;
        this.timeout = timeout;
    }

    @Override
    public List<NodeRecord> discover() {
        log.debug("Running discovery command: {}", command);
        Process process;
        try {
            process = new ProcessBuilder("sh", "-c", command)
                    .redirectError(ProcessBuilder.Redirect.DISCARD)
                    .start();
        } catch (IOException e) {
            throw new DiscoveryException("Could not start discovery command: " + e.getMessage(), e);
        }

        try {
            CompletableFuture<String> stdout = CompletableFuture.supplyAsync(() -> readAll(process.getInputStream()));
            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                throw new DiscoveryException("Discovery command timed out after " + timeout.toSeconds() + "s");
            }
            if (process.exitValue() != 0) {
                throw new DiscoveryException("Discovery command exited with " + process.exitValue());
            }
            return parse(stdout.join());
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            throw new DiscoveryException("Interrupted running discovery command", e);
        }
    }

    List<NodeRecord> parse(String json) {
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new DiscoveryException("Discovery output is not valid JSON: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isArray()) {
            throw new DiscoveryException("Discovery output must be a JSON array");
        }
        var nodes = new ArrayList<NodeRecord>();
        for (JsonNode node : root) {
            String name = text(node, "name");
            if (name == null) {
                log.warn("Skipping discovered node without a name: {}", node);
                continue;
            }
            nodes.add(new NodeRecord(name,
                    text(node, "publicAddress"),
                    text(node, "privateAddress"),
                    node.path("region").asText(""),
                    node.path("relayEligible").asBoolean(true),
                    NodeStates.parse(text(node, "state"))));
        }
        return nodes;
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull() || value.asText().isBlank()) {
            return null;
        }
        return value.asText();
    }

    private static String readAll(InputStream in) {
        try (in) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new DiscoveryException("Could not read discovery output: " + e.getMessage(), e);
        }
    }
}
