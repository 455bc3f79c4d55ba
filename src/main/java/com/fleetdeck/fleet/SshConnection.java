package com.fleetdeck.fleet;

import com.fleetdeck.core.dispatch.Connection;
import com.fleetdeck.core.dispatch.ConnectionException;
import com.fleetdeck.core.model.CommandOutput;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;

/**
 * One ssh invocation per {@link #execute} call. Exit status 255 is ssh's own
 * failure code and is reported as a connection failure; any other status is
 * the remote command's.
 */
class SshConnection implements Connection {

    private static final Logger log = LoggerFactory.getLogger(SshConnection.class);

    static final int SSH_FAILURE_EXIT = 255;

    private final String endpoint;
    private final List<String> baseCommand;
    private final ExecutorService streamReaders;
    private volatile Process current;
    private volatile boolean closed;

    SshConnection(String endpoint, List<String> baseCommand, ExecutorService streamReaders) {
        this.endpoint = endpoint;
        this.baseCommand = baseCommand;
        this.streamReaders = streamReaders;
    }

    @Override
    public CommandOutput execute(String command) {
        if (closed) {
            throw new ConnectionException("Connection to " + endpoint + " is closed");
        }
        var fullCommand = new ArrayList<>(baseCommand);
        fullCommand.add(command);

        Process process;
        try {
            process = new ProcessBuilder(fullCommand).start();
        } catch (IOException e) {
            throw new ConnectionException("Could not start ssh for " + endpoint + ": " + e.getMessage(), e);
        }
        current = process;
        closeStdin(process);

        // Streams are drained off-thread so waitFor stays interruptible
        CompletableFuture<String> stdout = CompletableFuture.supplyAsync(() -> readAll(process.getInputStream()), streamReaders);
        CompletableFuture<String> stderr = CompletableFuture.supplyAsync(() -> readAll(process.getErrorStream()), streamReaders);
        try {
            int exitCode = process.waitFor();
            String out = stdout.join();
            String err = stderr.join();
            if (exitCode == SSH_FAILURE_EXIT) {
                throw new ConnectionException("ssh to " + endpoint + " failed: "
                        + (err.isBlank() ? "exit code 255" : err.strip()));
            }
            return new CommandOutput(exitCode, out, err);
        } catch (CompletionException e) {
            throw new ConnectionException("Lost output from " + endpoint + ": " + e.getCause().getMessage(), e);
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            throw new ConnectionException("Interrupted running command on " + endpoint, e);
        } finally {
            current = null;
        }
    }

    @Override
    public void close() {
        closed = true;
        Process running = current;
        if (running != null && running.isAlive()) {
            log.debug("Killing ssh process for {}", endpoint);
            running.destroyForcibly();
        }
    }

    private void closeStdin(Process process) {
        try {
            process.getOutputStream().close();
        } catch (IOException e) {
            log.debug("Could not close ssh stdin for {}: {}", endpoint, e.getMessage());
        }
    }

    private static String readAll(InputStream in) {
        try (in) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
