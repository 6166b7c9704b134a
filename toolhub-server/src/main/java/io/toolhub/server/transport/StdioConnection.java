package io.toolhub.server.transport;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.jboss.logging.Logger;

/// Tool-server handle over the standard streams of a child process.
///
/// The definition's endpoint is the command line, split on whitespace. Messages are
/// newline-delimited JSON on stdin/stdout; stderr is forwarded to the debug log.
/// Closing the handle terminates the process.
///
/// @implNote Thread-safe. One daemon thread reads stdout, one reads stderr; writes are
/// serialized on the writer.
public class StdioConnection extends JsonRpcConnection {

    private static final Logger LOG = Logger.getLogger(StdioConnection.class);

    private static final long TERMINATE_GRACE_MS = 2000;

    private final Process process;
    private final BufferedWriter writer;
    private final PendingRequests pending = new PendingRequests();
    private final AtomicBoolean closed = new AtomicBoolean();

    private StdioConnection(String endpoint, Process process, JsonRpc jsonRpc, Duration timeout) {
        super(endpoint, jsonRpc, timeout);
        this.process = process;
        this.writer =
                new BufferedWriter(
                        new OutputStreamWriter(process.getOutputStream(), StandardCharsets.UTF_8));
    }

    /// Launches the process and performs the handshake.
    ///
    /// @param commandLine command and arguments separated by whitespace
    /// @param jsonRpc JSON-RPC framing
    /// @param timeout per-request bound
    /// @return connected handle
    /// @throws ToolServerException if the process cannot start or the handshake fails
    public static StdioConnection open(String commandLine, JsonRpc jsonRpc, Duration timeout)
            throws ToolServerException {
        List<String> command = parseCommand(commandLine);
        if (command.isEmpty()) {
            throw new ToolServerException("Empty stdio command line");
        }

        Process process;
        try {
            process = new ProcessBuilder(command).start();
        } catch (IOException e) {
            throw ToolServerException.connectionFailed(commandLine, e);
        }

        StdioConnection connection = new StdioConnection(commandLine, process, jsonRpc, timeout);
        connection.startReaders();
        try {
            connection.initialize();
        } catch (ToolServerException e) {
            connection.close();
            throw e;
        }
        return connection;
    }

    static List<String> parseCommand(String commandLine) {
        if (commandLine == null || commandLine.isBlank()) {
            return List.of();
        }
        return Arrays.asList(commandLine.trim().split("\\s+"));
    }

    @Override
    protected String exchange(String id, String method, String requestJson)
            throws ToolServerException {
        CompletableFuture<String> response = pending.register(id);
        try {
            send(requestJson);
        } catch (ToolServerException e) {
            pending.forget(id);
            throw e;
        }
        return pending.await(id, response, method, timeout);
    }

    @Override
    protected void send(String json) throws ToolServerException {
        if (!isConnected()) {
            throw new ToolServerException("Process not running: " + endpoint);
        }
        synchronized (writer) {
            try {
                writer.write(json);
                writer.newLine();
                writer.flush();
            } catch (IOException e) {
                throw new ToolServerException("Write to " + endpoint + " failed", e);
            }
        }
    }

    @Override
    public boolean isConnected() {
        return !closed.get() && process.isAlive();
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        pending.failAll(new ToolServerException("Connection closed: " + endpoint));
        try {
            writer.close();
        } catch (IOException e) {
            LOG.debugv("Closing stdin of {0} failed: {1}", endpoint, e.getMessage());
        }
        process.destroy();
        try {
            if (!process.waitFor(TERMINATE_GRACE_MS, TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
        }
        ended("closed");
    }

    private void startReaders() {
        Thread stdout = new Thread(this::readStdout, "toolhub-stdio-out-" + process.pid());
        stdout.setDaemon(true);
        stdout.start();

        Thread stderr = new Thread(this::readStderr, "toolhub-stdio-err-" + process.pid());
        stderr.setDaemon(true);
        stderr.start();
    }

    private void readStdout() {
        try (BufferedReader reader = reader(process.getInputStream())) {
            String line;
            while ((line = reader.readLine()) != null) {
                if (!line.isBlank()) {
                    dispatch(line, pending);
                }
            }
        } catch (IOException e) {
            if (!closed.get()) {
                LOG.warnv("Reading from {0} failed: {1}", endpoint, e.getMessage());
            }
        }
        if (!closed.get()) {
            LOG.infov("Process {0} exited", endpoint);
            pending.failAll(new ToolServerException("Process exited: " + endpoint));
            ended("process exited");
        }
    }

    private void readStderr() {
        try (BufferedReader reader = reader(process.getErrorStream())) {
            String line;
            while ((line = reader.readLine()) != null) {
                LOG.debugv("[{0}] {1}", endpoint, line);
            }
        } catch (IOException e) {
            LOG.tracev("stderr of {0} closed: {1}", endpoint, e.getMessage());
        }
    }

    private static BufferedReader reader(InputStream stream) {
        return new BufferedReader(new InputStreamReader(stream, StandardCharsets.UTF_8));
    }
}
