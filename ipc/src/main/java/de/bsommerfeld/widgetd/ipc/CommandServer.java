package de.bsommerfeld.widgetd.ipc;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.ListeningExecutorService;
import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.widgetd.core.command.CommandSink;
import de.bsommerfeld.widgetd.core.command.DaemonCommand;
import de.bsommerfeld.widgetd.core.command.DaemonCommand.KillServer;
import de.bsommerfeld.widgetd.core.command.DaemonCommand.Ping;
import de.bsommerfeld.widgetd.core.command.DaemonCommand.PrintState;
import de.bsommerfeld.widgetd.core.command.DaemonCommand.ReloadConfigAndCss;
import de.bsommerfeld.widgetd.core.command.DaemonCommand.UpdateVars;
import de.bsommerfeld.widgetd.core.command.DaemonResponse;
import de.bsommerfeld.widgetd.core.command.QueueClosedException;
import de.bsommerfeld.widgetd.core.command.ResponseChannel;
import de.bsommerfeld.widgetd.core.config.DaemonPaths;
import de.bsommerfeld.widgetd.core.config.DaemonSettings;
import de.bsommerfeld.widgetd.core.lifecycle.SupervisedTask;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Writer;
import java.net.StandardProtocolFamily;
import java.net.UnixDomainSocketAddress;
import java.nio.channels.Channels;
import java.nio.channels.ClosedChannelException;
import java.nio.channels.ServerSocketChannel;
import java.nio.channels.SocketChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;

/**
 * Accepts client connections on a Unix domain socket and turns each request
 * into exactly one {@link DaemonCommand} on the shared queue.
 *
 * <p>
 * Each connection carries one request line and receives one response line.
 * Requests that expect an answer wait for the command's
 * {@link ResponseChannel} up to the configured timeout. Malformed or unknown
 * requests are answered with an error and enqueue nothing.
 */
@Singleton
public class CommandServer implements SupervisedTask {

    private static final Logger LOG = LoggerFactory.getLogger(CommandServer.class);

    private final Path socketFile;
    private final CommandSink sink;
    private final Duration responseTimeout;
    private volatile ServerSocketChannel serverChannel;

    @Inject
    public CommandServer(DaemonPaths paths, DaemonSettings settings, CommandSink sink) {
        this(paths.socketFile(), sink, settings.getResponseTimeout());
    }

    public CommandServer(Path socketFile, CommandSink sink, Duration responseTimeout) {
        this.socketFile = socketFile;
        this.sink = sink;
        this.responseTimeout = responseTimeout;
    }

    @Override
    public String name() {
        return "command-server";
    }

    @Override
    public ListenableFuture<?> start(ListeningExecutorService workers) {
        return workers.submit(() -> {
            serve(workers);
            return null;
        });
    }

    private void serve(ListeningExecutorService workers) throws IOException {
        Files.deleteIfExists(socketFile);
        if (socketFile.getParent() != null) {
            Files.createDirectories(socketFile.getParent());
        }
        try (ServerSocketChannel server = ServerSocketChannel.open(StandardProtocolFamily.UNIX)) {
            server.bind(UnixDomainSocketAddress.of(socketFile));
            serverChannel = server;
            LOG.info("IPC server listening on {}", socketFile);
            while (true) {
                SocketChannel client;
                try {
                    client = server.accept();
                } catch (ClosedChannelException e) {
                    LOG.info("IPC server on {} closed", socketFile);
                    return;
                }
                workers.execute(() -> handleConnection(client));
            }
        } finally {
            Files.deleteIfExists(socketFile);
        }
    }

    /**
     * Stops accepting connections. The task then completes normally.
     */
    public void close() throws IOException {
        ServerSocketChannel server = serverChannel;
        if (server != null) {
            server.close();
        }
    }

    public boolean isListening() {
        ServerSocketChannel server = serverChannel;
        return server != null && server.isOpen();
    }

    private void handleConnection(SocketChannel client) {
        try (client;
             BufferedReader reader = new BufferedReader(Channels.newReader(client, StandardCharsets.UTF_8));
             Writer writer = Channels.newWriter(client, StandardCharsets.UTF_8)) {
            String line = reader.readLine();
            if (line == null) {
                LOG.debug("Client disconnected without a request");
                return;
            }
            IpcResponse response = handleLine(line);
            writer.write(IpcCodec.encode(response));
            writer.write('\n');
            writer.flush();
        } catch (IOException e) {
            LOG.warn("Error while talking to IPC client: {}", e.getMessage());
        }
    }

    IpcResponse handleLine(String line) {
        IpcRequest request;
        try {
            request = IpcCodec.decodeRequest(line);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            LOG.warn("Rejecting malformed IPC request: {}", e.getMessage());
            return IpcResponse.error("Malformed request");
        }
        LOG.debug("Received IPC request {}", request);
        try {
            return dispatch(request);
        } catch (QueueClosedException e) {
            return IpcResponse.error("Daemon is shutting down");
        }
    }

    private IpcResponse dispatch(IpcRequest request) {
        switch (request.action()) {
            case IpcRequest.PING:
                return roundTrip(Ping::new);
            case IpcRequest.RELOAD:
                return roundTrip(ReloadConfigAndCss::new);
            case IpcRequest.STATE:
                return roundTrip(PrintState::new);
            case IpcRequest.UPDATE:
                if (request.vars().isEmpty()) {
                    return IpcResponse.error("No variables given");
                }
                return roundTrip(channel -> new UpdateVars(request.vars(), channel));
            case IpcRequest.KILL:
                sink.send(new KillServer());
                return IpcResponse.ok("Shutting down");
            default:
                return IpcResponse.error("Unknown action: " + request.action());
        }
    }

    private IpcResponse roundTrip(Function<ResponseChannel, DaemonCommand> commandFactory) {
        ResponseChannel channel = ResponseChannel.create();
        sink.send(commandFactory.apply(channel));
        try {
            DaemonResponse response = channel.receiver().get(responseTimeout.toMillis(), TimeUnit.MILLISECONDS);
            return IpcResponse.from(response);
        } catch (TimeoutException e) {
            channel.receiver().cancel(false);
            return IpcResponse.error("Timed out waiting for the daemon");
        } catch (ExecutionException e) {
            return IpcResponse.error("No response from daemon");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            channel.receiver().cancel(false);
            return IpcResponse.error("Interrupted");
        }
    }
}
