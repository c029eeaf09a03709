package de.bsommerfeld.widgetd.ipc;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Writer;
import java.net.StandardProtocolFamily;
import java.net.UnixDomainSocketAddress;
import java.nio.channels.Channels;
import java.nio.channels.SocketChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;

/**
 * Sends a single request to a running daemon and reads its answer.
 */
public class IpcClient {

    private final Path socketFile;

    public IpcClient(Path socketFile) {
        this.socketFile = socketFile;
    }

    public IpcResponse send(IpcRequest request) throws IOException {
        try (SocketChannel channel = SocketChannel.open(StandardProtocolFamily.UNIX)) {
            channel.connect(UnixDomainSocketAddress.of(socketFile));
            Writer writer = Channels.newWriter(channel, StandardCharsets.UTF_8);
            writer.write(IpcCodec.encode(request));
            writer.write('\n');
            writer.flush();

            BufferedReader reader = new BufferedReader(Channels.newReader(channel, StandardCharsets.UTF_8));
            String line = reader.readLine();
            if (line == null) {
                throw new IOException("Daemon closed the connection without answering");
            }
            return IpcCodec.decodeResponse(line);
        }
    }

    public Path getSocketFile() {
        return socketFile;
    }
}
