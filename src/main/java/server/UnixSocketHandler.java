package server;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.StandardProtocolFamily;
import java.net.UnixDomainSocketAddress;
import java.nio.channels.Channels;
import java.nio.channels.ServerSocketChannel;
import java.nio.channels.SocketChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/** Accepts the single client connection on the configured Unix domain socket. */
@Slf4j
@Component
public class UnixSocketHandler {
    private final Path socketPath;
    private final CountDownLatch connected = new CountDownLatch(1);
    private ServerSocketChannel serverChannel;
    private volatile SocketChannel clientChannel;

    public UnixSocketHandler(StemdeckProperties properties) {
        this.socketPath = Path.of(properties.socketPath());
    }

    public Path getSocketPath() {
        return socketPath;
    }

    public void createUnixSocket() throws IOException {
        // A socket file left over from a previous run blocks bind
        if (Files.exists(socketPath)) {
            Files.delete(socketPath);
            log.info("Removed existing socket at {}", socketPath);
        }

        serverChannel = ServerSocketChannel.open(StandardProtocolFamily.UNIX);
        serverChannel.bind(UnixDomainSocketAddress.of(socketPath));
        log.info("Created Unix domain socket at {}", socketPath);

        Thread acceptor =
                new Thread(
                        () -> {
                            try {
                                clientChannel = serverChannel.accept();
                                log.info("Client connected to {}", socketPath);
                                connected.countDown();
                            } catch (IOException e) {
                                log.error("Error accepting Unix socket connection", e);
                            }
                        },
                        "SocketAcceptor");
        acceptor.setDaemon(true);
        acceptor.start();
    }

    /** Blocks until a client connected or the timeout elapsed. */
    public boolean awaitClient(long timeout, TimeUnit unit) throws InterruptedException {
        return connected.await(timeout, unit);
    }

    public InputStream getInputStream() throws IOException {
        return Channels.newInputStream(requireClient());
    }

    public OutputStream getOutputStream() throws IOException {
        return Channels.newOutputStream(requireClient());
    }

    public boolean isClientConnected() {
        SocketChannel client = clientChannel;
        return client != null && client.isOpen();
    }

    private SocketChannel requireClient() throws IOException {
        SocketChannel client = clientChannel;
        if (client == null) {
            throw new IOException("No client connected to " + socketPath);
        }
        return client;
    }

    public void cleanup() {
        try {
            if (clientChannel != null) {
                clientChannel.close();
            }
            if (serverChannel != null) {
                serverChannel.close();
            }
            Files.deleteIfExists(socketPath);
            log.info("Cleaned up Unix socket at {}", socketPath);
        } catch (IOException e) {
            log.error("Error cleaning up Unix socket", e);
        }
    }
}
