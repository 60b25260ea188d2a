package server;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.net.SocketException;
import java.util.concurrent.ExecutionException;
import lombok.extern.slf4j.Slf4j;
import org.eclipse.lsp4j.jsonrpc.Launcher;
import org.springframework.stereotype.Component;
import server.rpc.ClientApi;
import server.rpc.ClientGateway;
import server.rpc.RemoteControlService;

/**
 * Accepts remote-control clients on a TCP socket, one at a time. Each connection gets its own
 * JSON-RPC launcher; player notifications go to whichever client is currently connected.
 */
@Slf4j
@Component
public class RemoteSocketHandler {
    private final RemoteControlService rpc;
    private final ClientGateway gateway;
    private volatile ServerSocket serverSocket;

    public RemoteSocketHandler(RemoteControlService rpc, ClientGateway gateway) {
        this.rpc = rpc;
        this.gateway = gateway;
    }

    public void bind(String host, int port) throws IOException {
        ServerSocket socket = new ServerSocket();
        socket.setReuseAddress(true);
        socket.bind(new InetSocketAddress(host, port));
        serverSocket = socket;
        log.info("Remote control listening on {}:{}", host, socket.getLocalPort());
    }

    public int getLocalPort() {
        ServerSocket socket = serverSocket;
        return socket == null ? -1 : socket.getLocalPort();
    }

    /** Serves clients until {@link #close()} is called. */
    public void serve() throws InterruptedException {
        ServerSocket socket = serverSocket;
        if (socket == null) {
            throw new IllegalStateException("Remote socket is not bound");
        }
        while (!socket.isClosed()) {
            try (Socket client = socket.accept()) {
                log.info("Remote client connected from {}", client.getRemoteSocketAddress());
                handle(client);
            } catch (SocketException e) {
                if (!socket.isClosed()) {
                    log.warn("Remote connection failed", e);
                }
            } catch (IOException e) {
                log.warn("Remote connection failed", e);
            }
        }
    }

    private void handle(Socket client) throws IOException, InterruptedException {
        Launcher<ClientApi> launcher =
                new Launcher.Builder<ClientApi>()
                        .setLocalService(rpc)
                        .setRemoteInterface(ClientApi.class)
                        .setInput(client.getInputStream())
                        .setOutput(client.getOutputStream())
                        .create();
        gateway.setClient(launcher.getRemoteProxy());
        try {
            launcher.startListening().get();
        } catch (ExecutionException e) {
            log.warn("Remote session ended with an error", e.getCause());
        } finally {
            gateway.setClient(null);
            log.info("Remote client disconnected");
        }
    }

    public void close() {
        ServerSocket socket = serverSocket;
        if (socket == null) {
            return;
        }
        try {
            socket.close();
        } catch (IOException e) {
            log.warn("Error closing remote socket", e);
        }
    }
}
