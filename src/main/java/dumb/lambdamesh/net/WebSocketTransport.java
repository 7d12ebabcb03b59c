package dumb.lambdamesh.net;

import com.fasterxml.jackson.core.JsonProcessingException;
import org.java_websocket.WebSocket;
import org.java_websocket.client.WebSocketClient;
import org.java_websocket.exceptions.WebsocketNotConnectedException;
import org.java_websocket.handshake.ClientHandshake;
import org.java_websocket.handshake.ServerHandshake;
import org.java_websocket.server.WebSocketServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

import static java.util.Objects.requireNonNull;

/**
 * WebSocket transport: one server socket for inbound peers plus one client connection per configured
 * peer address. Each side announces itself with an {@link Message.Identity} before anything else.
 */
public class WebSocketTransport implements Transport {

    private static final Logger logger = LoggerFactory.getLogger(WebSocketTransport.class);
    private static final long START_TIMEOUT_SECONDS = 5;
    private static final int STOP_TIMEOUT_MILLIS = 1000;

    private final String nodeId;
    private final InetSocketAddress address;
    private final List<String> peerAddresses;
    private final ConcurrentMap<String, WebSocket> connections = new ConcurrentHashMap<>();
    private final ConcurrentMap<WebSocket, String> names = new ConcurrentHashMap<>();
    private final List<WebSocketClient> clients = new CopyOnWriteArrayList<>();
    private final CountDownLatch started = new CountDownLatch(1);
    private volatile Consumer<Message> handler = m -> {
    };
    private WebSocketServer server;

    public WebSocketTransport(String nodeId, InetSocketAddress address, Collection<String> peerAddresses) {
        this.nodeId = requireNonNull(nodeId);
        this.address = requireNonNull(address);
        this.peerAddresses = List.copyOf(peerAddresses);
    }

    @Override
    public void start() throws IOException {
        server = new WebSocketServer(address) {
            @Override
            public void onOpen(WebSocket conn, ClientHandshake handshake) {
                logger.debug("{}: inbound connection from {}", nodeId, conn.getRemoteSocketAddress());
            }

            @Override
            public void onClose(WebSocket conn, int code, String reason, boolean remote) {
                forget(conn);
            }

            @Override
            public void onMessage(WebSocket conn, String message) {
                received(conn, message, true);
            }

            @Override
            public void onError(WebSocket conn, Exception ex) {
                logger.error("{}: websocket server error ({}): {}", nodeId,
                        conn != null ? conn.getRemoteSocketAddress() : "server", ex.getMessage());
                if (conn != null) forget(conn);
            }

            @Override
            public void onStart() {
                logger.info("{}: listening on port {}", nodeId, getPort());
                started.countDown();
            }
        };
        server.setReuseAddr(true);
        server.start();
        try {
            if (!started.await(START_TIMEOUT_SECONDS, TimeUnit.SECONDS))
                throw new IOException("WebSocket server did not start on " + address);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IOException("Interrupted while starting WebSocket server", e);
        }
        for (var peer : peerAddresses) connect(peer);
    }

    /** Opens an outbound connection to {@code host:port}. */
    public void connect(String hostPort) {
        URI uri;
        try {
            uri = new URI("ws://" + hostPort);
        } catch (URISyntaxException e) {
            logger.error("{}: invalid peer address {}: {}", nodeId, hostPort, e.getMessage());
            return;
        }
        var client = new WebSocketClient(uri) {
            @Override
            public void onOpen(ServerHandshake handshake) {
                deliver(this, identity());
            }

            @Override
            public void onMessage(String message) {
                received(this, message, false);
            }

            @Override
            public void onClose(int code, String reason, boolean remote) {
                forget(this);
            }

            @Override
            public void onError(Exception ex) {
                logger.warn("{}: connection to {} failed: {}", nodeId, hostPort, ex.getMessage());
            }
        };
        clients.add(client);
        client.connect();
    }

    /** Actual listening port, once started. */
    public int port() {
        return server != null ? server.getPort() : address.getPort();
    }

    @Override
    public void stop() {
        for (var c : clients) c.close();
        clients.clear();
        if (server != null) {
            try {
                server.stop(STOP_TIMEOUT_MILLIS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                logger.error("{}: interrupted stopping websocket server", nodeId);
            }
        }
        connections.clear();
        names.clear();
    }

    @Override
    public void onMessage(Consumer<Message> handler) {
        this.handler = requireNonNull(handler);
    }

    @Override
    public void sendToPeer(String peerId, Message message) {
        var conn = connections.get(peerId);
        if (conn == null) {
            logger.warn("{}: no connection to peer {}", nodeId, peerId);
            return;
        }
        deliver(conn, message);
    }

    @Override
    public void broadcast(Message message) {
        connections.values().forEach(conn -> deliver(conn, message));
    }

    @Override
    public Set<String> peers() {
        return Set.copyOf(connections.keySet());
    }

    private Message identity() {
        return new Message.Identity(nodeId, System.currentTimeMillis(), port());
    }

    private void received(WebSocket conn, String text, boolean inbound) {
        Message m;
        try {
            m = Message.decode(text);
        } catch (JsonProcessingException e) {
            logger.warn("{}: dropped malformed message from {}: {}", nodeId, conn.getRemoteSocketAddress(), e.getOriginalMessage());
            return;
        }
        var fresh = register(m.senderId(), conn);
        if (m instanceof Message.Identity && fresh && inbound) deliver(conn, identity());
        handler.accept(m);
    }

    /** True if this connection was not yet known under that peer id. */
    private boolean register(String peerId, WebSocket conn) {
        if (peerId.equals(nodeId)) return false;
        var previous = connections.put(peerId, conn);
        names.put(conn, peerId);
        if (previous != conn) logger.info("{}: peer {} connected", nodeId, peerId);
        return previous != conn;
    }

    private void forget(WebSocket conn) {
        var peerId = names.remove(conn);
        if (peerId != null && connections.remove(peerId, conn)) logger.info("{}: peer {} disconnected", nodeId, peerId);
    }

    private void deliver(WebSocket conn, Message message) {
        try {
            conn.send(Message.encode(message));
        } catch (WebsocketNotConnectedException e) {
            logger.warn("{}: {} not delivered, connection closed", nodeId, message.type());
            forget(conn);
        } catch (JsonProcessingException e) {
            logger.error("{}: failed to encode {}: {}", nodeId, message.type(), e.getMessage());
        }
    }
}
