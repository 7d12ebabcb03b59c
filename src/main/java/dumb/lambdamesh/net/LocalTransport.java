package dumb.lambdamesh.net;

import com.fasterxml.jackson.core.JsonProcessingException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Consumer;
import java.util.stream.Collectors;

import static java.util.Objects.requireNonNull;

/**
 * In-process transport. Nodes joined to the same {@link Hub} see each other as peers once started.
 * Every message goes through the JSON codec, as it would on a socket.
 */
public class LocalTransport implements Transport {

    private static final Logger logger = LoggerFactory.getLogger(LocalTransport.class);

    private final Hub hub;
    private final String nodeId;
    private volatile Consumer<Message> handler = m -> {
    };
    private volatile boolean running;

    private LocalTransport(Hub hub, String nodeId) {
        this.hub = hub;
        this.nodeId = nodeId;
    }

    @Override
    public void start() {
        running = true;
    }

    @Override
    public void stop() {
        running = false;
        hub.members.remove(nodeId, this);
    }

    @Override
    public void onMessage(Consumer<Message> handler) {
        this.handler = requireNonNull(handler);
    }

    @Override
    public void sendToPeer(String peerId, Message message) {
        var peer = hub.members.get(peerId);
        if (peer == null || !peer.running || peerId.equals(nodeId)) {
            logger.warn("{}: cannot send {} to unknown peer {}", nodeId, message.type(), peerId);
            return;
        }
        String json;
        try {
            json = Message.encode(message);
        } catch (JsonProcessingException e) {
            logger.error("{}: failed to encode {}: {}", nodeId, message.type(), e.getMessage());
            return;
        }
        peer.receive(json);
    }

    @Override
    public void broadcast(Message message) {
        for (var peer : peers()) sendToPeer(peer, message);
    }

    @Override
    public Set<String> peers() {
        return hub.members.values().stream()
                .filter(t -> t.running && !t.nodeId.equals(nodeId))
                .map(t -> t.nodeId)
                .collect(Collectors.toUnmodifiableSet());
    }

    private void receive(String json) {
        try {
            handler.accept(Message.decode(json));
        } catch (JsonProcessingException e) {
            logger.warn("{}: dropped malformed message: {}", nodeId, e.getOriginalMessage());
        }
    }

    public static class Hub {
        private final ConcurrentMap<String, LocalTransport> members = new ConcurrentHashMap<>();

        public LocalTransport join(String nodeId) {
            var t = new LocalTransport(this, requireNonNull(nodeId));
            if (members.putIfAbsent(nodeId, t) != null)
                throw new IllegalArgumentException("Node id already joined: " + nodeId);
            return t;
        }
    }
}
