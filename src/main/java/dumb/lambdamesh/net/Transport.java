package dumb.lambdamesh.net;

import java.io.IOException;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Message delivery between nodes. Implementations report failures by logging; a failed send simply
 * means that peer's reply never arrives.
 */
public interface Transport {

    /** No peers: every verification resolves from the local vote alone. */
    Transport NONE = new Transport() {
        @Override
        public void start() {
        }

        @Override
        public void stop() {
        }

        @Override
        public void onMessage(Consumer<Message> handler) {
        }

        @Override
        public void sendToPeer(String peerId, Message message) {
        }

        @Override
        public void broadcast(Message message) {
        }

        @Override
        public Set<String> peers() {
            return Set.of();
        }

        @Override
        public String toString() {
            return "Transport.NONE";
        }
    };

    void start() throws IOException;

    void stop();

    /** Replaces the receiver of incoming messages. */
    void onMessage(Consumer<Message> handler);

    void sendToPeer(String peerId, Message message);

    void broadcast(Message message);

    Set<String> peers();

    default int peerCount() {
        return peers().size();
    }
}
