package dumb.lambdamesh.net;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LocalTransportTest {

    @Test
    void startedMembersSeeEachOther() {
        var hub = new LocalTransport.Hub();
        var a = hub.join("a");
        var b = hub.join("b");
        var c = hub.join("c");
        a.start();
        b.start();
        assertEquals(Set.of("b"), a.peers());
        assertEquals(Set.of("a"), b.peers());
        assertTrue(c.peers().containsAll(Set.of("a", "b")));

        b.stop();
        assertEquals(Set.of(), a.peers());
        assertEquals(0, a.peerCount());
    }

    @Test
    void deliversThroughTheCodec() {
        var hub = new LocalTransport.Hub();
        var a = hub.join("a");
        var b = hub.join("b");
        var inboxB = new CopyOnWriteArrayList<Message>();
        b.onMessage(inboxB::add);
        a.start();
        b.start();

        var ping = new Message.Ping("a", 1);
        a.sendToPeer("b", ping);
        a.broadcast(new Message.Pong("a", 2));
        a.sendToPeer("nobody", ping);

        assertEquals(2, inboxB.size());
        assertEquals(ping, inboxB.get(0));
        assertInstanceOf(Message.Pong.class, inboxB.get(1));
    }

    @Test
    void broadcastSkipsSender() {
        var hub = new LocalTransport.Hub();
        var a = hub.join("a");
        var seen = new CopyOnWriteArrayList<Message>();
        a.onMessage(seen::add);
        a.start();
        a.broadcast(new Message.Ping("a", 1));
        assertEquals(List.of(), seen);
    }

    @Test
    void nodeIdsAreUnique() {
        var hub = new LocalTransport.Hub();
        hub.join("a");
        assertThrows(IllegalArgumentException.class, () -> hub.join("a"));
    }
}
