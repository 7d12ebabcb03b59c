package dumb.lambdamesh.net;

import dumb.lambdamesh.LambdaExpression;
import dumb.lambdamesh.Vote;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.BiFunction;
import java.util.function.Consumer;

/**
 * Fake peers answering every verification request synchronously with canned votes. A peer whose
 * script returns null stays silent.
 */
public class ScriptedTransport implements Transport {

    private final Map<String, BiFunction<String, LambdaExpression, Vote>> peers = new LinkedHashMap<>();
    public final List<Message> sent = new CopyOnWriteArrayList<>();
    private volatile Consumer<Message> handler = m -> {
    };

    public ScriptedTransport peer(String peerId, BiFunction<String, LambdaExpression, Vote> script) {
        peers.put(peerId, script);
        return this;
    }

    @Override
    public void start() {
    }

    @Override
    public void stop() {
    }

    @Override
    public void onMessage(Consumer<Message> handler) {
        this.handler = handler;
    }

    @Override
    public void sendToPeer(String peerId, Message message) {
        sent.add(message);
    }

    @Override
    public void broadcast(Message message) {
        sent.add(message);
        if (!(message instanceof Message.VerifyRequest req)) return;
        peers.forEach((peerId, script) -> {
            var vote = script.apply(req.requestId(), req.expr());
            if (vote != null)
                handler.accept(new Message.VerifyVote(peerId, System.currentTimeMillis(), req.requestId(), vote));
        });
    }

    @Override
    public Set<String> peers() {
        return Set.copyOf(peers.keySet());
    }
}
