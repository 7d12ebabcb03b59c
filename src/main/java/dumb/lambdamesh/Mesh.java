package dumb.lambdamesh;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import dumb.lambdamesh.LambdaExpression.Metadata;
import dumb.lambdamesh.VerifyResponse.ConsensusInfo;
import dumb.lambdamesh.net.Message;
import dumb.lambdamesh.net.Transport;
import dumb.lambdamesh.net.WebSocketTransport;
import dumb.lambdamesh.semantic.BetaReduction;
import dumb.lambdamesh.semantic.DefinitionExpansion;
import dumb.lambdamesh.semantic.HypothesisEngine;
import dumb.lambdamesh.semantic.PurityChecker;
import dumb.lambdamesh.semantic.SemanticEquivalence;
import dumb.lambdamesh.store.FileStorage;
import dumb.lambdamesh.store.MemoryStorage;
import dumb.lambdamesh.store.Storage;
import dumb.lambdamesh.util.Json;
import org.jetbrains.annotations.Nullable;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.BooleanSupplier;

import static dumb.lambdamesh.util.Log.debug;
import static dumb.lambdamesh.util.Log.error;
import static dumb.lambdamesh.util.Log.message;
import static dumb.lambdamesh.util.Log.warning;
import static java.util.Objects.requireNonNull;

/**
 * One node of the verification network. Owns a registry, the equivalence engines and a consensus
 * coordinator; talks to peers through the injected {@link Transport} and persists accepted morphisms
 * through the injected {@link Storage}.
 */
public class Mesh {

    public static final int DEFAULT_PORT = 7070;
    private static final int EXECUTOR_SHUTDOWN_TIMEOUT_SECONDS = 2;
    static final String TOO_DEEP = "Expression too deep to verify";

    private static final AtomicLong id = new AtomicLong(0);

    public final String nodeId;
    public final Configuration config;
    public final MorphismRegistry registry;
    public final Events events;
    final Transport transport;
    final Storage storage;
    final SemanticEquivalence semantic;
    final HypothesisEngine hypotheses;
    final Consensus consensus;

    private final ExecutorService exe;
    private final BlockingQueue<Message> inbox = new LinkedBlockingQueue<>();
    private final AtomicBoolean running = new AtomicBoolean();
    private final AtomicLong verifications = new AtomicLong();
    private final Set<String> pendingSync = ConcurrentHashMap.newKeySet();
    private final BooleanSupplier cancelled;
    private volatile boolean stopped;
    private volatile long startedAt;
    private Thread receiver;

    public Mesh(Configuration config, Transport transport, Storage storage) {
        this.config = requireNonNull(config);
        this.nodeId = config.nodeId();
        this.transport = requireNonNull(transport);
        this.storage = requireNonNull(storage);
        this.registry = new MorphismRegistry();
        this.exe = Executors.newCachedThreadPool(daemon(nodeId + "-worker-"));
        this.events = new Events(Executors.newSingleThreadExecutor(daemon(nodeId + "-events-")));
        this.semantic = new SemanticEquivalence(registry, new DefinitionExpansion(config.expansionDepth()),
                new BetaReduction(config.reductionStepLimit()));
        this.hypotheses = new HypothesisEngine(registry, semantic, config.hypothesisThreshold());
        this.consensus = new Consensus(nodeId, registry, semantic, hypotheses, transport,
                config.consensusThreshold(), config.consensusTimeoutMillis());
        this.cancelled = () -> stopped;
    }

    /** A node with no peers and in-memory storage. */
    public static Mesh solo(Configuration config) {
        return new Mesh(config, Transport.NONE, new MemoryStorage());
    }

    public static String id(String prefix) {
        return prefix + id.incrementAndGet();
    }

    private static ThreadFactory daemon(String prefix) {
        var n = new AtomicInteger();
        return r -> {
            var t = new Thread(r, prefix + n.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    public static void main(String[] args) {
        var config = new Configuration();
        String configFile = null;
        var peers = new ArrayList<String>();
        String nodeId = null, storageDir = null;
        Integer port = null;
        Boolean seeds = null;

        for (var i = 0; i < args.length; i++) {
            try {
                switch (args[i]) {
                    case "-c", "--config" -> configFile = args[++i];
                    case "-n", "--node" -> nodeId = args[++i];
                    case "-p", "--port" -> port = Integer.parseInt(args[++i]);
                    case "--peer" -> peers.add(args[++i]);
                    case "-s", "--storage" -> storageDir = args[++i];
                    case "--no-seeds" -> seeds = false;
                    default -> warning("Unknown option: " + args[i]);
                }
            } catch (ArrayIndexOutOfBoundsException | NumberFormatException e) {
                error(String.format("Error parsing argument for %s: %s", (i > 0 ? args[i - 1] : args[i]), e.getMessage()));
                printUsageAndExit();
            }
        }

        try {
            if (configFile != null) config = Configuration.load(Path.of(configFile));
            if (nodeId != null) config = config.withNodeId(nodeId);
            if (port != null) config = config.withPort(port);
            if (!peers.isEmpty()) config = config.withPeers(peers);
            if (storageDir != null) config = config.withStorageDir(storageDir);
            if (seeds != null) config = config.withLoadSeeds(seeds);

            var transport = new WebSocketTransport(config.nodeId(), new InetSocketAddress(config.port()), config.peers());
            Storage storage = config.storageDir() != null ? new FileStorage(Path.of(config.storageDir())) : new MemoryStorage();
            var mesh = new Mesh(config, transport, storage);
            mesh.start();
            Runtime.getRuntime().addShutdownHook(new Thread(mesh::stop, "mesh-shutdown"));

            var in = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
            String line;
            while ((line = in.readLine()) != null) {
                var text = line.strip();
                if (text.isEmpty()) continue;
                switch (text) {
                    case ":status" -> System.out.println(Json.pretty(mesh.status()));
                    case ":list" -> mesh.listMorphisms().forEach(System.out::println);
                    case ":quit" -> {
                        mesh.stop();
                        return;
                    }
                    default -> System.out.println(Json.pretty(mesh.verify(text, null)));
                }
            }
            Thread.currentThread().join();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            error("Main thread interrupted.");
        } catch (Exception e) {
            error("Initialization/Startup failed: " + e.getMessage(), e);
            System.exit(1);
        }
    }

    private static void printUsageAndExit() {
        System.err.printf("Usage: java %s [-c config.json] [-n nodeId] [-p port] [--peer host:port]... [-s storageDir] [--no-seeds]%n",
                Mesh.class.getName());
        System.err.println("Then one expression per line on stdin; ':status', ':list' and ':quit' are commands.");
        System.exit(1);
    }

    private static void shutdownExecutor(ExecutorService executor, String name) {
        if (executor == null || executor.isShutdown()) return;
        executor.shutdownNow();
        try {
            if (!executor.awaitTermination(EXECUTOR_SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS))
                error(name + " did not terminate after forced shutdown.");
        } catch (InterruptedException e) {
            error("Interrupted while waiting for " + name + " shutdown.");
            Thread.currentThread().interrupt();
        }
    }

    public synchronized void start() throws IOException {
        if (!running.compareAndSet(false, true)) return;
        startedAt = System.currentTimeMillis();
        if (config.loadSeeds()) registry.loadSeeds();
        loadStored();

        transport.onMessage(inbox::offer);
        transport.start();
        receiver = new Thread(this::receiveLoop, nodeId + "-receiver");
        receiver.setDaemon(true);
        receiver.start();

        message(nodeId + ": started with " + registry.size() + " morphisms, " + transport.peerCount() + " peers");
        events.emit(new MeshEvent.Started(nodeId, registry.size()));
    }

    /** Abandons in-flight verifications; they resolve as cancelled without touching the registry. */
    public synchronized void stop() {
        if (!running.compareAndSet(true, false)) return;
        stopped = true;
        if (receiver != null) receiver.interrupt();
        transport.stop();
        shutdownExecutor(exe, nodeId + " worker pool");
        events.emit(new MeshEvent.Stopped(nodeId));
        events.shutdown();
        message(nodeId + ": stopped");
    }

    public boolean isRunning() {
        return running.get();
    }

    private void loadStored() {
        List<String> ids;
        try {
            ids = storage.listLocal();
        } catch (IOException e) {
            error(nodeId + ": could not list storage: " + e.getMessage());
            return;
        }
        var loaded = 0;
        for (var sid : ids) {
            CanonicalMorphism m;
            try {
                m = storage.retrieve(sid);
            } catch (IOException | RuntimeException e) {
                warning(nodeId + ": stored morphism " + sid + " is unreadable, skipped: " + e.getMessage());
                continue;
            }
            if (m == null) continue;
            if (!m.intact()) {
                warning(nodeId + ": stored morphism " + sid + " does not match its hash, skipped");
                continue;
            }
            registry.storageId(m.hash, sid);
            if (registry.insert(m).created()) loaded++;
        }
        if (loaded > 0) message(nodeId + ": loaded " + loaded + " morphisms from storage");
    }

    /**
     * Decides the status of {@code text}. Never throws: failures and cancellation become Rejected.
     */
    public VerifyResponse verify(String text, @Nullable Metadata metadata) {
        var requestId = id(nodeId + "-");
        VerifyResponse response;
        try {
            response = verify(requestId, text == null ? "" : text, metadata == null ? Metadata.EMPTY : metadata);
        } catch (CancellationException e) {
            debug(requestId + ": " + e.getMessage());
            response = VerifyResponse.rejected(requestId, List.of("Verification cancelled"), null, ConsensusInfo.solo(nodeId));
        } catch (RuntimeException e) {
            error(requestId + ": verification failed: " + e.getMessage(), e);
            response = VerifyResponse.rejected(requestId, List.of("Internal error: " + e.getMessage()), null, ConsensusInfo.solo(nodeId));
        } catch (StackOverflowError e) {
            warning(requestId + ": expression too deep to verify");
            response = VerifyResponse.rejected(requestId, List.of(TOO_DEEP), null, ConsensusInfo.solo(nodeId));
        }
        verifications.incrementAndGet();
        events.emit(new MeshEvent.Verified(nodeId, response));
        return response;
    }

    /** Runs {@link #verify} on the worker pool; cancelling the future with interruption abandons reduction. */
    public Future<VerifyResponse> verifyAsync(String text, @Nullable Metadata metadata) {
        return exe.submit(() -> verify(text, metadata));
    }

    private VerifyResponse verify(String requestId, String text, Metadata metadata) {
        var expr = LambdaExpression.of(text, metadata.withSource(nodeId));
        Term term;
        try {
            term = LambdaParser.parse(text);
        } catch (LambdaParser.ParseException e) {
            var purity = PurityChecker.check(text);
            var errors = new ArrayList<>(purity.violations());
            errors.add("Parse error: " + e.getMessage());
            return VerifyResponse.rejected(requestId, errors, purity.pure() ? null : purity.violations().get(0),
                    ConsensusInfo.solo(nodeId));
        }

        var local = consensus.opinion(requestId, expr, term, cancelled);
        var result = consensus.collect(requestId, expr, local.vote());
        var response = consensus.resolve(requestId, expr, term, local, result, cancelled);
        if (response.status() == VerifyResponse.Status.CREATED) publish(requireNonNull(response.created()));
        return response;
    }

    private void publish(CanonicalMorphism m) {
        String sid = null;
        try {
            sid = storage.store(m);
            registry.storageId(m.hash, sid);
        } catch (IOException e) {
            error(nodeId + ": could not store " + m.name + ": " + e.getMessage());
        }
        if (transport.peerCount() > 0)
            transport.broadcast(new Message.MorphismAnnounce(nodeId, System.currentTimeMillis(), m.hash, m.name, sid));
        events.emit(new MeshEvent.MorphismCreated(nodeId, m));
    }

    public List<CanonicalMorphism> listMorphisms() {
        return registry.list();
    }

    public Status status() {
        return new Status(nodeId, transport.peerCount(), registry.size(), verifications.get(),
                startedAt == 0 ? 0 : System.currentTimeMillis() - startedAt);
    }

    private void receiveLoop() {
        while (running.get()) {
            Message m;
            try {
                m = inbox.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
            try {
                handle(m);
            } catch (RuntimeException e) {
                error(nodeId + ": failed handling " + m.type() + " from " + m.senderId() + ": " + e.getMessage(), e);
            }
        }
    }

    void handle(Message m) {
        if (m.senderId().equals(nodeId)) return;
        switch (m.type()) {
            case VERIFY_REQUEST -> offload(() -> answer((Message.VerifyRequest) m));
            case VERIFY_VOTE -> {
                var v = (Message.VerifyVote) m;
                if (!v.vote().nodeId().equals(v.senderId()))
                    warning(nodeId + ": vote from " + v.senderId() + " claims to be from " + v.vote().nodeId() + ", dropped");
                else consensus.offer(v.vote());
            }
            case PING -> transport.sendToPeer(m.senderId(), new Message.Pong(nodeId, System.currentTimeMillis()));
            case PONG, IDENTITY -> debug(nodeId + ": " + m.type() + " from " + m.senderId());
            case MORPHISM_ANNOUNCE -> offload(() -> announced((Message.MorphismAnnounce) m));
            case MORPHISM_SYNC_REQUEST -> offload(() -> syncRequested((Message.MorphismSyncRequest) m));
            case MORPHISM_SYNC_RESPONSE -> synced((Message.MorphismSyncResponse) m);
        }
    }

    private void offload(Runnable task) {
        try {
            exe.execute(task);
        } catch (RejectedExecutionException e) {
            debug(nodeId + ": shutting down, message dropped");
        }
    }

    private void answer(Message.VerifyRequest req) {
        var expr = LambdaExpression.of(req.expr().text(), req.expr().metadata());
        Vote vote;
        try {
            vote = consensus.opinion(req.requestId(), expr, LambdaParser.parse(expr.text()), cancelled).vote();
        } catch (LambdaParser.ParseException e) {
            vote = consensus.unparseable(req.requestId(), e.getMessage());
        } catch (CancellationException e) {
            debug(nodeId + ": abandoned vote on " + req.requestId());
            return;
        } catch (StackOverflowError e) {
            vote = Vote.impure(nodeId, req.requestId(), 1.0, TOO_DEEP);
        }
        transport.sendToPeer(req.senderId(), new Message.VerifyVote(nodeId, System.currentTimeMillis(), req.requestId(), vote));
    }

    private void announced(Message.MorphismAnnounce a) {
        if (registry.contains(a.hash())) return;
        if (a.storageId() != null) {
            try {
                var m = storage.retrieve(a.storageId());
                if (m != null && accept(m, a.hash(), "storage")) return;
            } catch (IOException | IllegalArgumentException e) {
                debug(nodeId + ": " + a.storageId() + " not in local storage: " + e.getMessage());
            }
        }
        if (pendingSync.add(a.hash()))
            transport.sendToPeer(a.senderId(), new Message.MorphismSyncRequest(nodeId, System.currentTimeMillis(), a.hash(), a.storageId()));
    }

    private void syncRequested(Message.MorphismSyncRequest r) {
        var m = registry.get(r.hash()).orElse(null);
        if (m == null && r.storageId() != null) {
            try {
                m = storage.retrieve(r.storageId());
            } catch (IOException | IllegalArgumentException e) {
                warning(nodeId + ": sync request for " + r.storageId() + " failed: " + e.getMessage());
            }
        }
        var sid = r.storageId() != null ? r.storageId() : registry.storageId(r.hash()).orElse(null);
        transport.sendToPeer(r.senderId(), new Message.MorphismSyncResponse(nodeId, System.currentTimeMillis(), r.hash(), sid, m));
    }

    private void synced(Message.MorphismSyncResponse r) {
        pendingSync.remove(r.hash());
        if (r.morphism() == null) {
            warning(nodeId + ": peer " + r.senderId() + " does not have " + r.hash());
            return;
        }
        accept(r.morphism(), r.hash(), r.senderId());
    }

    /** Inserts a morphism from elsewhere after checking its hash and purity. */
    private boolean accept(CanonicalMorphism m, String expectedHash, String from) {
        if (!m.hash.equals(expectedHash) || !m.intact()) {
            warning(nodeId + ": morphism from " + from + " does not match its hash, rejected");
            return false;
        }
        if (!PurityChecker.check(m.definition).pure()) {
            warning(nodeId + ": morphism " + m.name + " from " + from + " is impure, rejected");
            return false;
        }
        if (!registry.insert(m).created()) return true;
        try {
            registry.storageId(m.hash, storage.store(m));
        } catch (IOException e) {
            error(nodeId + ": could not store synced " + m.name + ": " + e.getMessage());
        }
        message(nodeId + ": synced " + m.name + " from " + from);
        events.emit(new MeshEvent.MorphismSynced(nodeId, m, from));
        return true;
    }

    public record Status(String nodeId, int peersConnected, int morphismCount, long verificationCount, long uptimeMillis) {
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Configuration(
            @JsonProperty("nodeId") String nodeId,
            @JsonProperty("port") int port,
            @JsonProperty("peers") List<String> peers,
            @JsonProperty("consensusThreshold") double consensusThreshold,
            @JsonProperty("consensusTimeoutMillis") long consensusTimeoutMillis,
            @JsonProperty("reductionStepLimit") int reductionStepLimit,
            @JsonProperty("expansionDepth") int expansionDepth,
            @JsonProperty("hypothesisThreshold") double hypothesisThreshold,
            @JsonProperty("loadSeeds") boolean loadSeeds,
            @JsonProperty("storageDir") @Nullable String storageDir
    ) {
        @JsonCreator
        public Configuration(
                @JsonProperty("nodeId") String nodeId,
                @JsonProperty("port") Integer port,
                @JsonProperty("peers") List<String> peers,
                @JsonProperty("consensusThreshold") Double consensusThreshold,
                @JsonProperty("consensusTimeoutMillis") Long consensusTimeoutMillis,
                @JsonProperty("reductionStepLimit") Integer reductionStepLimit,
                @JsonProperty("expansionDepth") Integer expansionDepth,
                @JsonProperty("hypothesisThreshold") Double hypothesisThreshold,
                @JsonProperty("loadSeeds") Boolean loadSeeds,
                @JsonProperty("storageDir") String storageDir
        ) {
            this(
                    nodeId != null ? nodeId : "node-" + UUID.randomUUID().toString().substring(0, 8),
                    port != null ? port : DEFAULT_PORT,
                    peers != null ? List.copyOf(peers) : List.of(),
                    consensusThreshold != null ? consensusThreshold : Consensus.DEFAULT_THRESHOLD,
                    consensusTimeoutMillis != null ? consensusTimeoutMillis : Consensus.DEFAULT_TIMEOUT_MILLIS,
                    reductionStepLimit != null ? reductionStepLimit : BetaReduction.DEFAULT_STEP_LIMIT,
                    expansionDepth != null ? expansionDepth : DefinitionExpansion.DEFAULT_DEPTH,
                    hypothesisThreshold != null ? hypothesisThreshold : HypothesisEngine.DEFAULT_THRESHOLD,
                    loadSeeds != null ? loadSeeds : true,
                    storageDir
            );
        }

        public Configuration() {
            this(null, null, null, null, null, null, null, null, null, null);
        }

        public static Configuration load(Path file) throws IOException {
            return Json.the.readValue(Files.readString(file), Configuration.class);
        }

        public Configuration withNodeId(String nodeId) {
            return new Configuration(nodeId, port, peers, consensusThreshold, consensusTimeoutMillis, reductionStepLimit, expansionDepth, hypothesisThreshold, loadSeeds, storageDir);
        }

        public Configuration withPort(int port) {
            return new Configuration(nodeId, port, peers, consensusThreshold, consensusTimeoutMillis, reductionStepLimit, expansionDepth, hypothesisThreshold, loadSeeds, storageDir);
        }

        public Configuration withPeers(List<String> peers) {
            return new Configuration(nodeId, port, List.copyOf(peers), consensusThreshold, consensusTimeoutMillis, reductionStepLimit, expansionDepth, hypothesisThreshold, loadSeeds, storageDir);
        }

        public Configuration withConsensusThreshold(double consensusThreshold) {
            return new Configuration(nodeId, port, peers, consensusThreshold, consensusTimeoutMillis, reductionStepLimit, expansionDepth, hypothesisThreshold, loadSeeds, storageDir);
        }

        public Configuration withConsensusTimeoutMillis(long consensusTimeoutMillis) {
            return new Configuration(nodeId, port, peers, consensusThreshold, consensusTimeoutMillis, reductionStepLimit, expansionDepth, hypothesisThreshold, loadSeeds, storageDir);
        }

        public Configuration withReductionStepLimit(int reductionStepLimit) {
            return new Configuration(nodeId, port, peers, consensusThreshold, consensusTimeoutMillis, reductionStepLimit, expansionDepth, hypothesisThreshold, loadSeeds, storageDir);
        }

        public Configuration withLoadSeeds(boolean loadSeeds) {
            return new Configuration(nodeId, port, peers, consensusThreshold, consensusTimeoutMillis, reductionStepLimit, expansionDepth, hypothesisThreshold, loadSeeds, storageDir);
        }

        public Configuration withStorageDir(@Nullable String storageDir) {
            return new Configuration(nodeId, port, peers, consensusThreshold, consensusTimeoutMillis, reductionStepLimit, expansionDepth, hypothesisThreshold, loadSeeds, storageDir);
        }
    }
}
