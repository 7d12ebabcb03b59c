package dumb.lambdamesh;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Consumer;

import static dumb.lambdamesh.util.Log.debug;
import static dumb.lambdamesh.util.Log.error;
import static java.util.Objects.requireNonNull;

/**
 * Asynchronous event bus. Listeners are keyed by event class and run on the bus executor; a failing
 * listener is logged and does not affect the others.
 */
public class Events {
    public final ExecutorService exe;
    final ConcurrentMap<Class<? extends MeshEvent>, CopyOnWriteArrayList<Consumer<MeshEvent>>> listeners = new ConcurrentHashMap<>();

    public Events(ExecutorService exe) {
        this.exe = requireNonNull(exe);
    }

    private static void exeSafe(Consumer<MeshEvent> listener, MeshEvent event) {
        try {
            listener.accept(event);
        } catch (Exception e) {
            error("Error in listener for " + event.getClass().getSimpleName() + ": " + e.getMessage(), e);
        }
    }

    public <T extends MeshEvent> void on(Class<T> eventType, Consumer<T> listener) {
        listeners.computeIfAbsent(eventType, k -> new CopyOnWriteArrayList<>()).add(event -> listener.accept(eventType.cast(event)));
    }

    public void emit(MeshEvent event) {
        if (exe.isShutdown()) return;
        List<Consumer<MeshEvent>> targets = listeners.get(event.getClass());
        if (targets == null || targets.isEmpty()) return;
        try {
            exe.submit(() -> targets.forEach(listener -> exeSafe(listener, event)));
        } catch (RejectedExecutionException e) {
            debug("Event dropped during shutdown: " + event.getClass().getSimpleName());
        }
    }

    public void shutdown() {
        exe.shutdown();
    }
}
