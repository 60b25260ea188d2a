package server.rpc;

import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import org.eclipse.lsp4j.jsonrpc.services.JsonRequest;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import playback.PlaybackOrchestrator;
import playback.PlaybackSnapshot;
import server.rpc.dto.Pong;
import server.rpc.dto.SeekTo;
import server.rpc.dto.SetVolume;

/**
 * JSON-RPC surface for remote control. Every request runs on the event dispatch thread and
 * answers with the snapshot taken after it was applied.
 */
@Service
public class RemoteControlService {
    private final PlaybackOrchestrator player;
    private final ExecutorService edt;

    public RemoteControlService(
            PlaybackOrchestrator player, @Qualifier("edt") ExecutorService edt) {
        this.player = player;
        this.edt = edt;
    }

    private <T> CompletableFuture<T> onEdt(Callable<T> task) {
        var cf = new CompletableFuture<T>();
        edt.execute(
                () -> {
                    try {
                        cf.complete(task.call());
                    } catch (Throwable t) {
                        cf.completeExceptionally(t);
                    }
                });
        return cf;
    }

    private CompletableFuture<PlaybackSnapshot> apply(Runnable action) {
        return onEdt(
                () -> {
                    action.run();
                    return player.snapshot();
                });
    }

    @JsonRequest("ping")
    public CompletableFuture<Pong> ping() {
        return onEdt(Pong::new);
    }

    @JsonRequest("player/status")
    public CompletableFuture<PlaybackSnapshot> status() {
        return onEdt(player::snapshot);
    }

    @JsonRequest("player/toggle")
    public CompletableFuture<PlaybackSnapshot> toggle() {
        return apply(player::togglePause);
    }

    @JsonRequest("player/next")
    public CompletableFuture<PlaybackSnapshot> next() {
        return apply(player::next);
    }

    @JsonRequest("player/prev")
    public CompletableFuture<PlaybackSnapshot> prev() {
        return apply(player::prev);
    }

    @JsonRequest("player/setVolume")
    public CompletableFuture<PlaybackSnapshot> setVolume(SetVolume req) {
        return apply(() -> player.setVolume(req.volume()));
    }

    @JsonRequest("player/seek")
    public CompletableFuture<PlaybackSnapshot> seek(SeekTo req) {
        return apply(() -> player.seekTo(req.seconds()));
    }

    @JsonRequest("player/cycleTheme")
    public CompletableFuture<PlaybackSnapshot> cycleTheme() {
        return apply(player::cycleTheme);
    }

    @JsonRequest("player/cycleVisualizer")
    public CompletableFuture<PlaybackSnapshot> cycleVisualizer() {
        return apply(player::cycleVisualizer);
    }

    @JsonRequest("player/toggleShuffle")
    public CompletableFuture<PlaybackSnapshot> toggleShuffle() {
        return apply(player::toggleShuffle);
    }
}
