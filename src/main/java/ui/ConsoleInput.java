package ui;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.Executor;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import playback.PlaybackOrchestrator;

/**
 * Reads key presses from a line-buffered stream: every character of a line is one key and an empty
 * line is ENTER. Keys are handed to the event dispatch thread in order.
 */
@Slf4j
public class ConsoleInput {

    private final InputStream input;
    private final Executor edt;
    private final PlaybackOrchestrator player;
    private final Runnable onQuit;

    public ConsoleInput(
            @NonNull InputStream input,
            @NonNull Executor edt,
            @NonNull PlaybackOrchestrator player,
            @NonNull Runnable onQuit) {
        this.input = input;
        this.edt = edt;
        this.player = player;
        this.onQuit = onQuit;
    }

    public Thread start() {
        Thread reader = new Thread(this::readLoop, "tunebox-console");
        reader.setDaemon(true);
        reader.start();
        return reader;
    }

    void readLoop() {
        try (BufferedReader lines =
                new BufferedReader(new InputStreamReader(input, StandardCharsets.UTF_8))) {
            String line;
            while ((line = lines.readLine()) != null) {
                String keys = line.isEmpty() ? String.valueOf(KeyBindings.ENTER) : line;
                edt.execute(() -> dispatch(keys));
            }
        } catch (IOException e) {
            log.warn("Console input closed", e);
        }
    }

    private void dispatch(String keys) {
        for (int i = 0; i < keys.length(); i++) {
            if (!KeyBindings.dispatch(player, keys.charAt(i))) {
                onQuit.run();
                return;
            }
        }
    }
}
