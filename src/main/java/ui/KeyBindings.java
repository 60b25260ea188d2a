package ui;

import lombok.NonNull;
import playback.PlaybackOrchestrator;

/**
 * Maps single key presses to player actions. In search mode printable keys edit the query;
 * {@code ESC} and {@code ENTER} leave it.
 */
public final class KeyBindings {

    public static final char ENTER = '\n';
    public static final char ESC = 27;
    public static final char BACKSPACE = 127;

    private KeyBindings() {}

    /**
     * @return false if the key asks the player to quit
     */
    public static boolean dispatch(@NonNull PlaybackOrchestrator player, char key) {
        if (player.isSearchMode()) {
            switch (key) {
                case ESC, ENTER -> player.toggleSearch();
                case BACKSPACE, '\b' -> player.searchBackspace();
                default -> player.searchInput(key);
            }
            return true;
        }
        switch (key) {
            case 'q' -> {
                player.stop();
                return false;
            }
            case ' ' -> player.togglePause();
            case 'n' -> player.next();
            case 'p' -> player.prev();
            case 'j' -> player.moveSelectionDown();
            case 'k' -> player.moveSelectionUp();
            case ENTER -> player.playSelected();
            case 's' -> player.toggleShuffle();
            case 'r' -> player.cycleRepeat();
            case '+', ']' -> player.volumeUp();
            case '-', '[' -> player.volumeDown();
            case '/' -> player.toggleSearch();
            case 'l' -> player.seekForward();
            case 'h' -> player.seekBackward();
            case 'i' -> player.toggleInfo();
            case 'v' -> player.cycleVisualizer();
            case 'T' -> player.cycleTheme();
            case 't' -> player.cycleSleepTimer();
            case 'm' -> player.toggleMiniMode();
            case '<', ',' -> player.speedDown();
            case '>', '.' -> player.speedUp();
            default -> {}
        }
        return true;
    }
}
