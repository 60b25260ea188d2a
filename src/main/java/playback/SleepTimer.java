package playback;

import java.time.Duration;
import java.time.Instant;
import java.util.OptionalInt;
import lombok.NonNull;

/**
 * Pauses playback after a fixed time, fading the volume linearly to zero over the final
 * {@link #FADE}.
 *
 * @param originalVolume Volume to restore once the timer fires or is cancelled
 * @param durationMinutes Rung of the ladder this timer was armed from
 */
public record SleepTimer(
        @NonNull Instant endTime,
        @NonNull Instant fadeStart,
        float originalVolume,
        int durationMinutes) {

    public static final Duration FADE = Duration.ofSeconds(60);
    private static final int[] LADDER = {15, 30, 45, 60};

    public static SleepTimer start(@NonNull Instant now, int minutes, float originalVolume) {
        Instant end = now.plus(Duration.ofMinutes(minutes));
        return new SleepTimer(end, end.minus(FADE), originalVolume, minutes);
    }

    /** Minutes for the first timer armed when none is active. */
    public static int firstRung() {
        return LADDER[0];
    }

    /** Next rung after this timer's, or empty when the ladder wraps to off. */
    public OptionalInt nextRung() {
        for (int i = 0; i < LADDER.length - 1; i++) {
            if (LADDER[i] == durationMinutes) {
                return OptionalInt.of(LADDER[i + 1]);
            }
        }
        return OptionalInt.empty();
    }

    public boolean isExpired(@NonNull Instant now) {
        return !now.isBefore(endTime);
    }

    public boolean isFading(@NonNull Instant now) {
        return !now.isBefore(fadeStart) && now.isBefore(endTime);
    }

    /** {@code originalVolume * remaining / fade length}; the full volume before the fade starts. */
    public float volumeAt(@NonNull Instant now) {
        if (now.isBefore(fadeStart)) {
            return originalVolume;
        }
        if (isExpired(now)) {
            return 0f;
        }
        double fadeTotal = Duration.between(fadeStart, endTime).toNanos();
        double remaining = Duration.between(now, endTime).toNanos();
        return (float) (originalVolume * (remaining / fadeTotal));
    }

    public Duration remaining(@NonNull Instant now) {
        return isExpired(now) ? Duration.ZERO : Duration.between(now, endTime);
    }
}
