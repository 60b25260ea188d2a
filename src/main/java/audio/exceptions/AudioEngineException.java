package audio.exceptions;

import lombok.NonNull;

/** Illegal engine lifecycle transition, such as starting an engine twice. */
public class AudioEngineException extends AudioException {

    public AudioEngineException(@NonNull String message) {
        super(message);
    }
}
