package server.rpc;

import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import playback.PlaybackSnapshot;
import playback.PlayerListener;
import playback.PlayerState;
import server.rpc.dto.PlayerStateChanged;

/** Forwards player notifications to the connected remote client, if there is one. */
@Component
@Slf4j
public class ClientGateway implements PlayerListener {

    private volatile ClientApi client;

    public void setClient(ClientApi client) {
        this.client = client;
    }

    public boolean isClientConnected() {
        return client != null;
    }

    @Override
    public void onStateChanged(@NonNull PlayerState previous, @NonNull PlaybackSnapshot snapshot) {
        stateChanged(new PlayerStateChanged(previous, snapshot.state(), snapshot));
    }

    public void stateChanged(PlayerStateChanged payload) {
        ClientApi c = this.client;
        if (c != null) {
            try {
                c.stateChanged(payload);
            } catch (RuntimeException e) {
                log.warn("Failed to notify client: stateChanged", e);
            }
        } else {
            log.debug("Client not connected; dropping stateChanged: {}", payload.current());
        }
    }
}
