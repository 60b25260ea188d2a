package server.rpc;

import org.eclipse.lsp4j.jsonrpc.services.JsonNotification;
import server.rpc.dto.PlayerStateChanged;

public interface ClientApi {

    @JsonNotification("player/stateChanged")
    void stateChanged(PlayerStateChanged payload);
}
