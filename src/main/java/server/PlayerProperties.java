package server;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/** Externalized configuration for the player, its engine and the remote control. */
@ConfigurationProperties(prefix = "player")
public record PlayerProperties(
        @DefaultValue("") String musicPath,
        @DefaultValue("false") boolean shuffle,
        @DefaultValue("0.8") float initialVolume,
        @DefaultValue("javasound") String output,
        @DefaultValue("32") int commandQueueCapacity,
        @DefaultValue("64") int eventQueueCapacity,
        @DefaultValue("4") int sampleQueueCapacity,
        @DefaultValue("16ms") Duration pollTimeout,
        @DefaultValue("33ms") Duration progressInterval,
        @DefaultValue("33ms") Duration tickInterval,
        @DefaultValue("1s") Duration statusInterval,
        @DefaultValue("") String cacheFile,
        @DefaultValue("true") boolean remoteEnabled,
        @DefaultValue("0.0.0.0") String remoteHost,
        @DefaultValue("8080") int remotePort,
        @DefaultValue("false") boolean console) {

    static final String OUTPUT_JAVASOUND = "javasound";
    static final String OUTPUT_NULL = "null";
}
