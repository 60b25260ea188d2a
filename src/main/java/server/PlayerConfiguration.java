package server;

import audio.PlaybackEngine;
import audio.SampleSource;
import audio.decode.FormatRoutingSampleSource;
import audio.engine.EngineSettings;
import audio.engine.StreamingPlaybackEngine;
import audio.output.AudioOutput;
import audio.output.JavaSoundOutput;
import audio.output.NullAudioOutput;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.time.Clock;
import java.util.Random;
import java.util.concurrent.ScheduledExecutorService;
import library.AudioFileMetadataReader;
import library.JsonLibraryCache;
import library.Library;
import library.LibraryCache;
import library.LibraryScanner;
import library.MetadataReader;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import playback.PlaybackOrchestrator;
import server.rpc.ClientGateway;
import ui.PlayerLoop;
import ui.Renderer;
import ui.StatusLineRenderer;
import visualizer.Visualizer;

@Slf4j
@Configuration(proxyBeanMethods = false)
@EnableConfigurationProperties(PlayerProperties.class)
public class PlayerConfiguration {

    @Bean
    public SampleSource sampleSource() {
        return FormatRoutingSampleSource.standard();
    }

    @Bean
    public AudioOutput audioOutput(PlayerProperties properties) {
        String output = properties.output();
        if (PlayerProperties.OUTPUT_NULL.equalsIgnoreCase(output)) {
            return new NullAudioOutput(true);
        }
        if (!PlayerProperties.OUTPUT_JAVASOUND.equalsIgnoreCase(output)) {
            throw new IllegalArgumentException(
                    "Unknown player.output '" + output + "', expected javasound or null");
        }
        return new JavaSoundOutput();
    }

    @Bean
    public EngineSettings engineSettings(PlayerProperties properties) {
        return new EngineSettings(
                properties.commandQueueCapacity(),
                properties.eventQueueCapacity(),
                properties.sampleQueueCapacity(),
                properties.pollTimeout(),
                properties.progressInterval());
    }

    @Bean(initMethod = "start", destroyMethod = "close")
    public PlaybackEngine playbackEngine(
            SampleSource sampleSource, AudioOutput audioOutput, EngineSettings engineSettings) {
        return new StreamingPlaybackEngine(sampleSource, audioOutput, engineSettings);
    }

    @Bean
    public MetadataReader metadataReader() {
        return new AudioFileMetadataReader();
    }

    @Bean
    public LibraryCache libraryCache(ObjectMapper objectMapper, PlayerProperties properties) {
        Path cacheFile =
                properties.cacheFile().isBlank()
                        ? Path.of(System.getProperty("user.home"), ".tunebox", "library.json")
                        : Path.of(properties.cacheFile());
        return new JsonLibraryCache(objectMapper, cacheFile);
    }

    @Bean
    public LibraryScanner libraryScanner(MetadataReader metadataReader, LibraryCache libraryCache) {
        return new LibraryScanner(metadataReader, libraryCache);
    }

    @Bean
    public Library library(LibraryScanner scanner, PlayerProperties properties) {
        if (properties.musicPath().isBlank()) {
            log.warn("No music path configured, starting with an empty library");
            return Library.empty();
        }
        try {
            Library library = scanner.open(Path.of(properties.musicPath()));
            log.info("Found {} tracks in {}", library.size(), library.source());
            return library;
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot open music path " + properties.musicPath(), e);
        }
    }

    @Bean
    public Visualizer visualizer() {
        return new Visualizer();
    }

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public PlaybackOrchestrator playbackOrchestrator(
            PlaybackEngine playbackEngine,
            Visualizer visualizer,
            MetadataReader metadataReader,
            Library library,
            Clock clock,
            ClientGateway clientGateway,
            PlayerProperties properties) {
        PlaybackOrchestrator orchestrator =
                new PlaybackOrchestrator(
                        playbackEngine,
                        visualizer,
                        metadataReader,
                        library.tracks(),
                        clock,
                        new Random(),
                        properties.initialVolume());
        orchestrator.addListener(clientGateway);
        return orchestrator;
    }

    @Bean
    public Renderer renderer(Clock clock, PlayerProperties properties) {
        return new StatusLineRenderer(clock, properties.statusInterval());
    }

    @Bean(destroyMethod = "stop")
    public PlayerLoop playerLoop(
            @Qualifier("edt") ScheduledExecutorService edt,
            PlaybackOrchestrator orchestrator,
            Renderer renderer,
            PlayerProperties properties) {
        return new PlayerLoop(edt, orchestrator, renderer, properties.tickInterval());
    }
}
