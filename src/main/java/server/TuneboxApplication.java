package server;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ScheduledExecutorService;
import library.Library;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.ConfigurableApplicationContext;
import playback.PlaybackOrchestrator;
import ui.ConsoleInput;
import ui.PlayerLoop;

@Slf4j
@SpringBootApplication(proxyBeanMethods = false)
public class TuneboxApplication {

    public static void main(String[] args) throws Exception {
        var ctx = SpringApplication.run(TuneboxApplication.class, toSpringArgs(args));
        var properties = ctx.getBean(PlayerProperties.class);
        var library = ctx.getBean(Library.class);
        if (library.isEmpty()) {
            log.error("No audio files found in {}", properties.musicPath());
            System.exit(SpringApplication.exit(ctx, () -> 1));
        }

        var edt = ctx.getBean("edt", ScheduledExecutorService.class);
        var player = ctx.getBean(PlaybackOrchestrator.class);
        var loop = ctx.getBean(PlayerLoop.class);
        var socketHandler = ctx.getBean(RemoteSocketHandler.class);

        edt.submit(
                        () -> {
                            if (properties.shuffle()) {
                                player.toggleShuffle();
                            }
                            if (library.singleFile()) {
                                player.play(0);
                            }
                            loop.start();
                        })
                .get();

        if (properties.console()) {
            new ConsoleInput(System.in, edt, player, () -> shutdown(ctx, socketHandler)).start();
            log.info("Keys: space play/pause, n/p next/prev, l/h seek, +/- volume, q quit");
        }

        Runtime.getRuntime().addShutdownHook(new Thread(socketHandler::close));

        if (properties.remoteEnabled()) {
            socketHandler.bind(properties.remoteHost(), properties.remotePort());
            socketHandler.serve();
        } else {
            log.info("Remote control disabled");
            Thread.currentThread().join();
        }
    }

    private static void shutdown(ConfigurableApplicationContext ctx, RemoteSocketHandler handler) {
        log.info("Quitting");
        handler.close();
        System.exit(SpringApplication.exit(ctx));
    }

    /**
     * Translates {@code [--shuffle] [--port N] [path]} into Spring property arguments. Anything
     * else, including {@code --name=value} overrides, is passed through.
     */
    static String[] toSpringArgs(String[] args) {
        List<String> out = new ArrayList<>();
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            if (arg.equals("--shuffle")) {
                out.add("--player.shuffle=true");
            } else if (arg.equals("--port") && i + 1 < args.length) {
                out.add("--player.remote-port=" + args[++i]);
            } else if (!arg.startsWith("-")) {
                out.add("--player.music-path=" + arg);
            } else {
                out.add(arg);
            }
        }
        return out.toArray(new String[0]);
    }
}
