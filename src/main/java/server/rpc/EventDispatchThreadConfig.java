package server.rpc;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** The single thread that owns the player, visualizer and renderer. */
@Configuration
public class EventDispatchThreadConfig {

    @Bean(name = "edt", destroyMethod = "shutdown")
    public ScheduledExecutorService edt() {
        return Executors.newSingleThreadScheduledExecutor(
                r -> {
                    Thread t = new Thread(r, "EventDispatchThread");
                    t.setDaemon(true);
                    return t;
                });
    }
}
