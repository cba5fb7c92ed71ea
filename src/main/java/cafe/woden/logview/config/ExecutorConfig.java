package cafe.woden.logview.config;

import cafe.woden.logview.util.NamedThreads;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ScheduledExecutorService;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Centralized app-owned executors.
 *
 * <p>These remain workload-specific so a slow batch fetch never delays a reconnect timer, while
 * giving Spring ownership of creation/shutdown.
 */
@Configuration
public class ExecutorConfig {
  public static final String LOG_BATCH_FETCH_EXECUTOR = "logBatchFetchExecutor";
  public static final String LOG_STREAM_RECONNECT_SCHEDULER = "logStreamReconnectScheduler";

  @Bean(name = LOG_BATCH_FETCH_EXECUTOR, destroyMethod = "shutdown")
  public ExecutorService logBatchFetchExecutor() {
    return NamedThreads.newCachedThreadPool("logview-batch-fetch");
  }

  @Bean(name = LOG_STREAM_RECONNECT_SCHEDULER, destroyMethod = "shutdown")
  public ScheduledExecutorService logStreamReconnectScheduler() {
    return NamedThreads.newSingleThreadScheduledExecutor("logview-reconnect");
  }
}
