package cafe.woden.logview.util;

import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Lazy;
import org.springframework.stereotype.Component;

/** Stops executors created through {@link NamedThreads} when the Spring context closes. */
@Component
@Lazy(false)
class ExecutorsLifecycle {
  private static final Logger log = LoggerFactory.getLogger(ExecutorsLifecycle.class);

  @PreDestroy
  void shutdown() {
    int stopped = NamedThreads.shutdownTrackedExecutorsNow();
    if (stopped > 0) {
      log.debug("[logview] stopped {} tracked executor(s) on shutdown", stopped);
    }
  }
}
