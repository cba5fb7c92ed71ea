package cafe.woden.logview;

import cafe.woden.logview.config.LogViewProperties;
import cafe.woden.logview.flatten.FlatList;
import cafe.woden.logview.parse.LogLineParser;
import cafe.woden.logview.parse.ParsedLogSources;
import cafe.woden.logview.query.FieldFacet;
import cafe.woden.logview.session.LogViewSession;
import cafe.woden.logview.session.LogViewSessionFactory;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.builder.SpringApplicationBuilder;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.modulith.Modulithic;

@SpringBootApplication
@Modulithic(
    systemName = "LogView",
    sharedModules = {"config", "model", "util"})
@EnableConfigurationProperties(LogViewProperties.class)
public class LogViewApp {
  private static final Logger log = LoggerFactory.getLogger(LogViewApp.class);

  private static final long LOAD_TIMEOUT_SECONDS = 30;

  public static void main(String[] args) {
    new SpringApplicationBuilder(LogViewApp.class).web(WebApplicationType.NONE).run(args);
  }

  /** Loads each log file named on the command line into a session and logs a summary. */
  @Bean
  public ApplicationRunner run(LogViewSessionFactory sessions) {
    return args -> {
      for (String file : args.getNonOptionArgs()) {
        summarize(sessions, Path.of(file));
      }
    };
  }

  private static void summarize(LogViewSessionFactory sessions, Path path) {
    Optional<String> text = readText(path);
    if (text.isEmpty()) return;
    String content = text.get();
    LogLineParser parser = new LogLineParser();
    try (LogViewSession session =
        sessions.create(ParsedLogSources.batch(parser, () -> content), null, () -> {})) {
      session.start();
      FlatList flat =
          session
              .flatLists()
              .filter(f -> f.generation() > 0)
              .firstElement()
              .timeout(LOAD_TIMEOUT_SECONDS, TimeUnit.SECONDS)
              .onErrorComplete()
              .blockingGet();
      if (flat == null) {
        log.warn("[logview] {}: nothing loaded within {}s", path, LOAD_TIMEOUT_SECONDS);
        return;
      }
      log.info(
          "[logview] {}: {} entries, {} day separator(s)",
          path,
          flat.entryCount(),
          flat.separators().size());
      for (FieldFacet facet : session.facets()) {
        log.info("[logview]   {}: {}", facet.field(), describe(facet));
      }
    }
  }

  private static String describe(FieldFacet facet) {
    return facet.values().stream()
        .map(v -> v.value() + "=" + v.count())
        .collect(Collectors.joining(", "));
  }

  /** Reads the whole file as UTF-8, or logs why it cannot and returns empty. */
  static Optional<String> readText(Path path) {
    if (!Files.isReadable(path)) {
      log.warn("[logview] cannot read {}", path);
      return Optional.empty();
    }
    try {
      return Optional.of(Files.readString(path, StandardCharsets.UTF_8));
    } catch (IOException e) {
      log.warn("[logview] cannot read {} as UTF-8 text: {}", path, e.toString());
      return Optional.empty();
    }
  }
}
