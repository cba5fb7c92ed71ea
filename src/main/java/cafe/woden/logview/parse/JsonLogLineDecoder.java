package cafe.woden.logview.parse;

import cafe.woden.logview.model.LogEntry;
import cafe.woden.logview.model.LogIoType;
import cafe.woden.logview.model.LogLabels;
import cafe.woden.logview.model.LogLevel;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Decodes structured JSON log lines. Returns {@code null} for anything it cannot use. */
final class JsonLogLineDecoder {
  private static final Logger log = LoggerFactory.getLogger(JsonLogLineDecoder.class);

  private static final ObjectMapper JSON = new ObjectMapper();

  private final Function<Instant, String> idGenerator;

  JsonLogLineDecoder(Function<Instant, String> idGenerator) {
    this.idGenerator = Objects.requireNonNull(idGenerator, "idGenerator");
  }

  LogEntry decode(String line) {
    JsonNode root;
    try {
      root = JSON.readTree(line);
    } catch (JsonProcessingException e) {
      log.debug("[logview] not a JSON log line: {}", e.getOriginalMessage());
      return null;
    }
    if (root == null || !root.isObject()) return null;

    Instant timestamp = timestamp(root.get("timestamp"));
    if (timestamp == null) timestamp = timestamp(root.get("ts"));
    if (timestamp == null) return null;

    String message = text(root.get("message"));
    if (message.isEmpty()) message = text(root.get("line"));
    if (message.isEmpty()) message = text(root.get("msg"));

    JsonNode labelsNode = root.get("labels");
    String task = "";
    String retry = "";
    LogIoType ioType = null;
    String levelRaw = text(root.get("level"));
    TreeMap<String, String> extra = new TreeMap<>();
    if (labelsNode != null && labelsNode.isObject()) {
      var fields = labelsNode.fields();
      while (fields.hasNext()) {
        Map.Entry<String, JsonNode> e = fields.next();
        String key = Objects.toString(e.getKey(), "").trim();
        String value = text(e.getValue());
        switch (key) {
          case "task" -> task = value;
          case "retry" -> retry = value;
          case "io_type" -> ioType = LogIoType.fromLabel(value);
          case "level" -> {
            if (levelRaw.isEmpty()) levelRaw = value;
          }
          default -> {
            if (!key.isEmpty()) extra.put(key, value);
          }
        }
      }
    }

    String id = text(root.get("id"));
    if (id.isEmpty()) id = idGenerator.apply(timestamp);

    return new LogEntry(
        id,
        timestamp,
        LogLevel.fromLabel(levelRaw),
        LogLineParser.stripAnsi(message),
        new LogLabels(task, retry, ioType, extra));
  }

  private static Instant timestamp(JsonNode node) {
    if (node == null || node.isNull()) return null;
    if (node.isNumber()) return Instant.ofEpochMilli(node.asLong());
    String raw = node.asText("").trim();
    if (raw.isEmpty()) return null;
    try {
      return Instant.parse(raw);
    } catch (DateTimeParseException e) {
      log.debug("[logview] unparseable JSON log timestamp '{}'", raw);
      return null;
    }
  }

  private static String text(JsonNode node) {
    if (node == null || node.isNull()) return "";
    return node.isValueNode() ? node.asText("") : node.toString();
  }
}
