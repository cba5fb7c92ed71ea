package cafe.woden.logview.query;

import cafe.woden.logview.model.LogEntry;
import cafe.woden.logview.model.LogSourceType;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.function.Predicate;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/** Compiles {@link LogFilter}s into entry predicates. */
public final class LogFilters {

  private static final Predicate<LogEntry> MATCH_ALL = e -> true;

  private LogFilters() {}

  /**
   * Compiles a filter once so it can be applied to many entries.
   *
   * @throws IllegalArgumentException if the search pattern is not a valid regex/glob
   */
  public static Predicate<LogEntry> compile(LogFilter filter) {
    if (filter == null || filter.isEmpty()) return MATCH_ALL;

    TextMatcher text = compileMatcher(filter.search(), filter.searchMode());

    return entry -> {
      if (entry == null) return false;
      if (!filter.levels().isEmpty() && !filter.levels().contains(entry.level())) return false;
      if (!filter.tasks().isEmpty() && !filter.tasks().contains(entry.labels().task())) {
        return false;
      }
      if (!filter.retries().isEmpty() && !filter.retries().contains(entry.labels().retry())) {
        return false;
      }
      if (!filter.sources().isEmpty()) {
        LogSourceType source = entry.labels().source();
        if (source == null || !filter.sources().contains(source)) return false;
      }
      if (filter.start() != null && entry.timestamp().isBefore(filter.start())) return false;
      if (filter.end() != null && entry.timestamp().isAfter(filter.end())) return false;
      return text.matches(entry.message());
    };
  }

  /** Returns the matching entries in their original order. */
  public static List<LogEntry> apply(List<LogEntry> entries, LogFilter filter) {
    if (entries == null || entries.isEmpty()) return List.of();
    if (filter == null || filter.isEmpty()) return entries;
    Predicate<LogEntry> p = compile(filter);
    ArrayList<LogEntry> out = new ArrayList<>();
    for (LogEntry e : entries) {
      if (p.test(e)) out.add(e);
    }
    return List.copyOf(out);
  }

  private static TextMatcher compileMatcher(String pattern, LogSearchMode mode) {
    String p = Objects.toString(pattern, "").trim();
    if (p.isEmpty()) return value -> true;
    LogSearchMode m = (mode == null) ? LogSearchMode.CONTAINS : mode;

    return switch (m) {
      case CONTAINS -> {
        String needle = p.toLowerCase(Locale.ROOT);
        yield value -> Objects.toString(value, "").toLowerCase(Locale.ROOT).contains(needle);
      }
      case GLOB -> {
        Pattern re = compileGlob(p);
        yield value -> re.matcher(Objects.toString(value, "")).find();
      }
      case REGEX -> {
        Pattern re = compileRegex(p);
        yield value -> re.matcher(Objects.toString(value, "")).find();
      }
    };
  }

  private static Pattern compileRegex(String pattern) {
    try {
      return Pattern.compile(pattern, Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
    } catch (PatternSyntaxException ex) {
      throw new IllegalArgumentException("Invalid search regex: " + ex.getMessage(), ex);
    }
  }

  private static Pattern compileGlob(String glob) {
    StringBuilder sb = new StringBuilder(glob.length() + 12);
    for (int i = 0; i < glob.length(); i++) {
      char c = glob.charAt(i);
      switch (c) {
        case '*' -> sb.append(".*");
        case '?' -> sb.append('.');
        case '.', '\\', '+', '(', ')', '[', ']', '{', '}', '^', '$', '|' ->
            sb.append('\\').append(c);
        default -> sb.append(c);
      }
    }
    try {
      return Pattern.compile(sb.toString(), Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
    } catch (PatternSyntaxException ex) {
      throw new IllegalArgumentException("Invalid search glob: " + ex.getMessage(), ex);
    }
  }

  @FunctionalInterface
  private interface TextMatcher {
    boolean matches(String value);
  }
}
