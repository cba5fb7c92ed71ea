package cafe.woden.logview.query;

import cafe.woden.logview.model.LogEntry;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/** Counts distinct label values for the fields pane. */
public final class LogFacets {

  public static final List<String> DEFAULT_FIELDS = List.of("level", "source", "task", "retry");

  private static final Comparator<FacetValue> ORDER =
      Comparator.comparingInt(FacetValue::count).reversed().thenComparing(FacetValue::value);

  private LogFacets() {}

  public static List<FieldFacet> compute(List<LogEntry> entries, List<String> fields) {
    if (fields == null || fields.isEmpty()) return List.of();
    List<LogEntry> src = entries == null ? List.of() : entries;

    ArrayList<FieldFacet> out = new ArrayList<>(fields.size());
    for (String rawField : fields) {
      String field = Objects.toString(rawField, "").trim().toLowerCase(Locale.ROOT);
      if (field.isEmpty()) continue;

      Map<String, Integer> counts = new HashMap<>();
      for (LogEntry e : src) {
        String value = valueOf(e, field);
        if (value.isEmpty()) continue;
        counts.merge(value, 1, Integer::sum);
      }

      ArrayList<FacetValue> values = new ArrayList<>(counts.size());
      counts.forEach((v, c) -> values.add(new FacetValue(v, c)));
      values.sort(ORDER);
      out.add(new FieldFacet(field, values));
    }
    return List.copyOf(out);
  }

  private static String valueOf(LogEntry e, String field) {
    if ("level".equals(field)) return e.level().label();
    return e.labels().get(field);
  }
}
