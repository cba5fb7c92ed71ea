package cafe.woden.logview.query;

import java.util.List;

/** Distinct values of one field, most frequent first. */
public record FieldFacet(String field, List<FacetValue> values) {
  public FieldFacet {
    values = values == null ? List.of() : List.copyOf(values);
  }
}
