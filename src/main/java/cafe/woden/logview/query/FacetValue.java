package cafe.woden.logview.query;

/** One distinct label value and how many entries carry it. */
public record FacetValue(String value, int count) {}
