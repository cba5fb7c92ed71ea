package cafe.woden.logview.window;

/**
 * The virtualization host that measures and paints visible rows.
 *
 * <p>Hosts typically cache row positions keyed by flat index; those caches are only valid until
 * {@link #invalidateMeasurements()} is called.
 */
public interface WindowedViewHost {

  /** Drop any cached row positions; earlier flat indices may now address different items. */
  void invalidateMeasurements();

  /** The flat item count changed. Append-only growth keeps earlier positions valid. */
  default void itemCountChanged(int itemCount) {}
}
