package ca.gc.cra.funnel.infrastructure.intercept;

import java.util.List;
import org.slf4j.Marker;
import org.slf4j.MarkerFactory;

/**
 * SLF4J marker carried by events an aggregation consumer dispatched into its sink.
 */
public final class AggregationMarkers {
  /** Marker name; stable so log configurations can filter on it. */
  public static final String HANDLED_NAME = "FUNNEL_AGGREGATED";

  /** Handled-marker instance. */
  public static final Marker HANDLED = MarkerFactory.getMarker(HANDLED_NAME);

  private AggregationMarkers() {}

  /**
   * Tests whether an event's markers include the handled-marker, directly or as a reference.
   *
   * @param markers markers of an event; may be {@code null}
   * @return {@code true} when the event was already aggregated
   */
  public static boolean isHandled(List<Marker> markers) {
    if (markers == null || markers.isEmpty()) {
      return false;
    }
    for (Marker marker : markers) {
      if (marker != null && marker.contains(HANDLED_NAME)) {
        return true;
      }
    }
    return false;
  }
}
