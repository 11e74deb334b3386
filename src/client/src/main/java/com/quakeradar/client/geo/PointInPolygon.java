package com.quakeradar.client.geo;

/**
 * Even-odd ray casting over a vertex ring stored as parallel primitive arrays.
 *
 * <p>Longitudes must be unwrapped with {@link #unwrapLongitudes(double[])} so that consecutive
 * vertices never jump across the anti-meridian. The test point is then tried at its own longitude
 * and at every 360° shift that falls within the ring's longitude span. Points on an edge or vertex
 * count as inside.
 */
public final class PointInPolygon {
  private static final double EPSILON = 1e-9;

  private PointInPolygon() {}

  /**
   * Rewrites longitudes so each edge follows the shorter arc between its two vertices.
   *
   * @param longitudes raw ring longitudes
   * @return new array where {@code out[i] - out[i - 1]} is always within [-180, 180]
   */
  public static double[] unwrapLongitudes(double[] longitudes) {
    double[] unwrapped = new double[longitudes.length];
    if (longitudes.length == 0) {
      return unwrapped;
    }
    unwrapped[0] = normalizeLongitude(longitudes[0]);
    for (int i = 1; i < longitudes.length; i++) {
      unwrapped[i] = unwrapped[i - 1] + shortestDelta(longitudes[i - 1], longitudes[i]);
    }
    return unwrapped;
  }

  /**
   * Tests ring membership.
   *
   * @param latitudes ring latitudes
   * @param unwrappedLongitudes ring longitudes, unwrapped
   * @param latitude point latitude
   * @param longitude point longitude, any range
   * @return {@code true} when the point is inside or on the boundary
   */
  public static boolean contains(double[] latitudes, double[] unwrappedLongitudes, double latitude, double longitude) {
    int n = latitudes.length;
    if (n < 3 || unwrappedLongitudes.length != n) {
      return false;
    }
    double minLon = Double.POSITIVE_INFINITY;
    double maxLon = Double.NEGATIVE_INFINITY;
    for (double lon : unwrappedLongitudes) {
      minLon = Math.min(minLon, lon);
      maxLon = Math.max(maxLon, lon);
    }

    double base = normalizeLongitude(longitude);
    for (int k = -2; k <= 2; k++) {
      double candidate = base + 360.0 * k;
      if (candidate < minLon - EPSILON || candidate > maxLon + EPSILON) {
        continue;
      }
      if (containsPlanar(latitudes, unwrappedLongitudes, latitude, candidate)) {
        return true;
      }
    }
    return false;
  }

  /** Maps any longitude into [-180, 180). */
  public static double normalizeLongitude(double longitude) {
    double value = (longitude + 180.0) % 360.0;
    if (value < 0) {
      value += 360.0;
    }
    return value - 180.0;
  }

  static double shortestDelta(double from, double to) {
    double delta = (to - from) % 360.0;
    if (delta > 180.0) {
      delta -= 360.0;
    } else if (delta < -180.0) {
      delta += 360.0;
    }
    return delta;
  }

  private static boolean containsPlanar(double[] ys, double[] xs, double py, double px) {
    boolean inside = false;
    int n = ys.length;
    for (int i = 0, j = n - 1; i < n; j = i++) {
      double yi = ys[i];
      double xi = xs[i];
      double yj = ys[j];
      double xj = xs[j];
      if (onSegment(px, py, xi, yi, xj, yj)) {
        return true;
      }
      if ((yi > py) != (yj > py)) {
        double crossX = (xj - xi) * (py - yi) / (yj - yi) + xi;
        if (px < crossX) {
          inside = !inside;
        }
      }
    }
    return inside;
  }

  private static boolean onSegment(double px, double py, double x1, double y1, double x2, double y2) {
    if (px < Math.min(x1, x2) - EPSILON || px > Math.max(x1, x2) + EPSILON
        || py < Math.min(y1, y2) - EPSILON || py > Math.max(y1, y2) + EPSILON) {
      return false;
    }
    double cross = (x2 - x1) * (py - y1) - (y2 - y1) * (px - x1);
    double length = Math.hypot(x2 - x1, y2 - y1);
    return Math.abs(cross) <= EPSILON * Math.max(1.0, length);
  }
}
