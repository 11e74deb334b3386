package com.quakeradar.client.query;

import com.quakeradar.client.error.ErrorKind;
import com.quakeradar.client.error.Outcome;
import com.quakeradar.client.geo.BoundaryIndex;
import com.quakeradar.client.geo.BoundaryPolygon;
import java.util.List;

/**
 * Checks a {@link QueryDescriptor} before it may be sent.
 *
 * <p>Checks run in a fixed order and stop at the first failure: time range, magnitude range,
 * country code.
 */
public class ParameterValidator {
  public static final double MIN_MAGNITUDE = 0.0;
  public static final double MAX_MAGNITUDE = 10.0;

  private final BoundaryIndex boundaryIndex;

  public ParameterValidator(BoundaryIndex boundaryIndex) {
    this.boundaryIndex = boundaryIndex;
  }

  /**
   * Validates a descriptor without modifying it.
   *
   * @param descriptor criteria to check
   * @return the same descriptor, or the first failure found
   */
  public Outcome<QueryDescriptor> validate(QueryDescriptor descriptor) {
    if (descriptor.startTime() != null
        && descriptor.endTime() != null
        && descriptor.startTime().isAfter(descriptor.endTime())) {
      return Outcome.failure(
          ErrorKind.TIME_RANGE,
          "Start time " + descriptor.startTime() + " is after end time " + descriptor.endTime());
    }

    Double min = descriptor.minMagnitude();
    Double max = descriptor.maxMagnitude();
    if (min != null && (min.isNaN() || min < MIN_MAGNITUDE || min > MAX_MAGNITUDE)) {
      return Outcome.failure(ErrorKind.MAGNITUDE_RANGE, "Minimum magnitude must be within [0, 10], got " + min);
    }
    if (max != null && (max.isNaN() || max < MIN_MAGNITUDE || max > MAX_MAGNITUDE)) {
      return Outcome.failure(ErrorKind.MAGNITUDE_RANGE, "Maximum magnitude must be within [0, 10], got " + max);
    }
    if (min != null && max != null && min > max) {
      return Outcome.failure(
          ErrorKind.MAGNITUDE_RANGE, "Minimum magnitude " + min + " is greater than maximum " + max);
    }

    if (descriptor.hasCountryCode()) {
      // UNKNOWN_COUNTRY, or BOUNDARY_DATA when the dataset cannot be loaded.
      Outcome<List<BoundaryPolygon>> polygons = boundaryIndex.polygonsFor(descriptor.countryCode());
      if (!polygons.isSuccess()) {
        return Outcome.failure(polygons.error());
      }
    }
    return Outcome.success(descriptor);
  }
}
