package com.quakeradar.client.filter;

import com.quakeradar.client.error.Outcome;
import com.quakeradar.client.geo.BoundaryIndex;
import com.quakeradar.client.geo.BoundaryPolygon;
import com.quakeradar.client.model.EarthquakeRecord;
import com.quakeradar.client.model.ResultSet;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Keeps only the events whose epicenter lies inside a country's boundary polygons. */
public class CountryFilter {
  private static final Logger log = LoggerFactory.getLogger(CountryFilter.class);

  private final BoundaryIndex boundaryIndex;

  public CountryFilter(BoundaryIndex boundaryIndex) {
    this.boundaryIndex = boundaryIndex;
  }

  /**
   * Filters a result set by country.
   *
   * @param resultSet records to filter; left untouched
   * @param countryCode ISO-3166 alpha-2 code
   * @return a new result set in the original order, {@code UNKNOWN_COUNTRY}, or
   *     {@code BOUNDARY_DATA}
   */
  public Outcome<ResultSet> apply(ResultSet resultSet, String countryCode) {
    Outcome<List<BoundaryPolygon>> polygons = boundaryIndex.polygonsFor(countryCode);
    if (!polygons.isSuccess()) {
      return Outcome.failure(polygons.error());
    }

    List<EarthquakeRecord> kept = new ArrayList<>();
    for (EarthquakeRecord record : resultSet.records()) {
      if (record.epicenter() != null && boundaryIndex.contains(record.epicenter(), countryCode)) {
        kept.add(record);
      }
    }
    log.debug("Country filter {} kept {} of {} events", countryCode, kept.size(), resultSet.count());
    return Outcome.success(resultSet.withRecords(kept));
  }
}
