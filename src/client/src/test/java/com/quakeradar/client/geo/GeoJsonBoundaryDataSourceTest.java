package com.quakeradar.client.geo;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class GeoJsonBoundaryDataSourceTest {
  private final ObjectMapper objectMapper = new ObjectMapper();

  @Test
  void readsPolygonsAndMultiPolygonsWithTheirCodes() {
    List<BoundaryPolygon> polygons =
        new GeoJsonBoundaryDataSource("classpath:boundaries/test-boundaries.geojson", objectMapper).load();

    assertThat(polygons).extracting(BoundaryPolygon::countryCode).containsExactly("AA", "BB", "BB");
    // GeoJSON positions are [lon, lat].
    assertThat(polygons.get(0).vertices().get(1)).isEqualTo(new GeoPoint(0, 10));
  }

  @Test
  void ignoresHolesAndUnusableFeatures() {
    BoundaryIndex index = new PolygonBoundaryIndex(
        new GeoJsonBoundaryDataSource("classpath:boundaries/test-boundaries.geojson", objectMapper).load());

    assertThat(index.contains(new GeoPoint(31.5, 31.5), "BB")).isTrue();
    assertThat(index.isKnown("CC")).isFalse();
    assertThat(index.countryCodes()).containsExactlyInAnyOrder("AA", "BB");
  }

  @Test
  void failsFastWhenTheDatasetIsMissing() {
    GeoJsonBoundaryDataSource source =
        new GeoJsonBoundaryDataSource("classpath:boundaries/does-not-exist.geojson", objectMapper);

    assertThatThrownBy(source::load)
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("does-not-exist.geojson");
  }

  @Test
  void failsFastWhenTheLocationIsEmpty() {
    assertThatThrownBy(new GeoJsonBoundaryDataSource(" ", objectMapper)::load)
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("usgs.boundaries.location");
  }

  @Test
  void bundledDatasetCoversTurkey() {
    BoundaryIndex index = bundled();

    assertThat(index.contains(new GeoPoint(39.93, 32.85), "TR")).as("Ankara").isTrue();
    assertThat(index.contains(new GeoPoint(41.01, 28.98), "TR")).as("Istanbul").isTrue();
    assertThat(index.contains(new GeoPoint(38.67, 39.22), "TR")).as("Elazig").isTrue();
    assertThat(index.contains(new GeoPoint(37.98, 23.73), "TR")).as("Athens").isFalse();
    assertThat(index.contains(new GeoPoint(36.20, 37.16), "TR")).as("Aleppo").isFalse();
  }

  @Test
  void bundledDatasetHandlesIslandsAndTheAntiMeridian() {
    BoundaryIndex index = bundled();

    assertThat(index.contains(new GeoPoint(43.06, 141.35), "JP")).as("Sapporo").isTrue();
    assertThat(index.contains(new GeoPoint(35.68, 139.69), "JP")).as("Tokyo").isTrue();
    assertThat(index.contains(new GeoPoint(-18.14, 178.44), "FJ")).as("Suva").isTrue();
    assertThat(index.contains(new GeoPoint(-17.0, -179.9), "FJ")).as("east of 180").isTrue();
    assertThat(index.contains(new GeoPoint(-17.0, -170.0), "FJ")).isFalse();
    assertThat(index.contains(new GeoPoint(19.6, -155.5), "US")).as("Hawaii").isTrue();
  }

  @ParameterizedTest(name = "{0} contains {1}")
  @CsvSource({
      "ID, Jakarta, -6.20, 106.85",
      "ID, Palu, -0.90, 119.87",
      "MX, Mexico City, 19.43, -99.13",
      "CN, Chengdu, 30.57, 104.07",
      "IR, Tehran, 35.69, 51.39",
      "PE, Lima, -12.05, -77.03",
      "PH, Manila, 14.60, 120.98",
      "DE, Berlin, 52.52, 13.40",
      "IN, Delhi, 28.61, 77.20",
      "NP, Kathmandu, 27.71, 85.32",
      "GR, Athens, 37.98, 23.73",
      "SY, Aleppo, 36.20, 37.16",
      "EC, Quito, -0.18, -78.47",
      "AR, Mendoza, -32.89, -68.84",
      "CA, Vancouver, 49.28, -123.12",
      "PG, Port Moresby, -9.44, 147.18",
      "TO, Nukualofa, -21.13, -175.20",
      "RU, Petropavlovsk-Kamchatsky, 53.00, 158.65",
      "RU, Chukotka east of 180, 65.00, -175.00",
      "ZA, Cape Town, -33.92, 18.42",
      "KE, Nairobi, -1.29, 36.82",
      "AU, Sydney, -33.87, 151.21",
      "IS, Reykjavik, 64.15, -21.94"
  })
  void bundledDatasetCoversCountriesWorldwide(String code, String place, double latitude, double longitude) {
    BoundaryIndex index = bundled();

    assertThat(index.isKnown(code)).as(code).isTrue();
    assertThat(index.contains(new GeoPoint(latitude, longitude), code)).as(place).isTrue();
  }

  @Test
  void bundledDatasetListsEveryCountryCode() {
    BoundaryIndex index = bundled();

    assertThat(index.countryCodes()).hasSizeGreaterThan(240).contains("JP", "NZ", "CL", "US", "FJ", "AQ");
    assertThat(index.isKnown("ZZ")).isFalse();
  }

  private BoundaryIndex bundled() {
    return new PolygonBoundaryIndex(
        new GeoJsonBoundaryDataSource("classpath:boundaries/countries.geojson", objectMapper).load());
  }
}
