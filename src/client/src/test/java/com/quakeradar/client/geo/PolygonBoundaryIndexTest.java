package com.quakeradar.client.geo;

import static org.assertj.core.api.Assertions.assertThat;

import com.quakeradar.client.error.ErrorKind;
import com.quakeradar.client.error.Outcome;
import java.util.List;
import org.junit.jupiter.api.Test;

class PolygonBoundaryIndexTest {

  static BoundaryPolygon square(String code, double lat, double lon, double size) {
    return new BoundaryPolygon(code, List.of(
        new GeoPoint(lat, lon),
        new GeoPoint(lat, lon + size),
        new GeoPoint(lat + size, lon + size),
        new GeoPoint(lat + size, lon)));
  }

  @Test
  void containsUsesTheUnionOfACountrysPolygons() {
    BoundaryIndex index = new PolygonBoundaryIndex(List.of(
        square("JP", 30, 130, 5),
        square("JP", 40, 140, 5),
        square("KR", 34, 126, 3)));

    assertThat(index.contains(new GeoPoint(32, 132), "JP")).isTrue();
    assertThat(index.contains(new GeoPoint(42, 142), "JP")).isTrue();
    assertThat(index.contains(new GeoPoint(37, 137), "JP")).isFalse();
    assertThat(index.contains(new GeoPoint(35, 127), "JP")).isFalse();
    assertThat(index.contains(new GeoPoint(35, 127), "KR")).isTrue();
  }

  @Test
  void overlappingClaimsAreAnsweredPerRequestedCode() {
    BoundaryIndex index = new PolygonBoundaryIndex(List.of(square("AA", 0, 0, 10), square("BB", 5, 5, 10)));

    GeoPoint shared = new GeoPoint(7, 7);
    assertThat(index.contains(shared, "AA")).isTrue();
    assertThat(index.contains(shared, "BB")).isTrue();
  }

  @Test
  void matchesCountryCodesCaseInsensitively() {
    BoundaryIndex index = new PolygonBoundaryIndex(List.of(square("tr", 36, 26, 6)));

    assertThat(index.isKnown("TR")).isTrue();
    assertThat(index.isKnown(" tr ")).isTrue();
    assertThat(index.contains(new GeoPoint(39, 30), "Tr")).isTrue();
    assertThat(index.countryCodes()).containsExactly("TR");
  }

  @Test
  void reportsUnknownCountries() {
    BoundaryIndex index = new PolygonBoundaryIndex(List.of(square("TR", 36, 26, 6)));

    Outcome<List<BoundaryPolygon>> polygons = index.polygonsFor("ZZ");

    assertThat(polygons.isSuccess()).isFalse();
    assertThat(polygons.error().kind()).isEqualTo(ErrorKind.UNKNOWN_COUNTRY);
    assertThat(index.contains(new GeoPoint(39, 30), "ZZ")).isFalse();
    assertThat(index.isKnown(null)).isFalse();
  }

  @Test
  void returnsEveryPolygonOfACountry() {
    BoundaryIndex index = new PolygonBoundaryIndex(List.of(square("JP", 30, 130, 5), square("JP", 40, 140, 5)));

    assertThat(index.polygonsFor("jp").value()).hasSize(2).allMatch(polygon -> polygon.countryCode().equals("JP"));
  }
}
