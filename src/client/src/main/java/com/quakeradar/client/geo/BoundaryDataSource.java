package com.quakeradar.client.geo;

import java.util.List;

/** Supplies raw boundary polygons when a {@link LazyBoundaryIndex} is first used. */
@FunctionalInterface
public interface BoundaryDataSource {
  List<BoundaryPolygon> load();
}
