package com.quakeradar.client.geo;

import com.quakeradar.client.error.ErrorKind;
import com.quakeradar.client.error.Outcome;
import com.quakeradar.client.error.QueryError;
import java.util.List;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link BoundaryIndex} that loads its {@link BoundaryDataSource} on first use and never again.
 *
 * <p>After the first successful load every call reads a volatile reference without locking. A
 * failed load is not cached; the next call retries it. While the dataset is unavailable
 * {@link #polygonsFor} reports {@code BOUNDARY_DATA} and the boolean lookups answer {@code false}.
 */
public final class LazyBoundaryIndex implements BoundaryIndex {
  private static final Logger log = LoggerFactory.getLogger(LazyBoundaryIndex.class);

  private final BoundaryDataSource dataSource;
  private volatile BoundaryIndex delegate;

  public LazyBoundaryIndex(BoundaryDataSource dataSource) {
    this.dataSource = dataSource;
  }

  @Override
  public Outcome<List<BoundaryPolygon>> polygonsFor(String countryCode) {
    return resolve().flatMap(index -> index.polygonsFor(countryCode));
  }

  @Override
  public boolean contains(GeoPoint point, String countryCode) {
    Outcome<BoundaryIndex> index = resolve();
    return index.isSuccess() && index.value().contains(point, countryCode);
  }

  @Override
  public boolean isKnown(String countryCode) {
    Outcome<BoundaryIndex> index = resolve();
    return index.isSuccess() && index.value().isKnown(countryCode);
  }

  @Override
  public Set<String> countryCodes() {
    Outcome<BoundaryIndex> index = resolve();
    return index.isSuccess() ? index.value().countryCodes() : Set.of();
  }

  public boolean isLoaded() {
    return delegate != null;
  }

  private Outcome<BoundaryIndex> resolve() {
    BoundaryIndex current = delegate;
    if (current != null) {
      return Outcome.success(current);
    }
    synchronized (this) {
      if (delegate == null) {
        try {
          List<BoundaryPolygon> polygons = dataSource.load();
          PolygonBoundaryIndex loaded = new PolygonBoundaryIndex(polygons);
          log.info("Boundary index loaded: {} polygons across {} countries",
              polygons.size(), loaded.countryCodes().size());
          delegate = loaded;
        } catch (RuntimeException ex) {
          log.error("Boundary index unavailable: {}", ex.getMessage());
          return Outcome.failure(QueryError.of(ErrorKind.BOUNDARY_DATA, ex.getMessage(), ex));
        }
      }
      return Outcome.success(delegate);
    }
  }
}
