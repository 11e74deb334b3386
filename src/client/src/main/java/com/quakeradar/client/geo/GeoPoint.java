package com.quakeradar.client.geo;

/**
 * Geographic point in decimal degrees.
 *
 * @param latitude latitude in [-90, 90]
 * @param longitude longitude, usually in [-180, 180]
 */
public record GeoPoint(double latitude, double longitude) {}
