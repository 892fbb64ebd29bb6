/*
 * どこで: Exchange ドメインモデル
 * 何を: 度単位の緯度経度と大圏距離
 * なぜ: オファーとリクエストの近さは平面ではなく球面上で判定するため
 */
package com.example.exchange.model;

public record GeoPoint(double latitude, double longitude) {

  /** 地球の平均半径 (IUGG)。メートル。 */
  public static final double EARTH_RADIUS_METERS = 6_371_008.8;

  public boolean isValid() {
    return Double.isFinite(latitude)
        && Double.isFinite(longitude)
        && latitude >= -90.0
        && latitude <= 90.0
        && longitude >= -180.0
        && longitude <= 180.0;
  }

  /** {@code other} までの haversine 距離 (メートル)。 */
  public double distanceMeters(GeoPoint other) {
    final double lat1 = Math.toRadians(latitude);
    final double lat2 = Math.toRadians(other.latitude);
    final double deltaLat = lat2 - lat1;
    final double deltaLon = Math.toRadians(other.longitude - longitude);
    final double sinLat = Math.sin(deltaLat / 2);
    final double sinLon = Math.sin(deltaLon / 2);
    final double a = sinLat * sinLat + Math.cos(lat1) * Math.cos(lat2) * sinLon * sinLon;
    final double c = 2 * Math.atan2(Math.sqrt(a), Math.sqrt(Math.max(0.0, 1 - a)));
    return EARTH_RADIUS_METERS * c;
  }
}
