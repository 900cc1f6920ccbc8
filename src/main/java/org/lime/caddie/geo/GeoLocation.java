package org.lime.caddie.geo;

public record GeoLocation(double lat, double lng, String label, String stateCode) {
}
