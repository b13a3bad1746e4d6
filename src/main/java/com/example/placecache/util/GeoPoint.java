package com.example.placecache.util;

public record GeoPoint(double lat, double lng) {
}
