package com.propertyintel.price.model;

public record GeoPoint(double latitude, double longitude) {
}
