package com.propertyintel.price.model;

/**
 * Land Registry property type codes.
 */
public enum PropertyType {
    /** Flat or maisonette */
    F,
    /** Semi-detached */
    S,
    /** Detached */
    D,
    /** Terraced */
    T,
    /** Other */
    O;

    public String code() {
        return name();
    }
}
