package com.lynkvertx.lcce.model;

public enum TransportMode {
    ROAD,
    RAIL,
    SEA
}
