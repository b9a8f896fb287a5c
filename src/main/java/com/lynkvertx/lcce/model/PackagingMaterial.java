package com.lynkvertx.lcce.model;

public enum PackagingMaterial {
    CARDBOARD,
    PLASTIC,
    WOOD,
    METAL
}
