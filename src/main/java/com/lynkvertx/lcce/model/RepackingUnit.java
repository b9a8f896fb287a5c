package com.lynkvertx.lcce.model;

public enum RepackingUnit {
    PER_PART,
    PER_TRAY,
    PER_BAG_OR_BULK
}
