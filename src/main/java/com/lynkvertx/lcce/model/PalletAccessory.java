package com.lynkvertx.lcce.model;

/**
 * Extra packaging required when special packaging travels on its own pallet.
 */
public enum PalletAccessory {
    SPECIAL_PALLET,
    COVER
}
