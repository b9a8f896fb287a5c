package com.lynkvertx.lcce.model;

/**
 * Logistics unit carriers available in the pallet catalog.
 */
public enum PalletType {
    EUR_PALLET,
    INDUSTRIAL_PALLET,
    PLASTIC_PALLET,
    ONE_WAY_PALLET
}
