package com.lynkvertx.lcce.model;

/**
 * Special packaging (SP) variants used instead of the standard box / pallet combination.
 */
public enum SpecialPackagingVariant {
    /** Inlay trays placed inside standard boxes */
    INLAY_TRAY,
    /** Inlay trays sized to a full pallet footprint */
    INLAY_TRAY_PALLET_SIZE,
    /** Self-stacking trays on dedicated special pallets */
    STANDALONE_TRAY,
    NONE
}
