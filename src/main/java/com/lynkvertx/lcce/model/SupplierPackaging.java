package com.lynkvertx.lcce.model;

/**
 * One-way packaging the supplier ships in.
 */
public enum SupplierPackaging {
    NOT_APPLICABLE,
    ONE_WAY_TRAY_IN_BOX,
    BULK_IN_BOX,
    ONE_WAY_BLISTER_IN_BOX
}
