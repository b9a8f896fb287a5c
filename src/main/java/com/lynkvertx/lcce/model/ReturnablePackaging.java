package com.lynkvertx.lcce.model;

/**
 * Returnable packaging used at the receiving plant.
 */
public enum ReturnablePackaging {
    NOT_APPLICABLE,
    RETURNABLE_TRAYS,
    ONE_WAY_TRAY_IN_KLT,
    KLT
}
