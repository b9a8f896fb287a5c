package com.lynkvertx.lcce.model;

/**
 * Standard box types available in the box catalog.
 */
public enum BoxType {
    KLT_3147,
    KLT_4147,
    KLT_4280,
    KLT_6147,
    KLT_6280,
    GLT_1210,
    CARDBOARD_SMALL,
    CARDBOARD_MEDIUM,
    CARDBOARD_LARGE,
    WOODEN_BOX,
    WOODEN_CRATE
}
