package com.lynkvertx.lcce.model;

/**
 * Incoterms 2020 codes.
 */
public enum Incoterm {
    EXW,
    FCA,
    FAS,
    FOB,
    CFR,
    CIF,
    CPT,
    CIP,
    DAP,
    DPU,
    DDP
}
