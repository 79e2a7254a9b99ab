package com.microsoft.capacityplanner.formulation;

/**
 * The three variable families of a capacity planning model.
 */
public enum VariableKind {
    /** On-demand instances running in a period. */
    ON_DEMAND,
    /** Reserved instances of a tier running in a period. */
    RESERVED,
    /** Commitments purchased for a tier, shared by every period. */
    RESERVATION
}
