package com.microsoft.capacityplanner.formulation;

public enum OptimizationDirection {
    MINIMIZE
}
