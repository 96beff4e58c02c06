package com.di.fragnova.residency;

public enum ResidencyStatus {
    RESIDENT,
    MIGRATING
}
