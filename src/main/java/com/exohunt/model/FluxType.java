package com.exohunt.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Flux products a light-curve file may carry.
 * PDCSAP is systematics-corrected and preferred; SAP is the simple aperture sum.
 */
public enum FluxType {

    PDCSAP("pdcsap_flux"),
    SAP("sap_flux");

    private final String columnName;

    FluxType(String columnName) {
        this.columnName = columnName;
    }

    public String getColumnName() {
        return columnName;
    }

    /**
     * The flux type to try when this one is absent from a file.
     */
    public FluxType fallback() {
        return this == PDCSAP ? SAP : PDCSAP;
    }

    /**
     * Look up a flux type by its column name, ignoring case (e.g., "PDCSAP_FLUX").
     */
    public static Optional<FluxType> fromColumnName(String name) {
        return Arrays.stream(values())
                .filter(t -> t.columnName.equalsIgnoreCase(name))
                .findFirst();
    }
}
