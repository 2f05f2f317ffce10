package com.regolith.core.flavor;

import java.util.Objects;

/**
 * A flag letter accepted by a flavor.
 *
 * @param flag the flag character (e.g., {@code 'i'})
 * @param name short name (e.g., "case-insensitive")
 * @param description longer description of what the flag does
 */
public record FlagInfo(char flag, String name, String description) {

    public FlagInfo {
        Objects.requireNonNull(name, "name must not be null");
        if (description == null) {
            description = "";
        }
    }
}
