package com.archsketch.core.model;

import java.util.Objects;

/**
 * A file skipped during aggregation, with the reason it was skipped.
 *
 * @param component component label of the file
 * @param file relative path of the file
 * @param reason human-readable failure reason
 */
public record FileFailure(String component, String file, String reason) {

    public FileFailure {
        Objects.requireNonNull(file, "file must not be null");
        if (component == null) {
            component = "";
        }
        if (reason == null) {
            reason = "unknown error";
        }
    }
}
