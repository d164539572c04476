package com.example.access.catalog.model;

import com.example.access.common.util.StringSanitizer;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Validated permission identifier: lowercase snake case, 2 to 64 characters.
 *
 * <p>Equality is exact string match. {@link #ADMIN} is the global override code and
 * is interpreted only by the authorization resolver.
 */
public record PermissionCode(String value) implements Comparable<PermissionCode> {

    private static final Pattern FORMAT = Pattern.compile("^[a-z][a-z0-9_]{1,63}$");

    public static final PermissionCode ADMIN = new PermissionCode("admin");

    public PermissionCode {
        if (!isWellFormed(value)) {
            throw new IllegalArgumentException("Malformed permission code: '" + StringSanitizer.forLog(value) + "'");
        }
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static PermissionCode of(String value) {
        return new PermissionCode(value);
    }

    /**
     * Lenient variant of {@link #of(String)} for untrusted input.
     */
    public static Optional<PermissionCode> parse(String value) {
        return isWellFormed(value) ? Optional.of(new PermissionCode(value)) : Optional.empty();
    }

    public static boolean isWellFormed(String value) {
        return value != null && FORMAT.matcher(value).matches();
    }

    public boolean isAdmin() {
        return ADMIN.equals(this);
    }

    @JsonValue
    @Override
    public String value() {
        return value;
    }

    @Override
    public int compareTo(PermissionCode other) {
        return value.compareTo(other.value);
    }

    @Override
    public String toString() {
        return value;
    }
}
