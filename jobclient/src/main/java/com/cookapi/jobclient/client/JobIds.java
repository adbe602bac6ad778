package com.cookapi.jobclient.client;

import java.util.Optional;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Job identifier parsing. Only canonical 8-4-4-4-12 hex strings are accepted;
 * {@link UUID#fromString} alone would also take forms like {@code 1-2-3-4-5}.
 */
public final class JobIds {

    private static final Pattern CANONICAL = Pattern.compile(
            "[0-9a-fA-F]{8}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{12}");

    private JobIds() {}

    public static Optional<UUID> parse(String id) {
        if (id == null || !CANONICAL.matcher(id.trim()).matches()) {
            return Optional.empty();
        }
        return Optional.of(UUID.fromString(id.trim()));
    }

    public static boolean isValid(String id) {
        return parse(id).isPresent();
    }
}
