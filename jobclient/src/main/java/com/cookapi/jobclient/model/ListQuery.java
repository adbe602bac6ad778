package com.cookapi.jobclient.model;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Filter for {@code GET /list}: jobs run by {@code user} in the given states,
 * optionally bounded by submission time and result count.
 *
 * @param user   defaults to the {@code user.name} system property when null
 * @param states defaults to every {@link ListState} when null or empty
 * @param limit  null for no limit; otherwise must be positive
 */
public record ListQuery(
        String        user,
        Set<ListState> states,
        Instant       start,
        Instant       stop,
        Integer       limit
) {
    public ListQuery {
        if (user == null || user.isBlank()) user = System.getProperty("user.name");
        states = Collections.unmodifiableSet(states == null || states.isEmpty()
                ? EnumSet.allOf(ListState.class)
                : EnumSet.copyOf(states));
        if (limit != null && limit <= 0) {
            throw new IllegalArgumentException("limit must be positive, got " + limit);
        }
        if (start != null && stop != null && stop.isBefore(start)) {
            throw new IllegalArgumentException("stop " + stop + " is before start " + start);
        }
    }

    /** All of {@code user}'s jobs, in any state, with no time bounds. */
    public static ListQuery forUser(String user) {
        return new ListQuery(user, null, null, null, null);
    }
}
