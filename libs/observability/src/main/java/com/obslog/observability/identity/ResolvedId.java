package com.obslog.observability.identity;

/**
 * Outcome of reconciling an upstream-supplied identifier with the locally known one.
 *
 * @param value       the accepted identifier, null when none could be resolved
 * @param upstreamRaw the rejected upstream value kept verbatim for diagnostics, null when the
 *                    upstream value was accepted or absent
 */
public record ResolvedId(String value, String upstreamRaw) {

    private static final ResolvedId NONE = new ResolvedId(null, null);

    /** Nothing resolved and nothing rejected. */
    public static ResolvedId none() {
        return NONE;
    }

    /** An accepted identifier with no diagnostic. */
    public static ResolvedId accepted(String value) {
        return new ResolvedId(value, null);
    }

    public boolean isPresent() {
        return value != null;
    }
}
