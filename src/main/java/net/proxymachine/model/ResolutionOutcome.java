package net.proxymachine.model;

import java.util.Locale;

/**
 * Per-request result of name resolution. A miss is a value, not an exception.
 */
public record ResolutionOutcome(CardRequest request, Status status, Print print, MatchTier tier, String detail) {

    public enum Status {
        RESOLVED,
        NOT_FOUND
    }

    public static ResolutionOutcome resolved(CardRequest request, Print print, MatchTier tier) {
        return new ResolutionOutcome(request, Status.RESOLVED, print, tier,
            tier.name().toLowerCase(Locale.ROOT) + " match " + print.getName() + " [" + print.getSetCode() + " " + print.getCollectorNumber() + "]");
    }

    public static ResolutionOutcome notFound(CardRequest request) {
        return new ResolutionOutcome(request, Status.NOT_FOUND, null, null, "no print matches '" + request.name() + "'");
    }

    public boolean isResolved() {
        return status == Status.RESOLVED;
    }
}
