package net.proxymachine.model;

import java.util.List;

/**
 * Output of relationship resolution.
 *
 * @param prints        resolved prints, deduplicated, seeds first then expansions in discovery order
 * @param outcomes      one outcome per request, in request order
 * @param missing       requested names that matched nothing, then related parts that could not be found
 * @param expandedCount prints added by relationship expansion
 */
public record ResolutionReport(List<Print> prints,
                               List<ResolutionOutcome> outcomes,
                               List<String> missing,
                               int expandedCount) {

    public ResolutionReport {
        prints = List.copyOf(prints);
        outcomes = List.copyOf(outcomes);
        missing = List.copyOf(missing);
    }

    public List<String> printIds() {
        return prints.stream().map(Print::getId).toList();
    }
}
