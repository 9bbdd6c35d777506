package net.proxymachine.service.resolve;

import net.proxymachine.model.CardRequest;
import net.proxymachine.model.MatchTier;
import net.proxymachine.model.NamePreference;
import net.proxymachine.model.Print;
import net.proxymachine.model.RelationshipEdge;
import net.proxymachine.model.RelationshipKind;
import net.proxymachine.model.ResolutionOptions;
import net.proxymachine.model.ResolutionOutcome;
import net.proxymachine.model.ResolutionReport;
import net.proxymachine.service.CardIndexService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Turns requested card names into the complete set of prints to fetch.
 * <p>
 * Each name resolves to its best-scoring print (exact over prefix over substring, ties
 * broken by {@link PrintPreference}). The seeds are then expanded breadth-first along
 * relationship edges: sibling faces and parts, meld partners and results, and created
 * tokens. Token prints only follow their own token edges; their links back to the cards
 * that create them are not followed. A visited set bounds the walk, so cyclic edges
 * terminate and no print appears twice.
 */
@Service
public class RelationshipResolver {

    private static final Logger log = LoggerFactory.getLogger(RelationshipResolver.class);

    private static final List<MatchTier> TIERS = List.of(MatchTier.values());

    private final CardIndexService cardIndex;

    public RelationshipResolver(CardIndexService cardIndex) {
        this.cardIndex = cardIndex;
    }

    /**
     * Resolves and expands the requests. Names that match nothing are reported in the
     * result; they never abort resolution.
     *
     * @throws net.proxymachine.exception.DatabaseUnavailableException when the index cannot be read
     */
    public ResolutionReport resolve(List<CardRequest> requests, ResolutionOptions options) {
        Map<String, Print> resolved = new LinkedHashMap<>();
        List<ResolutionOutcome> outcomes = new ArrayList<>(requests.size());
        Set<String> missing = new LinkedHashSet<>();
        List<Print> frontier = new ArrayList<>();

        for (CardRequest request : requests) {
            Optional<ScoredPrint> best = StringUtils.hasText(request.name())
                ? bestMatch(request, options, false, TIERS)
                : Optional.empty();
            if (best.isEmpty()) {
                outcomes.add(ResolutionOutcome.notFound(request));
                missing.add(request.name() == null ? "" : request.name());
                continue;
            }
            Print print = best.get().print();
            outcomes.add(ResolutionOutcome.resolved(request, print, best.get().tier()));
            if (resolved.putIfAbsent(print.getId(), print) == null) {
                frontier.add(print);
            }
        }

        int expanded = 0;
        while (!frontier.isEmpty()) {
            List<Print> next = new ArrayList<>();
            for (Print discovered : expand(frontier, resolved, missing, options)) {
                if (resolved.putIfAbsent(discovered.getId(), discovered) == null) {
                    next.add(discovered);
                    expanded++;
                }
            }
            frontier = next;
        }

        log.info("Resolved {} request(s) into {} print(s): expanded={} missing={}",
            requests.size(), resolved.size(), expanded, missing.size());
        return new ResolutionReport(new ArrayList<>(resolved.values()), outcomes, new ArrayList<>(missing), expanded);
    }

    /**
     * One breadth-first level: prints reachable over a single followed edge from the
     * frontier and not yet resolved, in frontier order then edge order.
     */
    private List<Print> expand(List<Print> frontier, Map<String, Print> resolved, Set<String> missing,
                               ResolutionOptions options) {
        Map<String, Print> frontierById = new LinkedHashMap<>();
        frontier.forEach(print -> frontierById.put(print.getId(), print));

        Map<String, List<RelationshipEdge>> edgesBySource = new LinkedHashMap<>();
        for (RelationshipEdge edge : cardIndex.findRelationships(frontierById.keySet())) {
            edgesBySource.computeIfAbsent(edge.sourcePrintId(), key -> new ArrayList<>()).add(edge);
        }

        List<RelationshipEdge> followed = new ArrayList<>();
        Set<String> relatedIds = new LinkedHashSet<>();
        for (Print source : frontier) {
            for (RelationshipEdge edge : edgesBySource.getOrDefault(source.getId(), List.of())) {
                if (shouldFollow(source, edge, options) && !resolved.containsKey(edge.relatedPrintId())) {
                    followed.add(edge);
                    relatedIds.add(edge.relatedPrintId());
                }
            }
        }
        if (followed.isEmpty()) {
            return List.of();
        }

        Map<String, Print> found = cardIndex.findByIds(relatedIds);
        List<Print> discovered = new ArrayList<>();
        Set<String> seen = new LinkedHashSet<>();
        for (RelationshipEdge edge : followed) {
            Print related = found.get(edge.relatedPrintId());
            if (related == null) {
                related = resolveByName(edge, options).orElse(null);
            }
            if (related == null) {
                String label = StringUtils.hasText(edge.relatedCardName()) ? edge.relatedCardName() : edge.relatedPrintId();
                log.debug("Related part {} of {} not in index", label, edge.sourcePrintId());
                missing.add(label);
                continue;
            }
            if (!resolved.containsKey(related.getId()) && seen.add(related.getId())) {
                discovered.add(related);
            }
        }
        return discovered;
    }

    static boolean shouldFollow(Print source, RelationshipEdge edge, ResolutionOptions options) {
        if (edge.kind() == RelationshipKind.TOKEN) {
            return options.includeTokens();
        }
        // Tokens point back at every card that makes them; only their own tokens are wanted
        return !source.isToken();
    }

    /**
     * Fallback for edges whose related print id is not indexed (e.g. a token printed only
     * in another language): the exact name in the preferred language.
     */
    private Optional<Print> resolveByName(RelationshipEdge edge, ResolutionOptions options) {
        if (!StringUtils.hasText(edge.relatedCardName())) {
            return Optional.empty();
        }
        boolean wantToken = edge.kind() == RelationshipKind.TOKEN;
        return bestMatch(CardRequest.of(edge.relatedCardName()), options, wantToken, List.of(MatchTier.EXACT))
            .map(ScoredPrint::print);
    }

    private Optional<ScoredPrint> bestMatch(CardRequest request, ResolutionOptions options, boolean wantToken,
                                            List<MatchTier> tiers) {
        for (MatchTier tier : tiers) {
            NamePreference preference = NamePreference.forRequest(request, options.preferredLang(), wantToken);
            List<Print> candidates = cardIndex.findNameCandidates(request.name(), tier, preference);
            if (!candidates.isEmpty()) {
                Print best = candidates.stream()
                    .min(PrintPreference.forPreference(preference))
                    .orElseThrow();
                return Optional.of(new ScoredPrint(best, tier));
            }
        }
        return Optional.empty();
    }

    private record ScoredPrint(Print print, MatchTier tier) {
    }
}
