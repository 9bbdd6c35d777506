package net.proxymachine.service;

import net.proxymachine.model.CardRequest;
import net.proxymachine.model.ProxyFetchReport;
import net.proxymachine.model.ResolutionOptions;
import net.proxymachine.model.ResolutionReport;
import net.proxymachine.model.fetch.FetchJob;
import net.proxymachine.model.fetch.FetchOptions;
import net.proxymachine.model.fetch.FetchResult;
import net.proxymachine.model.fetch.FetchSummary;
import net.proxymachine.service.classify.DestinationPlanner;
import net.proxymachine.service.deck.DeckListParser;
import net.proxymachine.service.deck.DeckParserRegistry;
import net.proxymachine.service.fetch.FetchBatch;
import net.proxymachine.service.fetch.FetchOrchestrator;
import net.proxymachine.service.resolve.RelationshipResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Request-time flow: card names are resolved and expanded against the index, planned
 * into destinations, and fetched.
 */
@Service
public class ProxyFetchService {

    private static final Logger log = LoggerFactory.getLogger(ProxyFetchService.class);

    private final RelationshipResolver resolver;
    private final DestinationPlanner planner;
    private final FetchOrchestrator orchestrator;

    public ProxyFetchService(RelationshipResolver resolver, DestinationPlanner planner, FetchOrchestrator orchestrator) {
        this.resolver = resolver;
        this.planner = planner;
        this.orchestrator = orchestrator;
    }

    /**
     * Parses a deck list in the given format (or detects it when {@code format} is null)
     * and fetches it.
     */
    public ProxyFetchReport fetchDeckList(String deckText, String format, ResolutionOptions resolution,
                                          FetchOptions fetch, Path outputRoot) {
        DeckListParser parser = format == null ? DeckParserRegistry.detect(deckText) : DeckParserRegistry.require(format);
        List<CardRequest> requests = parser.parse(deckText);
        log.info("Parsed {} card request(s) from {} deck list", requests.size(), parser.format());
        return fetch(requests, resolution, fetch, outputRoot);
    }

    public ProxyFetchReport fetch(List<CardRequest> requests, ResolutionOptions resolution,
                                  FetchOptions fetch, Path outputRoot) {
        ResolutionReport resolved = resolver.resolve(requests, resolution);
        DestinationPlanner.Plan plan = planner.plan(resolved.prints(), outputRoot);
        FetchSummary summary = plan.jobs().isEmpty()
            ? FetchSummary.empty()
            : orchestrator.run(plan.jobs(), fetch);

        Set<Path> failedDestinations = new HashSet<>();
        for (FetchResult result : summary.failedResults()) {
            failedDestinations.add(result.job().destinationPath());
        }
        List<Path> materialized = new ArrayList<>();
        for (FetchJob job : plan.jobs()) {
            if (!failedDestinations.contains(job.destinationPath())) {
                materialized.add(job.destinationPath());
            }
        }

        log.info("Proxy fetch done: requested={} resolved={} missing={} fetched={} failed={} skipped={}",
            requests.size(), resolved.prints().size(), resolved.missing().size(),
            summary.successful(), summary.failed(), summary.skipped());
        return new ProxyFetchReport(resolved, plan.unplannable(), summary, materialized);
    }

    /**
     * Starts the fetch for already resolved prints without waiting; used when the caller
     * wants to cancel.
     */
    public FetchBatch submit(ResolutionReport resolved, FetchOptions fetch, Path outputRoot) {
        DestinationPlanner.Plan plan = planner.plan(resolved.prints(), outputRoot);
        return orchestrator.submit(plan.jobs(), fetch);
    }
}
