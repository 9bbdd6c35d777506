package net.proxymachine.model;

import net.proxymachine.model.fetch.FetchSummary;

import java.nio.file.Path;
import java.util.List;

/**
 * Everything a downstream consumer (the PDF builder) needs after a fetch: what was
 * resolved, what could not be planned, how the downloads went, and which image files
 * now exist on disk.
 */
public record ProxyFetchReport(ResolutionReport resolution,
                               List<Print> unplannable,
                               FetchSummary fetch,
                               List<Path> materializedPaths) {

    public ProxyFetchReport {
        unplannable = List.copyOf(unplannable);
        materializedPaths = List.copyOf(materializedPaths);
    }
}
