package net.proxymachine.service.classify;

import net.proxymachine.model.Print;
import net.proxymachine.model.fetch.FetchJob;
import net.proxymachine.util.SlugGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Turns resolved prints into fetch jobs with collision-free destinations:
 * {@code <root>/<category>/<name>-<art>-<lang>-<set>-<collector>.<ext>}.
 */
@Component
public class DestinationPlanner {

    private static final Logger log = LoggerFactory.getLogger(DestinationPlanner.class);

    private static final String DEFAULT_EXTENSION = "png";
    private static final Set<String> KNOWN_EXTENSIONS = Set.of("png", "jpg", "jpeg", "webp");
    private static final int ID_SUFFIX_LENGTH = 8;

    /**
     * @param jobs        one job per plannable print, in input order
     * @param unplannable prints without an image reference
     */
    public record Plan(List<FetchJob> jobs, List<Print> unplannable) {
        public Plan {
            jobs = List.copyOf(jobs);
            unplannable = List.copyOf(unplannable);
        }
    }

    private final PrintClassifier classifier;

    public DestinationPlanner(PrintClassifier classifier) {
        this.classifier = classifier;
    }

    public Plan plan(List<Print> prints, Path outputRoot) {
        Path root = outputRoot.toAbsolutePath().normalize();
        List<FetchJob> jobs = new ArrayList<>(prints.size());
        List<Print> unplannable = new ArrayList<>();
        Set<Path> taken = new HashSet<>();

        for (Print print : prints) {
            if (!StringUtils.hasText(print.getImageUrl())) {
                unplannable.add(print);
                continue;
            }
            Path directory = root.resolve(classifier.categoryPath(print));
            String baseName = fileBaseName(print);
            String extension = extensionOf(print.getImageUrl());
            Path destination = directory.resolve(baseName + "." + extension);
            if (!taken.add(destination)) {
                String suffix = print.getId().length() > ID_SUFFIX_LENGTH
                    ? print.getId().substring(0, ID_SUFFIX_LENGTH)
                    : print.getId();
                String disambiguated = baseName + "-" + SlugGenerator.slugifyOrDefault(suffix, "dup");
                destination = directory.resolve(disambiguated + "." + extension);
                // Ids sharing a prefix can still collide; count up until the name is free
                for (int attempt = 2; !taken.add(destination); attempt++) {
                    destination = directory.resolve(disambiguated + "-" + attempt + "." + extension);
                }
                log.debug("Destination collision for print {}, using {}", print.getId(), destination.getFileName());
            }
            jobs.add(new FetchJob(print.getId(), displayName(print), print.getImageUrl(), destination));
        }
        if (!unplannable.isEmpty()) {
            log.warn("{} print(s) have no image reference and were not scheduled", unplannable.size());
        }
        return new Plan(jobs, unplannable);
    }

    /**
     * File name without extension, e.g. {@code lightning-bolt-standard-en-m10-146}.
     */
    String fileBaseName(Print print) {
        return String.join("-",
            SlugGenerator.slugifyOrDefault(print.getName(), "unknown"),
            classifier.classifyArt(print).label(),
            SlugGenerator.slugifyOrDefault(print.getLang(), "xx"),
            SlugGenerator.slugifyOrDefault(print.getSetCode(), "unknown"),
            SlugGenerator.slugifyOrDefault(print.getCollectorNumber(), "0"));
    }

    static String extensionOf(String imageUrl) {
        String path = imageUrl;
        int query = path.indexOf('?');
        if (query >= 0) {
            path = path.substring(0, query);
        }
        int dot = path.lastIndexOf('.');
        int slash = path.lastIndexOf('/');
        if (dot > slash && dot < path.length() - 1) {
            String extension = path.substring(dot + 1).toLowerCase(Locale.ROOT);
            if (KNOWN_EXTENSIONS.contains(extension)) {
                return "jpeg".equals(extension) ? "jpg" : extension;
            }
        }
        return DEFAULT_EXTENSION;
    }

    private static String displayName(Print print) {
        return print.getName() + " [" + print.getSetCode() + " " + print.getCollectorNumber() + "]";
    }
}
