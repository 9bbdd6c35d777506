package net.proxymachine.service.resolve;

import net.proxymachine.model.NamePreference;
import net.proxymachine.model.Print;

import java.util.Comparator;

/**
 * Tie-break ordering between prints that matched a name equally well. The first print in
 * this order wins:
 * <ol>
 *   <li>set code equals the requested set</li>
 *   <li>collector number equals the requested one</li>
 *   <li>language equals the preferred language</li>
 *   <li>token-ness matches what is wanted (cards for deck names, tokens for token parts)</li>
 *   <li>most recent release date</li>
 *   <li>lexicographically smallest print id</li>
 * </ol>
 * The last key makes the order total, so resolution is deterministic.
 */
final class PrintPreference {

    private PrintPreference() {
    }

    static Comparator<Print> forPreference(NamePreference preference) {
        Comparator<Print> bySet = Comparator.comparing(print -> !equalsIgnoreCase(print.getSetCode(), preference.setCode()));
        Comparator<Print> byCollector =
            Comparator.comparing(print -> !equalsIgnoreCase(print.getCollectorNumber(), preference.collectorNumber()));
        Comparator<Print> byLang = Comparator.comparing(print -> !equalsIgnoreCase(print.getLang(), preference.lang()));
        Comparator<Print> byTokenness = Comparator.comparing(print -> print.isToken() != preference.token());
        Comparator<Print> byRecency = Comparator.comparing(Print::getReleasedAt,
            Comparator.nullsLast(Comparator.<String>reverseOrder()));
        Comparator<Print> byId = Comparator.comparing(Print::getId);

        return bySet
            .thenComparing(byCollector)
            .thenComparing(byLang)
            .thenComparing(byTokenness)
            .thenComparing(byRecency)
            .thenComparing(byId);
    }

    private static boolean equalsIgnoreCase(String value, String wanted) {
        return wanted != null && value != null && value.equalsIgnoreCase(wanted);
    }
}
