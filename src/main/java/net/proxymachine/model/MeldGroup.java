package net.proxymachine.model;

import java.util.List;

/**
 * Meld result print together with the part prints that link to it.
 */
public record MeldGroup(String resultPrintId, List<String> partPrintIds) {
    public MeldGroup {
        partPrintIds = List.copyOf(partPrintIds);
    }
}
