package net.proxymachine.model.fetch;

public enum FetchStatus {
    SUCCESS,
    FAILED,
    SKIPPED
}
