package net.proxymachine.model;

/**
 * Query cache key: a normalized filter bound to the index generation it was read from.
 * Results read before a swap are never served after it.
 */
public record CachedQueryKey(long generation, CardQuery query) {
}
