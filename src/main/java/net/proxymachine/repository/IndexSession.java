package net.proxymachine.repository;

import org.springframework.jdbc.core.JdbcTemplate;

/**
 * Read access to one generation of the card index.
 *
 * @param jdbc       template over the generation's pooled connections
 * @param ftsEnabled whether the full-text table exists in this generation
 */
public record IndexSession(JdbcTemplate jdbc, boolean ftsEnabled) {
}
