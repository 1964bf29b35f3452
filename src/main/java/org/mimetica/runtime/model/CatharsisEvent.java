package org.mimetica.runtime.model;

/**
 * Fractional drop in total system tension caused by one expulsion.
 *
 * @param step      The step of the expulsion.
 * @param victim    Id of the expelled agent.
 * @param catharsis {@code max(0, (pre - post) / pre)}, or 0 when there was no tension before.
 */
public record CatharsisEvent(long step, int victim, double catharsis) {
}
