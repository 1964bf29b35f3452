package org.mimetica.runtime.model;

/**
 * An agent crossed the expulsion threshold and was removed.
 *
 * @param step               The step in which the expulsion happened (0-based).
 * @param victim             Id of the expelled agent.
 * @param receivedAggression Aggression the victim received when the threshold triggered.
 */
public record ExpulsionEvent(long step, int victim, double receivedAggression) {
}
