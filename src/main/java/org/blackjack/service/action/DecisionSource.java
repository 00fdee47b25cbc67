package org.blackjack.service.action;

/**
 * Fournit la décision brute du joueur. Appel bloquant : la manche attend la réponse.
 * La valeur est interprétée par {@link PlayerAction#parse(String)}.
 */
@FunctionalInterface
public interface DecisionSource {
    String nextDecision();
}
