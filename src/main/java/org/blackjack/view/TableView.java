package org.blackjack.view;

import org.blackjack.model.Hand;
import org.blackjack.model.RoundResult;

/**
 * Reçoit les états intermédiaires d'une manche. L'implémentation choisit quoi afficher.
 */
public interface TableView {

    void handStart(Hand player, Hand dealer);

    /** Avant chaque demande de décision. */
    void playerTurn(Hand player);

    void playerHit(Hand player);

    void invalidDecision(String input);

    void dealerTurnStart(Hand dealer);

    void dealerHit(Hand dealer);

    void roundResolved(RoundResult result);
}
