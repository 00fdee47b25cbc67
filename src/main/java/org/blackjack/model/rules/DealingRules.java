package org.blackjack.model.rules;

import org.blackjack.model.Hand;
import org.blackjack.model.Round;

public final class DealingRules {
    private DealingRules(){}

    public static final int INITIAL_CARDS = 2;
    public static final int DEALER_STANDS_ON = 17;

    // croupier d'abord, puis joueur, deux fois
    public static void dealInitial(Round r) {
        for (int i = 0; i < INITIAL_CARDS; i++) {
            r.getDealer().add(r.getDeck().deal());
            r.getPlayer().add(r.getDeck().deal());
        }
    }

    public static boolean dealerMustDraw(Hand dealer) {
        return dealer.total() < DEALER_STANDS_ON;
    }
}
