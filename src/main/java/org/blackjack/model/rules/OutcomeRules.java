package org.blackjack.model.rules;

import org.blackjack.model.Outcome;

import static org.blackjack.model.rules.HandRules.BLACKJACK;

public final class OutcomeRules {
    private OutcomeRules(){}

    public static Outcome compute(int playerTotal, int dealerTotal) {
        if (playerTotal > BLACKJACK) return Outcome.PLAYER_BUST;
        if (dealerTotal > BLACKJACK) return Outcome.DEALER_BUST;
        if (playerTotal > dealerTotal) return Outcome.PLAYER_WIN;
        if (dealerTotal > playerTotal) return Outcome.DEALER_WIN;
        return Outcome.TIE;
    }
}
