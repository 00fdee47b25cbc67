package org.blackjack.model;

import java.util.List;

public record RoundResult(Outcome outcome,
                          int playerTotal,
                          int dealerTotal,
                          List<Card> playerCards,
                          List<Card> dealerCards) {

    public RoundResult {
        playerCards = List.copyOf(playerCards);
        dealerCards = List.copyOf(dealerCards);
    }
}
