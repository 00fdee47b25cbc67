package org.blackjack.model;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum Outcome {
    PLAYER_BUST("Player busts! Dealer wins."),
    DEALER_BUST("Dealer busts! Player wins."),
    PLAYER_WIN("Player wins!"),
    DEALER_WIN("Dealer wins!"),
    TIE("It's a tie!");

    private final String message;
}
