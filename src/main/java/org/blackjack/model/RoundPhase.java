package org.blackjack.model;

public enum RoundPhase {
    SETUP,
    PLAYER_TURN,
    DEALER_TURN,
    RESOLVED;

    public boolean canMoveTo(RoundPhase next) {
        return switch (this) {
            case SETUP -> next == PLAYER_TURN;
            case PLAYER_TURN -> next == DEALER_TURN || next == RESOLVED;   // RESOLVED direct = joueur bust
            case DEALER_TURN -> next == RESOLVED;
            case RESOLVED -> false;
        };
    }
}
