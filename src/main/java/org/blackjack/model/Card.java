package org.blackjack.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

@Getter
@ToString
@EqualsAndHashCode
public class Card {
    public static final int ACE = 1;
    public static final int JACK = 11;
    public static final int QUEEN = 12;
    public static final int KING = 13;

    private final int rank;   // 1 = As, 11..13 = figures
    private final Suit suit;

    public Card(int rank, Suit suit) {
        if (rank < ACE || rank > KING) throw new IllegalArgumentException("Rang invalide: " + rank);
        if (suit == null) throw new IllegalArgumentException("Couleur requise");
        this.rank = rank;
        this.suit = suit;
    }

    public boolean isAce() { return rank == ACE; }

    public boolean isFace() { return rank >= JACK; }

    public enum Suit { HEARTS, DIAMONDS, SPADES, CLUBS }
}
