package org.blackjack.view;

import org.blackjack.model.Card;

// "Jack of Hearts", "10 of Clubs"
public class AlphaCardView implements CardView {

    @Override
    public String render(Card c) {
        String rank = switch (c.getRank()) {
            case Card.ACE -> "Ace";
            case Card.JACK -> "Jack";
            case Card.QUEEN -> "Queen";
            case Card.KING -> "King";
            default -> String.valueOf(c.getRank());
        };
        return rank + " of " + suitName(c.getSuit());
    }

    private String suitName(Card.Suit s) {
        return switch (s) {
            case HEARTS -> "Hearts";
            case DIAMONDS -> "Diamonds";
            case SPADES -> "Spades";
            case CLUBS -> "Clubs";
        };
    }
}
