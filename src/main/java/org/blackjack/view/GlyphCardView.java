package org.blackjack.view;

import org.blackjack.model.Card;

// "J♥", "10♣"
public class GlyphCardView implements CardView {

    @Override
    public String render(Card c) {
        String rank = switch (c.getRank()) {
            case Card.ACE -> "A";
            case Card.JACK -> "J";
            case Card.QUEEN -> "Q";
            case Card.KING -> "K";
            default -> String.valueOf(c.getRank());
        };
        return rank + glyph(c.getSuit());
    }

    private String glyph(Card.Suit s) {
        return switch (s) {
            case HEARTS -> "♥";
            case DIAMONDS -> "♦";
            case SPADES -> "♠";
            case CLUBS -> "♣";
        };
    }
}
