package org.blackjack.view;

import org.blackjack.model.Card;

import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

public interface CardView {
    String render(Card c);

    default String render(List<Card> cards) {
        return cards.stream().map(this::render).collect(Collectors.joining(", "));
    }

    static CardView forName(String name) {
        if (name == null) throw new IllegalArgumentException("Vue de carte requise");
        return switch (name.trim().toLowerCase(Locale.ROOT)) {
            case "alpha" -> new AlphaCardView();
            case "glyph" -> new GlyphCardView();
            default -> throw new IllegalArgumentException("Vue de carte inconnue: " + name);
        };
    }
}
