package org.blackjack.model;

import lombok.ToString;
import org.blackjack.model.rules.HandRules;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

@ToString
public class Hand {
    private final List<Card> cards = new ArrayList<>();

    public void add(Card c) {
        if (c == null) throw new IllegalArgumentException("Carte requise");
        cards.add(c);
    }

    public List<Card> getCards() { return Collections.unmodifiableList(cards); }

    public int size() { return cards.size(); }

    // recalculé à chaque appel
    public int total() { return HandRules.bestTotal(cards); }

    public boolean isBust() { return HandRules.isBust(cards); }

    public boolean isSoft() { return HandRules.isSoft(cards); }
}
