package org.blackjack.model.rules;

import org.blackjack.model.Card;

public final class HandRules {
    private HandRules(){}

    public static final int BLACKJACK = 21;

    public static int value(Card c) {
        if (c.isAce()) return 11; // ramené à 1 dans bestTotal si nécessaire
        if (c.isFace()) return 10;
        return c.getRank();
    }

    public static int bestTotal(Iterable<Card> cards) {
        int sum = 0, aces = 0;
        for (Card c : cards) {
            sum += value(c);
            if (c.isAce()) aces++;
        }
        while (sum > BLACKJACK && aces-- > 0) sum -= 10;
        return sum;
    }

    /** Vrai si au moins un As compte encore pour 11 dans le meilleur total. */
    public static boolean isSoft(Iterable<Card> cards) {
        int hard = 0;
        boolean ace = false;
        for (Card c : cards) {
            hard += c.isAce() ? 1 : value(c);
            if (c.isAce()) ace = true;
        }
        return ace && hard + 10 <= BLACKJACK;
    }

    public static boolean isBust(Iterable<Card> cards) {
        return bestTotal(cards) > BLACKJACK;
    }
}
