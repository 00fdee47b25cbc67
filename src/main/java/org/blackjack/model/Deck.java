package org.blackjack.model;

import java.util.*;

/**
 * Paquet de 52 cartes, utilisé pour une seule manche.
 * On ne peut que le mélanger et tirer la carte du dessus.
 */
public class Deck {
    public static final int SIZE = 52;

    private final Deque<Card> cards = new ArrayDeque<>();

    public Deck() {
        cards.addAll(standardOrder());
    }

    private Deck(List<Card> ordered) {
        cards.addAll(ordered);
    }

    /** Paquet complet dont les premières cartes tirées seront {@code top}, dans cet ordre. */
    public static Deck stacked(Card... top) {
        List<Card> ordered = new ArrayList<>(Arrays.asList(top));
        if (new HashSet<>(ordered).size() != ordered.size())
            throw new IllegalArgumentException("Carte en double dans le paquet");
        for (Card c : standardOrder()) {
            if (!ordered.contains(c)) ordered.add(c);
        }
        return new Deck(ordered);
    }

    public void shuffle(Random rnd) {
        List<Card> tmp = new ArrayList<>(cards);
        Collections.shuffle(tmp, rnd);
        cards.clear();
        cards.addAll(tmp);
    }

    public Card deal() {
        Card c = cards.pollFirst();
        if (c == null) throw new IllegalStateException("Paquet vide");
        return c;
    }

    public int remaining() { return cards.size(); }

    public boolean isEmpty() { return cards.isEmpty(); }

    public List<Card> cards() { return List.copyOf(cards); }

    private static List<Card> standardOrder() {
        List<Card> tmp = new ArrayList<>(SIZE);
        for (Card.Suit s : Card.Suit.values()) {
            for (int r = Card.ACE; r <= Card.KING; r++) tmp.add(new Card(r, s));
        }
        return tmp;
    }
}
