package org.blackjack.service.engine;

import org.blackjack.model.Deck;

/** Fournit un paquet neuf, déjà mélangé, pour chaque manche. */
@FunctionalInterface
public interface DeckSource {
    Deck shuffledDeck();
}
