package org.blackjack.service.engine;

import lombok.RequiredArgsConstructor;
import org.blackjack.model.Deck;
import org.springframework.stereotype.Component;

import java.util.Random;

@Component
@RequiredArgsConstructor
public class RandomDeckSource implements DeckSource {
    private final Random shuffleRandom;

    @Override
    public Deck shuffledDeck() {
        Deck d = new Deck();
        d.shuffle(shuffleRandom);
        return d;
    }
}
