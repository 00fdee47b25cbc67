package org.blackjack.service.engine;

import org.blackjack.model.Deck;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.Random;

import static org.assertj.core.api.Assertions.*;

class RandomDeckSourceTest {

    @Test
    void paquetNeuf_complet_etMelange() {
        RandomDeckSource source = new RandomDeckSource(new Random(8));

        Deck d = source.shuffledDeck();

        assertThat(d.remaining()).isEqualTo(Deck.SIZE);
        assertThat(new HashSet<>(d.cards())).hasSize(Deck.SIZE);
        assertThat(d.cards()).isNotEqualTo(new Deck().cards());
    }

    @Test
    void memeGraine_memeOrdre_instancesDistinctes() {
        Deck a = new RandomDeckSource(new Random(21)).shuffledDeck();
        Deck b = new RandomDeckSource(new Random(21)).shuffledDeck();

        assertThat(a).isNotSameAs(b);
        assertThat(a.cards()).isEqualTo(b.cards());
    }
}
