package org.blackjack.model;

import lombok.Getter;

/**
 * État d'une manche : le paquet, les deux mains et la phase courante.
 * Créé au début de chaque manche, jeté à la fin.
 */
@Getter
public class Round {
    private final Deck deck;
    private final Hand player = new Hand();
    private final Hand dealer = new Hand();

    private RoundPhase phase = RoundPhase.SETUP;
    private Outcome outcome;

    public Round(Deck deck) {
        if (deck == null) throw new IllegalArgumentException("Paquet requis");
        this.deck = deck;
    }

    public void moveTo(RoundPhase next) {
        if (next == RoundPhase.RESOLVED)
            throw new IllegalStateException("Utiliser resolve() pour terminer la manche");
        checkTransition(next);
        this.phase = next;
    }

    public void resolve(Outcome o) {
        if (o == null) throw new IllegalArgumentException("Résultat requis");
        checkTransition(RoundPhase.RESOLVED);
        this.outcome = o;
        this.phase = RoundPhase.RESOLVED;
    }

    public boolean isResolved() { return phase == RoundPhase.RESOLVED; }

    public RoundResult toResult() {
        if (!isResolved()) throw new IllegalStateException("Manche non terminée (" + phase + ")");
        return new RoundResult(outcome, player.total(), dealer.total(), player.getCards(), dealer.getCards());
    }

    private void checkTransition(RoundPhase next) {
        if (!phase.canMoveTo(next))
            throw new IllegalStateException("Transition interdite " + phase + " -> " + next);
    }
}
