package org.blackjack.service.engine;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.blackjack.model.*;
import org.blackjack.model.rules.DealingRules;
import org.blackjack.model.rules.OutcomeRules;
import org.blackjack.service.action.DecisionSource;
import org.blackjack.service.action.PlayerAction;
import org.blackjack.view.TableView;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Déroule une manche complète : SETUP -> PLAYER_TURN -> DEALER_TURN -> RESOLVED.
 * Chaque appel à {@link #playRound()} repart d'un paquet et de mains neufs.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RoundEngine {
    private final DeckSource decks;
    private final DecisionSource decisions;
    private final TableView view;

    public RoundResult playRound() {
        Round r = new Round(decks.shuffledDeck());
        setup(r);

        while (!r.isResolved()) {
            switch (r.getPhase()) {
                case PLAYER_TURN -> playerStep(r);
                case DEALER_TURN -> dealerTurn(r);
                default -> throw new IllegalStateException("Phase inattendue: " + r.getPhase());
            }
        }

        RoundResult result = r.toResult();
        log.debug("Manche terminée: {} (joueur={}, croupier={})",
                result.outcome(), result.playerTotal(), result.dealerTotal());
        view.roundResolved(result);
        return result;
    }

    void setup(Round r) {
        DealingRules.dealInitial(r);
        r.moveTo(RoundPhase.PLAYER_TURN);
        log.debug("Distribution initiale, reste {} cartes", r.getDeck().remaining());
        view.handStart(r.getPlayer(), r.getDealer());
    }

    /** Une décision valide du joueur ; une saisie invalide ne change rien et on redemande. */
    void playerStep(Round r) {
        Hand player = r.getPlayer();
        view.playerTurn(player);

        String input = decisions.nextDecision();
        Optional<PlayerAction> action = PlayerAction.parse(input);
        if (action.isEmpty()) {
            log.debug("Saisie invalide: '{}'", input);
            view.invalidDecision(input);
            return;
        }

        switch (action.get()) {
            case HIT -> {
                player.add(r.getDeck().deal());
                view.playerHit(player);
                if (player.isBust()) {
                    // le croupier ne joue pas
                    r.resolve(Outcome.PLAYER_BUST);
                }
            }
            case STAND -> r.moveTo(RoundPhase.DEALER_TURN);
        }
    }

    void dealerTurn(Round r) {
        Hand dealer = r.getDealer();
        view.dealerTurnStart(dealer);
        while (DealingRules.dealerMustDraw(dealer)) {
            dealer.add(r.getDeck().deal());
            view.dealerHit(dealer);
        }
        log.debug("Croupier reste sur {}{}", dealer.total(), dealer.isSoft() ? " (soft)" : "");
        r.resolve(OutcomeRules.compute(r.getPlayer().total(), dealer.total()));
    }
}
