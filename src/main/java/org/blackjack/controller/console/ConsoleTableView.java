package org.blackjack.controller.console;

import lombok.RequiredArgsConstructor;
import org.blackjack.model.Card;
import org.blackjack.model.Hand;
import org.blackjack.model.Outcome;
import org.blackjack.model.RoundResult;
import org.blackjack.view.CardView;
import org.blackjack.view.TableView;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
@RequiredArgsConstructor
public class ConsoleTableView implements TableView {
    private final ConsoleIO io;
    private final CardView cards;

    @Override
    public void handStart(Hand player, Hand dealer) {
        io.println("");
        io.println("Dealer shows: " + cards.render(dealer.getCards().get(0)));
    }

    @Override
    public void playerTurn(Hand player) {
        io.println("Player's hand total: " + player.total());
        io.println("Hand: " + cards.render(player.getCards()));
    }

    @Override
    public void playerHit(Hand player) {
        io.println("You draw " + cards.render(last(player.getCards())));
    }

    @Override
    public void invalidDecision(String input) {
        io.println("Invalid choice, please enter 'h' or 's'.");
    }

    @Override
    public void dealerTurnStart(Hand dealer) {
        io.println("Dealer reveals: " + cards.render(dealer.getCards()));
    }

    @Override
    public void dealerHit(Hand dealer) {
        io.println("Dealer draws " + cards.render(last(dealer.getCards())));
    }

    @Override
    public void roundResolved(RoundResult result) {
        if (result.outcome() != Outcome.PLAYER_BUST) {
            io.println("Dealer's hand total: " + result.dealerTotal());
            io.println("Hand: " + cards.render(result.dealerCards()));
        }
        io.println("Player's hand total: " + result.playerTotal());
        io.println("Hand: " + cards.render(result.playerCards()));
        io.println(result.outcome().getMessage());
    }

    private Card last(List<Card> l) { return l.get(l.size() - 1); }
}
