package org.blackjack.controller.console;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.blackjack.model.RoundResult;
import org.blackjack.service.engine.RoundEngine;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

// boucle "rejouer ?" autour du moteur
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "blackjack.console.enabled", havingValue = "true", matchIfMissing = true)
public class ConsoleGameRunner implements CommandLineRunner {
    private final RoundEngine engine;
    private final ConsoleIO io;

    @Override
    public void run(String... args) {
        log.info("Session de blackjack démarrée");
        int rounds = 0;
        try {
            do {
                RoundResult result = engine.playRound();
                rounds++;
                log.debug("Manche {} : {}", rounds, result.outcome());
            } while (playAgain());
        } catch (InputClosedException e) {
            log.info("{}, fin de session", e.getMessage());
        } catch (IllegalStateException e) {
            log.error("Erreur fatale, manche {} abandonnée", rounds + 1, e);
            throw e;
        }
        log.info("Session terminée après {} manche(s)", rounds);
    }

    boolean playAgain() {
        io.print("\nDo you want to play again? (y/n): ");
        return "y".equals(io.readLine().trim());
    }
}
