package org.blackjack.config;

import lombok.extern.slf4j.Slf4j;
import org.blackjack.controller.console.ConsoleIO;
import org.blackjack.view.CardView;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.security.SecureRandom;
import java.util.Random;

@Slf4j
@Configuration
public class GameConfig {

    // graine fixe = parties reproductibles
    @Bean
    public Random shuffleRandom(@Value("${blackjack.shuffle-seed:#{null}}") Long seed) {
        if (seed == null) return new SecureRandom();
        log.info("Mélange déterministe, graine={}", seed);
        return new Random(seed);
    }

    @Bean
    public CardView cardView(@Value("${blackjack.view:glyph}") String view) {
        return CardView.forName(view);
    }

    @Bean
    public ConsoleIO consoleIO() {
        return new ConsoleIO(System.in, System.out);
    }
}
