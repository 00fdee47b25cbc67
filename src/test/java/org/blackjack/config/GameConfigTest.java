package org.blackjack.config;

import org.blackjack.controller.console.ConsoleIO;
import org.blackjack.model.Card;
import org.blackjack.view.GlyphCardView;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;
import java.util.Random;

import static org.assertj.core.api.Assertions.*;

class GameConfigTest {

    PrintStream stdout;
    ByteArrayOutputStream captured;

    @BeforeEach
    void setUp() {
        stdout = System.out;
        captured = new ByteArrayOutputStream();
        // console en ASCII, comme une locale POSIX
        System.setOut(new PrintStream(captured, true, StandardCharsets.US_ASCII));
    }

    @AfterEach
    void tearDown() {
        System.setOut(stdout);
    }

    @Test
    void consoleIO_ecritLesSymbolesEnUtf8_memeSurConsoleAscii() {
        ConsoleIO io = new GameConfig().consoleIO();

        io.println(new GlyphCardView().render(new Card(Card.JACK, Card.Suit.HEARTS)));

        byte[] attendu = ("J♥" + System.lineSeparator()).getBytes(StandardCharsets.UTF_8);
        assertThat(captured.toByteArray()).isEqualTo(attendu);
        assertThat(captured.toString(StandardCharsets.UTF_8)).startsWith("J♥");
    }

    @Test
    void shuffleRandom_sansGraine_secureRandom() {
        assertThat(new GameConfig().shuffleRandom(null)).isInstanceOf(SecureRandom.class);
        assertThat(new GameConfig().shuffleRandom(5L).getClass()).isEqualTo(Random.class);
    }
}
