package org.blackjack.controller.console;

import org.blackjack.model.Outcome;
import org.blackjack.model.RoundResult;
import org.blackjack.service.engine.RoundEngine;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ConsoleGameRunnerTest {

    @Mock
    private RoundEngine engine;

    private final ByteArrayOutputStream out = new ByteArrayOutputStream();

    private ConsoleGameRunner runnerWithInput(String input) {
        ConsoleIO io = new ConsoleIO(new ByteArrayInputStream(input.getBytes(StandardCharsets.UTF_8)),
                new PrintStream(out, true, StandardCharsets.UTF_8));
        return new ConsoleGameRunner(engine, io);
    }

    private RoundResult tie() {
        return new RoundResult(Outcome.TIE, 19, 19, List.of(), List.of());
    }

    @Test
    void rejoueTantQueReponseY() {
        when(engine.playRound()).thenReturn(tie());

        runnerWithInput("y\n y \nn\n").run();

        verify(engine, times(3)).playRound();
        assertThat(out.toString(StandardCharsets.UTF_8)).contains("Do you want to play again? (y/n): ");
    }

    @Test
    void majusculeY_arrete() {
        when(engine.playRound()).thenReturn(tie());

        runnerWithInput("Y\ny\n").run();

        verify(engine, times(1)).playRound();
    }

    @Test
    void autreReponse_arrete() {
        when(engine.playRound()).thenReturn(tie());

        runnerWithInput("yes\n").run();

        verify(engine, times(1)).playRound();
    }

    @Test
    void entreeFermee_finDeSessionSansErreur() {
        when(engine.playRound()).thenReturn(tie());

        assertThatCode(() -> runnerWithInput("").run()).doesNotThrowAnyException();
        verify(engine, times(1)).playRound();
    }

    @Test
    void entreeFermeePendantLaManche_finDeSession() {
        when(engine.playRound()).thenThrow(new InputClosedException());

        assertThatCode(() -> runnerWithInput("").run()).doesNotThrowAnyException();
    }

    @Test
    void erreurFatale_remonte() {
        when(engine.playRound()).thenThrow(new IllegalStateException("Paquet vide"));

        assertThatThrownBy(() -> runnerWithInput("y\n").run())
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("Paquet vide");
    }
}
