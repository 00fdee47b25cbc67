package org.blackjack.controller.console;

import lombok.RequiredArgsConstructor;
import org.blackjack.service.action.DecisionSource;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class ConsoleDecisionSource implements DecisionSource {
    private final ConsoleIO io;

    @Override
    public String nextDecision() {
        io.println("Do you want to (h)it or (s)tand?");
        return io.readLine();
    }
}
