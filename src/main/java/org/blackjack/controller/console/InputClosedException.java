package org.blackjack.controller.console;

public class InputClosedException extends RuntimeException {
    public InputClosedException() {
        super("Entrée console fermée");
    }
}
