package org.blackjack.service.action;

import java.util.Locale;
import java.util.Optional;

public enum PlayerAction {
    HIT, STAND;

    /** "h"/"hit" ou "s"/"stand", casse et espaces ignorés ; vide sinon. */
    public static Optional<PlayerAction> parse(String input) {
        if (input == null) return Optional.empty();
        return switch (input.trim().toLowerCase(Locale.ROOT)) {
            case "h", "hit" -> Optional.of(HIT);
            case "s", "stand" -> Optional.of(STAND);
            default -> Optional.empty();
        };
    }
}
