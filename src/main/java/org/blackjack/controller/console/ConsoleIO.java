package org.blackjack.controller.console;

import java.io.*;
import java.nio.charset.StandardCharsets;

public class ConsoleIO {
    private final BufferedReader in;
    private final PrintStream out;

    // lecture et écriture en UTF-8, quel que soit le charset par défaut de la machine
    public ConsoleIO(InputStream in, OutputStream out) {
        this.in = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
        this.out = new PrintStream(out, true, StandardCharsets.UTF_8);
    }

    public void println(String line) { out.println(line); }

    public void print(String text) {
        out.print(text);
        out.flush();
    }

    /** Ligne suivante, ou exception si l'entrée est fermée. */
    public String readLine() {
        try {
            String line = in.readLine();
            if (line == null) throw new InputClosedException();
            return line;
        } catch (IOException e) {
            throw new UncheckedIOException("Lecture console impossible", e);
        }
    }
}
