package com.abalone.core.ai;

import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class SelfPlayRunnerTest {

    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();
    private PrintStream originalOut;
    private PrintStream originalErr;

    @BeforeEach
    void redirect() {
        originalOut = System.out;
        originalErr = System.err;
        System.setOut(new PrintStream(out, true, StandardCharsets.UTF_8));
        System.setErr(new PrintStream(err, true, StandardCharsets.UTF_8));
    }

    @AfterEach
    void restore() {
        System.setOut(originalOut);
        System.setErr(originalErr);
    }

    @Test
    void playsCappedGames() {
        SelfPlayRunner.main(new String[] {"2", "1", "--heuristic=material", "--maxMoves=4", "--layout=belgian_daisy"});

        String output = out.toString(StandardCharsets.UTF_8);
        assertTrue(output.contains("Score: Black(@@) 0 - 0 White(OO)"), output);
        assertTrue(output.contains("Games: 2, Black wins: 0, White wins: 0"), output);
    }

    @Test
    void printsUsageForMissingArguments() {
        SelfPlayRunner.main(new String[] {"1"});

        assertTrue(err.toString(StandardCharsets.UTF_8).startsWith("Usage: SelfPlayRunner"));
        assertTrue(out.toString(StandardCharsets.UTF_8).isEmpty());
    }
}
