package com.webaudit.server.logging;

import org.junit.jupiter.api.Test;

import java.util.logging.Level;

import static org.junit.jupiter.api.Assertions.assertEquals;

class LogSetupTest {

    @Test
    void level_names_accept_slf4j_and_jul_spellings() {
        assertEquals(Level.FINE, LogSetup.levelOf("debug"));
        assertEquals(Level.WARNING, LogSetup.levelOf("WARN"));
        assertEquals(Level.SEVERE, LogSetup.levelOf("error"));
        assertEquals(Level.FINER, LogSetup.levelOf("FINER"));
        assertEquals(Level.INFO, LogSetup.levelOf("loud"));
        assertEquals(Level.INFO, LogSetup.levelOf(null));
    }

    @Test
    void int_props_fall_back_to_default() {
        assertEquals(2, LogSetup.parseInt(null, 2));
        assertEquals(5, LogSetup.parseInt("x", 5));
        assertEquals(1, LogSetup.parseInt("-3", 5));
        assertEquals(8, LogSetup.parseInt(" 8 ", 5));
    }
}
