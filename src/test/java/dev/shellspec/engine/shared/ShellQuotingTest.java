package dev.shellspec.engine.shared;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.util.List;
import org.junit.jupiter.api.Test;

class ShellQuotingTest {
    @Test
    void wrapsInSingleQuotes() {
        assertEquals("'echo $HOME'", ShellQuoting.quote("echo $HOME"));
    }

    @Test
    void escapesEmbeddedSingleQuotes() {
        assertEquals("'it'\\''s'", ShellQuoting.quote("it's"));
    }

    @Test
    void quotesEmptyString() {
        assertEquals("''", ShellQuoting.quote(""));
    }

    @Test
    void joinsQuotedValues() {
        assertEquals("'cd' '[' 'a b'", ShellQuoting.quoteAll(List.of("cd", "[", "a b")));
    }
}
