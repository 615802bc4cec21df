package dev.shellspec.engine.coverage;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import dev.shellspec.engine.support.ShellTestSupport;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class TraceCollectorTest {
    private static final String LIBRARY = """
        #!/usr/bin/env bash
        add() {
            echo $(( $1 + $2 ))
        }
        sub() {
            echo $(( $1 - $2 ))
        }
        """;

    @Test
    void absorbingSameTraceTwiceChangesNothing(@TempDir Path dir) {
        Path lib = ShellTestSupport.write(dir, "lib.sh", LIBRARY);
        var once = new TraceCollector(dir, Set.of());
        once.absorb(List.of(lib + ":3"));

        var twice = new TraceCollector(dir, Set.of());
        twice.absorb(List.of(lib + ":3", lib + ":3"));
        twice.absorb(List.of(lib + ":3"));

        assertEquals(once.data().records(), twice.data().records());
        assertEquals(once.data().statsFor(lib), twice.data().statsFor(lib));
        assertEquals("2 1 50.0", twice.data().statsFor(lib).tokens());
    }

    @Test
    void excludedFilesAreNeverRecorded(@TempDir Path dir) {
        Path lib = ShellTestSupport.write(dir, "lib.sh", LIBRARY);
        Path test = ShellTestSupport.write(dir, "lib_test.sh", "test_add() { add 1 2; }\n");
        var collector = new TraceCollector(dir, Set.of(test));

        collector.absorb(List.of(test + ":1", lib + ":3", "garbage", ":12", lib + ":x"));

        assertEquals(Set.of(new TraceRecord(lib, 3)), collector.data().records());
    }

    @Test
    void sessionFilesAreReadAndDeleted(@TempDir Path dir) throws IOException {
        Path lib = ShellTestSupport.write(dir, "lib.sh", LIBRARY);
        var collector = new TraceCollector(dir, Set.of());
        var session = collector.openSession("test_add");
        Files.writeString(session.file(), lib + ":3\n" + lib + ":6\n");

        collector.absorb(session);

        assertFalse(Files.exists(session.file()));
        assertEquals("2 2 100.0", collector.data().statsFor(lib).tokens());
    }

    @Test
    void sessionWithoutFileIsIgnored(@TempDir Path dir) {
        var collector = new TraceCollector(dir, Set.of());
        collector.absorb(collector.openSession("never ran"));
        assertEquals(0, collector.data().size());
    }

    @Test
    void sessionsGetDistinctFiles(@TempDir Path dir) {
        var collector = new TraceCollector(dir, Set.of());
        assertTrue(!collector.openSession("a").file().equals(collector.openSession("a").file()));
    }

    @Test
    void parsesPathsContainingColons() {
        assertEquals(Optional.of(new TraceRecord(Path.of("/tmp/a:b/lib.sh"), 4)), TraceRecord.parse("/tmp/a:b/lib.sh:4"));
        assertTrue(TraceRecord.parse("/tmp/lib.sh:0").isEmpty());
    }
}
