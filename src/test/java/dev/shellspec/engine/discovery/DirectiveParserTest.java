package dev.shellspec.engine.discovery;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.util.List;
import org.junit.jupiter.api.Test;

class DirectiveParserTest {
    @Test
    void readsSkipWithReason() {
        var lines = List.of("# @SKIP needs network", "test_download() {", "}");
        assertEquals(Directive.skip("needs network"), DirectiveParser.parse(lines, 2));
    }

    @Test
    void readsTodoWithoutReason() {
        var lines = List.of("  #@TODO", "test_later() {");
        var directive = DirectiveParser.parse(lines, 2);
        assertEquals(Directive.Kind.TODO, directive.kind());
        assertEquals("", directive.reason());
        assertEquals("TODO", directive.tapText());
    }

    @Test
    void onlyTheImmediatelyPrecedingLineCounts() {
        var lines = List.of("# @SKIP too far away", "", "test_x() {");
        assertEquals(Directive.NONE, DirectiveParser.parse(lines, 3));
    }

    @Test
    void firstLineHasNoDirective() {
        assertEquals(Directive.NONE, DirectiveParser.parse(List.of("test_x() {"), 1));
    }

    @Test
    void ordinaryCommentsAreIgnored() {
        assertEquals(Directive.NONE, DirectiveParser.parseComment("# SKIP this is prose"));
        assertEquals(Directive.NONE, DirectiveParser.parseComment("# @skip lowercase"));
        assertEquals(Directive.NONE, DirectiveParser.parseComment("echo '# @SKIP'"));
    }

    @Test
    void rendersTapDirective() {
        assertEquals("SKIP no database", Directive.skip("  no database ").tapText());
        assertEquals("", Directive.NONE.tapText());
    }
}
