package me.golemcore.dispatch.domain.command;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ShellWordsTest {

    @Test
    void shouldSplitOnWhitespace() {
        assertEquals(List.of("deploy", "-v", "prod"), ShellWords.parse("  deploy \t-v   prod\n"));
    }

    @Test
    void shouldGroupDoubleQuotedWords() {
        assertEquals(List.of("say", "hello world"), ShellWords.parse("say \"hello world\""));
    }

    @Test
    void shouldKeepSingleQuotedTextLiteral() {
        assertEquals(List.of("echo", "a\\b \"c\""), ShellWords.parse("echo 'a\\b \"c\"'"));
    }

    @Test
    void shouldHonourBackslashEscapes() {
        assertEquals(List.of("a b", "x\"y"), ShellWords.parse("a\\ b \"x\\\"y\""));
    }

    @Test
    void shouldJoinAdjacentQuotedParts() {
        assertEquals(List.of("foobar baz"), ShellWords.parse("foo'bar'\" baz\""));
    }

    @Test
    void shouldKeepEmptyQuotedWord() {
        assertEquals(List.of("set", ""), ShellWords.parse("set ''"));
    }

    @Test
    void shouldReturnEmptyListForBlankOrNullText() {
        assertTrue(ShellWords.parse("   ").isEmpty());
        assertTrue(ShellWords.parse(null).isEmpty());
    }

    @Test
    void shouldRejectUnterminatedQuote() {
        assertThrows(CommandLineSyntaxException.class, () -> ShellWords.parse("say \"hello"));
        assertThrows(CommandLineSyntaxException.class, () -> ShellWords.parse("say 'hello"));
    }

    @Test
    void shouldRejectTrailingBackslash() {
        assertThrows(CommandLineSyntaxException.class, () -> ShellWords.parse("say hello\\"));
    }
}
