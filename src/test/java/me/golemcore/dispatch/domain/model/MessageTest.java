package me.golemcore.dispatch.domain.model;

import me.golemcore.dispatch.domain.command.CommandFlags;
import me.golemcore.dispatch.domain.command.CommandLineSyntaxException;
import me.golemcore.dispatch.domain.command.CommandOutcome;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MessageTest {

    @Test
    void shouldTokenizeTextOnce() {
        Message message = Message.builder().text("say \"hello world\"").build();
        assertFalse(message.hasArgs());

        List<String> first = message.parseArgs();
        message.setText("something else");

        assertEquals(List.of("say", "hello world"), first);
        assertSame(first, message.parseArgs());
        assertTrue(message.hasArgs());
    }

    @Test
    void shouldPropagateSyntaxErrors() {
        Message message = Message.builder().text("say \"hello").build();

        assertThrows(CommandLineSyntaxException.class, message::parseArgs);
        assertFalse(message.hasArgs());
    }

    @Test
    void shouldReplaceArgsWithRemainingAfterParse() {
        Message message = Message.builder().text("deploy -v app extra").build();
        message.parseArgs();
        CommandFlags flags = message.prepareCommand("deploy");
        CommandFlags.Flag<Boolean> verbose = flags.bool("v", false, "verbose");

        CommandOutcome outcome = message.parse();

        assertTrue(outcome.isSuccess());
        assertTrue(verbose.get());
        assertEquals(List.of("app", "extra"), message.getArgs());
    }

    @Test
    void shouldKeepArgsWhenParseFails() {
        Message message = Message.builder().text("deploy -x app").build();
        message.parseArgs();
        message.prepareCommand("deploy");

        CommandOutcome outcome = message.parse();

        assertTrue(outcome.isFailure());
        assertEquals(List.of("deploy", "-x", "app"), message.getArgs());
    }

    @Test
    void shouldCopyEnvelopeAndArgsButNotFlags() {
        Message message = Message.builder()
                .channel("#ops")
                .from("alice")
                .to("bob")
                .userId("u-1")
                .privateMessage(true)
                .toBot(true)
                .text("status")
                .build();
        message.parseArgs();
        message.prepareCommand("status");

        Message copy = message.copy();

        assertEquals("#ops", copy.getChannel());
        assertEquals("alice", copy.getFrom());
        assertEquals("bob", copy.getTo());
        assertEquals("u-1", copy.getUserId());
        assertTrue(copy.isPrivateMessage());
        assertTrue(copy.isToBot());
        assertEquals("status", copy.getText());
        assertSame(message.getArgs(), copy.getArgs());
        assertNull(copy.getFlags());
    }
}
