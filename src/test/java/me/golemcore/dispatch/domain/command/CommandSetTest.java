package me.golemcore.dispatch.domain.command;

import me.golemcore.dispatch.domain.handler.CommandHandler;
import me.golemcore.dispatch.domain.handler.Handlers;
import me.golemcore.dispatch.domain.model.DispatchContext;
import me.golemcore.dispatch.domain.model.Message;
import me.golemcore.dispatch.domain.response.ResponseWriter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CommandSetTest {

    private static final DispatchContext CTX = DispatchContext.background();

    private final List<String> invoked = new ArrayList<>();
    private CommandSet commands;
    private ResponseWriter writer;

    @BeforeEach
    void setUp() {
        commands = new CommandSet();
        commands.add(recording("status"));
        commands.add(recording("deploy"));
        commands.add(recording("help"));
        commands.add(recording("delete"));
        writer = ResponseWriter.discarding(new Message());
    }

    @Test
    void shouldListHelpFirstThenAlphabetically() {
        assertEquals(List.of("help", "delete", "deploy", "status"), commands.names());
    }

    @Test
    void shouldDispatchUniquePrefix() {
        CommandOutcome outcome = commands.nextCommand(CTX, writer, message("dep now"));

        assertTrue(outcome.isSuccess());
        assertEquals(List.of("deploy"), invoked);
    }

    @Test
    void shouldPreferExactMatchOverLongerNames() {
        commands.add(recording("deployall"));

        CommandOutcome outcome = commands.nextCommand(CTX, writer, message("deploy"));

        assertTrue(outcome.isSuccess());
        assertEquals(List.of("deploy"), invoked);
    }

    @Test
    void shouldReportAmbiguousPrefixWithSortedCandidates() {
        CommandOutcome outcome = commands.nextCommand(CTX, writer, message("de"));

        assertTrue(outcome.is(CommandErrorKind.AMBIGUOUS_COMMAND));
        assertEquals("ambiguous command, de: delete, deploy", outcome.detail());
        assertTrue(invoked.isEmpty());
    }

    @Test
    void shouldReportUnknownCommand() {
        CommandOutcome outcome = commands.nextCommand(CTX, writer, message("reboot"));

        assertTrue(outcome.is(CommandErrorKind.UNKNOWN_COMMAND));
        assertEquals("unknown command: reboot", outcome.detail());
    }

    @Test
    void shouldReportMissingSubCommandWithNames() {
        CommandOutcome outcome = commands.nextCommand(CTX, writer, message("   "));

        assertTrue(outcome.is(CommandErrorKind.MISSING_SUBCOMMAND));
        assertEquals("required sub-command missing: help, delete, deploy, status", outcome.detail());
    }

    @Test
    void shouldReportBadCommandLine() {
        CommandOutcome outcome = commands.nextCommand(CTX, writer, message("deploy \"oops"));

        assertTrue(outcome.is(CommandErrorKind.BAD_CLI));
        assertTrue(invoked.isEmpty());
    }

    @Test
    void shouldReplaceHandlerWithSameName() {
        commands.add(recording("deploy"));

        assertEquals(4, commands.size());
    }

    private CommandHandler recording(String name) {
        return Handlers.command(name, name + " things", (ctx, w, m) -> {
            invoked.add(name);
            return CommandOutcome.success();
        });
    }

    private static Message message(String text) {
        return Message.builder().text(text).toBot(true).build();
    }
}
