package me.golemcore.dispatch.domain.command;

import me.golemcore.dispatch.domain.handler.CommandHandler;
import me.golemcore.dispatch.domain.handler.CommandWithSubsHandler;
import me.golemcore.dispatch.domain.handler.Handlers;
import me.golemcore.dispatch.domain.model.DispatchContext;
import me.golemcore.dispatch.domain.model.Message;
import me.golemcore.dispatch.domain.response.AdapterResponseWriter;
import me.golemcore.dispatch.port.outbound.MessageMetricsPort;
import me.golemcore.dispatch.testsupport.QueueAdapter;
import lombok.SneakyThrows;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CommandInvokerTest {

    private static final DispatchContext CTX = DispatchContext.background();

    private QueueAdapter adapter;
    private AdapterResponseWriter writer;

    @BeforeEach
    void setUp() {
        adapter = new QueueAdapter("test");
        writer = new AdapterResponseWriter(adapter, new Message(), "test", MessageMetricsPort.NOOP);
    }

    @Test
    void shouldRenderUsageAndSkipRemainingWhenHelpRequested() {
        CommandHandler deploy = Handlers.command("deploy", "deploys the app", (ctx, w, m) -> {
            m.getFlags().bool("v", false, "verbose output");
            return m.parse();
        });

        CommandOutcome outcome = CommandInvoker.run(CTX, deploy, writer, message("deploy -help"));

        assertEquals(CommandOutcome.Status.SKIP_REMAINING, outcome.status());
        assertEquals(1, adapter.getSent().size());
        assertEquals("Usage: deploy [flags] [args...]\ndeploys the app\n\nFlags:\n  -v\n    \tverbose output\n",
                adapter.getSent().get(0).getText());
    }

    @Test
    void shouldContainHandlerException() {
        CommandHandler broken = Handlers.command("boom", "", (ctx, w, m) -> {
            throw new IllegalStateException("boom");
        });

        CommandOutcome outcome = CommandInvoker.run(CTX, broken, writer, message("boom"));

        assertTrue(outcome.isSuccess());
    }

    @Test
    void shouldContainCheckedExceptionThrownSneakily() {
        CommandHandler sneaky = Handlers.command("sneaky", "", (ctx, w, m) -> readConfig());

        assertTrue(CommandInvoker.run(CTX, sneaky, writer, message("sneaky")).isSuccess());
    }

    @Test
    void shouldContainAssertionError() {
        CommandHandler asserting = Handlers.command("check", "", (ctx, w, m) -> {
            throw new AssertionError("invariant broken");
        });

        assertTrue(CommandInvoker.run(CTX, asserting, writer, message("check")).isSuccess());
    }

    @Test
    void shouldTreatNullOutcomeAsSuccess() {
        CommandHandler quiet = Handlers.command("quiet", "", (ctx, w, m) -> null);

        assertTrue(CommandInvoker.run(CTX, quiet, writer, message("quiet")).isSuccess());
    }

    @Test
    void shouldAttachFlagsNamedAfterInvokedName() {
        AtomicReference<String> flagSetName = new AtomicReference<>();
        CommandHandler status = Handlers.command("status", "", (ctx, w, m) -> {
            flagSetName.set(m.getFlags().getName());
            return CommandOutcome.success();
        });

        CommandInvoker.run(CTX, status, writer, message("stat"));

        assertEquals("stat", flagSetName.get());
    }

    @Test
    void shouldDeferToSubCommandWithRemainingArguments() {
        List<String> seen = new ArrayList<>();
        CommandSet subs = new CommandSet();
        subs.add(Handlers.command("start", "starts it", (ctx, w, m) -> {
            CommandOutcome parsed = m.parse();
            seen.addAll(m.getArgs());
            return parsed;
        }));
        CommandWithSubsHandler svc = Handlers.command("svc", "service control", null, subs);

        CommandOutcome outcome = CommandInvoker.run(CTX, svc, writer, message("svc start now"));

        assertTrue(outcome.isSuccess());
        assertEquals(List.of("now"), seen);
    }

    @Test
    void shouldPassDeferredContextToSubCommand() {
        AtomicReference<String> value = new AtomicReference<>();
        CommandSet subs = new CommandSet();
        subs.add(Handlers.command("show", "", (ctx, w, m) -> {
            value.set(ctx.getValue("target", String.class).orElse(null));
            return CommandOutcome.success();
        }));
        CommandWithSubsHandler svc = Handlers.command("svc", "", (ctx, w, m) -> {
            CommandOutcome parsed = m.parse();
            return parsed.isSuccess() ? CommandOutcome.deferTo(ctx.withValue("target", "db")) : parsed;
        }, subs);

        CommandInvoker.run(CTX, svc, writer, message("svc show"));

        assertEquals("db", value.get());
    }

    @Test
    void shouldRenderSubCommandsInUsage() {
        CommandSet subs = new CommandSet();
        subs.add(Handlers.command("start", "starts it", (ctx, w, m) -> CommandOutcome.success()));
        CommandWithSubsHandler svc = Handlers.command("svc", "service control", null, subs);

        CommandOutcome outcome = CommandInvoker.run(CTX, svc, writer, message("svc -help"));

        assertEquals(CommandOutcome.Status.SKIP_REMAINING, outcome.status());
        assertEquals("Usage: svc <sub-command> [args...]\nservice control\n\nSub-commands:\n  start - starts it\n",
                adapter.getSent().get(0).getText());
    }

    @Test
    void shouldFailWhenDeferringWithoutSubCommands() {
        CommandHandler plain = Handlers.command("plain", "", (ctx, w, m) -> CommandOutcome.deferTo(ctx));

        CommandOutcome outcome = CommandInvoker.run(CTX, plain, writer, message("plain x"));

        assertTrue(outcome.is(CommandErrorKind.NO_SUBCOMMANDS));
    }

    @Test
    void shouldFailWithMissingSubCommandWhenNothingFollows() {
        CommandSet subs = new CommandSet();
        subs.add(Handlers.command("start", "starts it", (ctx, w, m) -> CommandOutcome.success()));
        CommandWithSubsHandler svc = Handlers.command("svc", "", null, subs);

        CommandOutcome outcome = CommandInvoker.run(CTX, svc, writer, message("svc"));

        assertTrue(outcome.is(CommandErrorKind.MISSING_SUBCOMMAND));
        assertEquals("required sub-command missing: start", outcome.detail());
    }

    @Test
    void shouldFailWithNoArgumentsOnEmptyText() {
        CommandHandler any = Handlers.command("any", "", (ctx, w, m) -> CommandOutcome.success());

        CommandOutcome outcome = CommandInvoker.run(CTX, any, writer, message(""));

        assertTrue(outcome.is(CommandErrorKind.NO_ARGUMENTS));
        assertEquals("command handler called with no possible arguments", outcome.detail());
    }

    @Test
    void shouldFailWithBadCliOnUnterminatedQuote() {
        CommandHandler any = Handlers.command("any", "", (ctx, w, m) -> CommandOutcome.success());

        assertTrue(CommandInvoker.run(CTX, any, writer, message("any 'x")).is(CommandErrorKind.BAD_CLI));
    }

    @SneakyThrows
    private static CommandOutcome readConfig() {
        throw new IOException("config unreadable");
    }

    private static Message message(String text) {
        return Message.builder().channel("ops").from("alice").text(text).toBot(true).build();
    }
}
