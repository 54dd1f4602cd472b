package me.golemcore.dispatch.domain.handler;

import me.golemcore.dispatch.domain.command.CommandOutcome;
import me.golemcore.dispatch.domain.command.CommandSet;
import me.golemcore.dispatch.domain.model.DispatchContext;
import me.golemcore.dispatch.domain.model.Message;
import me.golemcore.dispatch.domain.response.ResponseWriter;
import me.golemcore.dispatch.testsupport.QueueAdapter;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.test.web.reactive.server.WebTestClient;
import org.springframework.web.reactive.function.server.RequestPredicates;
import org.springframework.web.reactive.function.server.RouterFunctions;
import org.springframework.web.reactive.function.server.ServerResponse;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class HandlersTest {

    private static final DispatchContext CTX = DispatchContext.background();

    @Test
    void shouldWrapRawFunction() {
        List<String> seen = new ArrayList<>();
        RawHandler handler = Handlers.raw("logger", "logs everything", (ctx, w, m) -> seen.add(m.getText()));

        handler.processMessage(CTX, ResponseWriter.discarding(new Message()), QueueAdapter.message("#a", "bob", "hi"));

        assertEquals("logger", handler.getName());
        assertEquals("logs everything", handler.getDescription());
        assertEquals(List.of("hi"), seen);
    }

    @Test
    void shouldExposeHearsPattern() {
        Pattern pattern = Pattern.compile("tableflip");
        HearsHandler handler = Handlers.hears("flip", "flips tables", pattern, (ctx, w, m, matches) -> {
        });

        assertSame(pattern, handler.getPattern());
    }

    @Test
    void shouldBuildCommandWithSubCommands() {
        CommandSet subs = new CommandSet();
        subs.add(Handlers.command("start", "", (ctx, w, m) -> CommandOutcome.success()));

        CommandHandler handler = Handlers.command("svc", "", null, subs);

        CommandWithSubsHandler withSubs = assertInstanceOf(CommandWithSubsHandler.class, handler);
        assertSame(subs, withSubs.getSubCommands());
    }

    @Test
    void shouldDeferByDefaultAfterParsingFlags() {
        CommandWithSubsHandler handler = Handlers.command("svc", "", null, new CommandSet());
        Message message = Message.builder().text("svc start").build();
        message.parseArgs();
        message.prepareCommand("svc");

        CommandOutcome outcome = handler.command(CTX, ResponseWriter.discarding(new Message()), message);

        assertEquals(CommandOutcome.Status.DEFER_TO_SUBCOMMAND, outcome.status());
        assertSame(CTX, outcome.context());
        assertEquals(List.of("start"), message.getArgs());
    }

    @Test
    void shouldRunBackgroundFunction() {
        List<String> started = new ArrayList<>();
        BackgroundHandler handler = Handlers.background("ticker", "", (ctx, w) -> started.add("ticker"));

        handler.startBackground(CTX, ResponseWriter.discarding(new Message()));

        assertEquals(List.of("ticker"), started);
    }

    @Test
    void shouldDefaultBlankDescription() {
        RawHandler handler = Handlers.raw("quiet", null, (ctx, w, m) -> {
        });

        assertEquals("", handler.getDescription());
        assertTrue(handler.toString().contains("quiet"));
    }

    @Test
    void shouldAttachAdapterWriterToWebHookRequests() throws InterruptedException {
        QueueAdapter adapter = new QueueAdapter("irc");
        WebHookHandler hook = Handlers.webHook("notify", "posts notifications",
                request -> Handlers.responseWriter(request)
                        .map(w -> {
                            w.setChannel("#alerts");
                            w.write("deployed");
                            return ServerResponse.ok().bodyValue("sent");
                        })
                        .orElseGet(() -> ServerResponse.status(HttpStatus.SERVICE_UNAVAILABLE).build()));
        hook.setUrl(URI.create("http://bot.example.com/hooks/notify/"));
        hook.setAdapter(adapter);

        WebTestClient client = WebTestClient
                .bindToRouterFunction(RouterFunctions.route(RequestPredicates.POST("/notify"), hook))
                .build();

        client.post().uri("/notify")
                .exchange()
                .expectStatus().isOk()
                .expectBody(String.class).isEqualTo("sent");

        assertEquals(URI.create("http://bot.example.com/hooks/notify/"), hook.getUrl());
        Message sent = adapter.getSent().get(0);
        assertEquals("#alerts", sent.getChannel());
        assertEquals("deployed", sent.getText());
    }

    @Test
    void shouldNotAttachWriterBeforeAdapterIsBound() {
        WebHookHandler hook = Handlers.webHook("notify", "",
                request -> Handlers.responseWriter(request).isPresent()
                        ? ServerResponse.ok().build()
                        : ServerResponse.status(HttpStatus.SERVICE_UNAVAILABLE).build());

        WebTestClient.bindToRouterFunction(RouterFunctions.route(RequestPredicates.GET("/notify"), hook))
                .build()
                .get().uri("/notify")
                .exchange()
                .expectStatus().isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
    }
}
