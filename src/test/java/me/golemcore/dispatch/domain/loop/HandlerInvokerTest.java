package me.golemcore.dispatch.domain.loop;

import me.golemcore.dispatch.domain.handler.BackgroundHandler;
import me.golemcore.dispatch.domain.handler.Handlers;
import me.golemcore.dispatch.domain.handler.HearsHandler;
import me.golemcore.dispatch.domain.handler.RawHandler;
import me.golemcore.dispatch.domain.model.DispatchContext;
import me.golemcore.dispatch.domain.model.Message;
import me.golemcore.dispatch.domain.response.ResponseWriter;
import me.golemcore.dispatch.testsupport.QueueAdapter;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.regex.Pattern;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class HandlerInvokerTest {

    private static final DispatchContext CTX = DispatchContext.background();
    private static final ResponseWriter WRITER = ResponseWriter.discarding(new Message());

    @Test
    void shouldReturnEveryMatchWithGroups() {
        HearsHandler handler = hears("(\\w+)=(\\d+)", new AtomicInteger());

        List<List<String>> matches = HandlerInvoker.findAllSubmatches(handler, "a=1 and b=22");

        assertEquals(List.of(List.of("a=1", "a", "1"), List.of("b=22", "b", "22")), matches);
    }

    @Test
    void shouldReturnEmptyStringForGroupsThatDidNotParticipate() {
        HearsHandler handler = hears("(please )?deploy (\\w+)", new AtomicInteger());

        List<List<String>> matches = HandlerInvoker.findAllSubmatches(handler, "deploy api");

        assertEquals(List.of(List.of("deploy api", "", "api")), matches);
    }

    @Test
    void shouldInvokeHearsOnlyOnMatch() {
        AtomicInteger calls = new AtomicInteger();
        HearsHandler ping = hears("^ping$", calls);

        assertTrue(HandlerInvoker.runHears(CTX, ping, WRITER, QueueAdapter.message("#a", "bob", "ping")));
        assertFalse(HandlerInvoker.runHears(CTX, ping, WRITER, QueueAdapter.message("#a", "bob", "pingpong")));
        assertFalse(HandlerInvoker.runHears(CTX, ping, WRITER, new Message()));

        assertEquals(1, calls.get());
    }

    @Test
    void shouldContainRawHandlerException() {
        RawHandler broken = Handlers.raw("broken", "", (ctx, w, m) -> {
            throw new IllegalStateException("boom");
        });

        assertDoesNotThrow(() -> HandlerInvoker.runRaw(CTX, broken, WRITER, new Message()));
    }

    @Test
    void shouldContainHearsHandlerException() {
        HearsHandler broken = Handlers.hears("broken", "", Pattern.compile("."), (ctx, w, m, matches) -> {
            throw new IllegalStateException("boom");
        });

        assertTrue(HandlerInvoker.runHears(CTX, broken, WRITER, QueueAdapter.message("#a", "bob", "x")));
    }

    @Test
    void shouldStartBackgroundOnExecutorAndContainException() {
        List<Runnable> submitted = new ArrayList<>();
        BackgroundHandler broken = Handlers.background("broken", "", (ctx, w) -> {
            throw new IllegalStateException("boom");
        });

        HandlerInvoker.startBackground(submitted::add, CTX, broken, WRITER);

        assertEquals(1, submitted.size());
        assertDoesNotThrow(() -> submitted.get(0).run());
    }

    private static HearsHandler hears(String regex, AtomicInteger calls) {
        return Handlers.hears("h", "", Pattern.compile(regex), (ctx, w, m, matches) -> calls.incrementAndGet());
    }
}
