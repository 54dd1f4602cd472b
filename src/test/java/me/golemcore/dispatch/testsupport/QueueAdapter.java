package me.golemcore.dispatch.testsupport;

import me.golemcore.dispatch.domain.model.DispatchContext;
import me.golemcore.dispatch.domain.model.Message;
import me.golemcore.dispatch.port.inbound.Adapter;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * In-memory adapter: tests push inbound messages with {@link #deliver} and
 * read what handlers sent with {@link #awaitSent}.
 */
public class QueueAdapter implements Adapter {

    private final String adapterType;
    private final BlockingQueue<Message> inbound = new LinkedBlockingQueue<>();
    private final BlockingQueue<Message> sent = new LinkedBlockingQueue<>();

    public QueueAdapter(String adapterType) {
        this.adapterType = adapterType;
    }

    public void deliver(Message message) {
        inbound.add(message);
    }

    @Override
    public Message receive() throws InterruptedException {
        return inbound.take();
    }

    @Override
    public void send(DispatchContext ctx, Message message) {
        sent.add(message);
    }

    @Override
    public String getAdapterType() {
        return adapterType;
    }

    public Message awaitSent(Duration timeout) throws InterruptedException {
        return sent.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    public List<Message> getSent() {
        return new ArrayList<>(sent);
    }

    public static Message message(String channel, String from, String text) {
        return Message.builder()
                .channel(channel)
                .from(from)
                .text(text)
                .build();
    }

    public static Message toBot(String channel, String from, String text) {
        Message message = message(channel, from, text);
        message.setToBot(true);
        return message;
    }
}
