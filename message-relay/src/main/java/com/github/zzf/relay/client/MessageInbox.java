package com.github.zzf.relay.client;

import com.github.zzf.relay.protocol.model.Message;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ConcurrentNavigableMap;
import java.util.concurrent.ConcurrentSkipListMap;
import lombok.extern.slf4j.Slf4j;

/**
 * <pre>
 * sorts inbound messages by kind until a consumer drains them
 *
 * text / event: queued in arrival order
 * snapshot:     only the latest one of every sender is kept
 * </pre>
 */
@Slf4j
public class MessageInbox implements MessageHandler {

    private final Queue<Message> texts = new ConcurrentLinkedQueue<>();
    private final Queue<Message> events = new ConcurrentLinkedQueue<>();
    // senderId -> latest snapshot
    private final ConcurrentNavigableMap<Integer, Message> snapshots = new ConcurrentSkipListMap<>();

    private volatile boolean closed;

    @Override
    public void onText(Message message) {
        texts.add(message);
    }

    @Override
    public void onEvent(Message message) {
        events.add(message);
    }

    @Override
    public void onSnapshot(Message message) {
        Message previous = snapshots.put(message.senderId(), message);
        if (previous != null) {
            log.debug("snapshot of sender({}) replaced before it was drained", message.senderId());
        }
    }

    @Override
    public void clientClosed() {
        closed = true;
    }

    public List<Message> drainTexts() {
        return drain(texts);
    }

    public List<Message> drainEvents() {
        return drain(events);
    }

    /**
     * @return senderId -> latest snapshot, ordered by senderId
     */
    public Map<Integer, Message> drainSnapshots() {
        Map<Integer, Message> ret = new LinkedHashMap<>();
        Map.Entry<Integer, Message> e;
        while ((e = snapshots.pollFirstEntry()) != null) {
            ret.put(e.getKey(), e.getValue());
        }
        return ret;
    }

    public boolean isClosed() {
        return closed;
    }

    private static List<Message> drain(Queue<Message> queue) {
        List<Message> ret = new ArrayList<>();
        Message m;
        while ((m = queue.poll()) != null) {
            ret.add(m);
        }
        return ret;
    }

}
