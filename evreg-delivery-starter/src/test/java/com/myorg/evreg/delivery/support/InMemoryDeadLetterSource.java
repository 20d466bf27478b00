package com.myorg.evreg.delivery.support;

import com.myorg.evreg.contracts.core.envelope.DeadLetterRecord;
import com.myorg.evreg.contracts.core.spi.DeadLetterSource;
import com.myorg.evreg.contracts.core.spi.ReceivedDeadLetter;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/** Single-partition dead-letter topic held in a list; the read position falls back to the commit on rewind. */
public class InMemoryDeadLetterSource implements DeadLetterSource {

    private final List<ReceivedDeadLetter> log = new ArrayList<>();
    private int position;
    private long committed = -1;
    private int rewinds;

    public ReceivedDeadLetter add(String sourceTopic, DeadLetterRecord record) {
        ReceivedDeadLetter r = ReceivedDeadLetter.readable(sourceTopic, 0, log.size(), record, "{}");
        log.add(r);
        return r;
    }

    public ReceivedDeadLetter addUnreadable(String sourceTopic, String raw) {
        ReceivedDeadLetter r = ReceivedDeadLetter.unreadable(sourceTopic, 0, log.size(), raw, "bad json");
        log.add(r);
        return r;
    }

    @Override
    public List<ReceivedDeadLetter> poll(int maxRecords, Duration timeout) {
        List<ReceivedDeadLetter> out = new ArrayList<>();
        while (out.size() < maxRecords && position < log.size()) {
            out.add(log.get(position++));
        }
        return out;
    }

    @Override
    public void commit(ReceivedDeadLetter received) {
        committed = Math.max(committed, received.offset());
    }

    @Override
    public void rewind() {
        rewinds++;
        position = (int) (committed + 1);
    }

    public long committedOffset() {
        return committed;
    }

    public int rewinds() {
        return rewinds;
    }
}
