package com.unconference.backend.modules.schedule.application;

import java.util.concurrent.atomic.AtomicLong;

import org.springframework.stereotype.Component;

/**
 * Last-request-wins bookkeeping for {@code generate}. Every request takes a ticket; issuing a newer
 * ticket supersedes all older ones, which their optimizer runs observe through {@link Ticket#isSuperseded()}.
 */
@Component
public class GenerationCoordinator {

    private final AtomicLong latest = new AtomicLong();

    public Ticket issue() {
        return new Ticket(latest.incrementAndGet());
    }

    public long latestTicket() {
        return latest.get();
    }

    public final class Ticket {

        private final long number;

        private Ticket(long number) {
            this.number = number;
        }

        public long number() {
            return number;
        }

        public boolean isSuperseded() {
            return latest.get() != number;
        }

        @Override
        public String toString() {
            return "Ticket#" + number;
        }
    }
}
