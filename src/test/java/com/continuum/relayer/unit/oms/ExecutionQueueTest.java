package com.continuum.relayer.unit.oms;

import static org.assertj.core.api.Assertions.assertThat;

import com.continuum.relayer.oms.ExecutionQueue;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class ExecutionQueueTest {

    private ExecutionQueue queue;

    @BeforeEach
    void setUp() {
        queue = new ExecutionQueue();
    }

    @Nested
    @DisplayName("Ordering")
    class Ordering {

        @Test
        @DisplayName("Ids are dequeued in insertion order")
        void dequeuesInInsertionOrder() {
            queue.enqueue("ord_a");
            queue.enqueue("ord_b");
            queue.enqueue("ord_c");

            assertThat(queue.dequeueNext()).contains("ord_a");
            assertThat(queue.dequeueNext()).contains("ord_b");
            assertThat(queue.dequeueNext()).contains("ord_c");
            assertThat(queue.dequeueNext()).isEmpty();
        }

        @Test
        @DisplayName("restoreToHead puts an id back in front of the rest")
        void restoreToHeadKeepsPosition() {
            queue.enqueue("ord_a");
            queue.enqueue("ord_b");

            String head = queue.dequeueNext().orElseThrow();
            queue.restoreToHead(head);

            assertThat(queue.snapshot()).containsExactly("ord_a", "ord_b");
        }
    }

    @Nested
    @DisplayName("Membership")
    class Membership {

        @Test
        @DisplayName("An id already queued is not added twice")
        void enqueueIsIdempotent() {
            assertThat(queue.enqueue("ord_a")).isTrue();
            assertThat(queue.enqueue("ord_a")).isFalse();

            assertThat(queue.size()).isEqualTo(1);
        }

        @Test
        @DisplayName("A dequeued id can be enqueued again")
        void dequeuedIdCanReturn() {
            queue.enqueue("ord_a");
            queue.dequeueNext();

            assertThat(queue.enqueue("ord_a")).isTrue();
            assertThat(queue.contains("ord_a")).isTrue();
        }

        @Test
        @DisplayName("remove drops an id from the middle of the queue")
        void removeFromMiddle() {
            queue.enqueue("ord_a");
            queue.enqueue("ord_b");
            queue.enqueue("ord_c");

            assertThat(queue.remove("ord_b")).isTrue();
            assertThat(queue.remove("ord_b")).isFalse();
            assertThat(queue.snapshot()).containsExactly("ord_a", "ord_c");
        }
    }
}
