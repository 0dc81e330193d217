package io.prism.rag.concurrent;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DocumentLocksTest {

    private final DocumentLocks locks = new DocumentLocks();
    private final ExecutorService executor = Executors.newFixedThreadPool(4);

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void releasedLocksAreEvicted() {
        for (int i = 0; i < 1_000; i++) {
            locks.lock("doc-" + i);
            locks.unlock("doc-" + i);
        }

        assertThat(locks.size()).isZero();
    }

    @Test
    void reentrantLockIsEvictedAfterLastUnlock() {
        locks.lock("doc");
        locks.lock("doc");
        locks.unlock("doc");
        assertThat(locks.size()).isEqualTo(1);

        locks.unlock("doc");
        assertThat(locks.size()).isZero();
    }

    @Test
    void sameDocumentIsMutuallyExclusive() throws Exception {
        AtomicInteger inside = new AtomicInteger();
        AtomicInteger maxInside = new AtomicInteger();
        List<Future<?>> tasks = new ArrayList<>();
        for (int i = 0; i < 8; i++) {
            tasks.add(executor.submit(() -> {
                for (int round = 0; round < 50; round++) {
                    locks.lock("doc");
                    try {
                        maxInside.accumulateAndGet(inside.incrementAndGet(), Math::max);
                        Thread.yield();
                        inside.decrementAndGet();
                    } finally {
                        locks.unlock("doc");
                    }
                }
            }));
        }
        for (Future<?> task : tasks) {
            task.get(10, TimeUnit.SECONDS);
        }

        assertThat(maxInside).hasValue(1);
        assertThat(locks.size()).isZero();
    }

    @Test
    void differentDocumentsDoNotBlockEachOther() throws Exception {
        CountDownLatch bothHeld = new CountDownLatch(2);
        Future<Boolean> first = executor.submit(() -> holdUntilBothHeld("a", bothHeld));
        Future<Boolean> second = executor.submit(() -> holdUntilBothHeld("b", bothHeld));

        assertThat(first.get(10, TimeUnit.SECONDS)).isTrue();
        assertThat(second.get(10, TimeUnit.SECONDS)).isTrue();
    }

    @Test
    void unlockWithoutLockFails() {
        assertThatThrownBy(() -> locks.unlock("doc")).isInstanceOf(IllegalMonitorStateException.class);
    }

    private boolean holdUntilBothHeld(String documentId, CountDownLatch bothHeld) throws InterruptedException {
        locks.lock(documentId);
        try {
            bothHeld.countDown();
            return bothHeld.await(5, TimeUnit.SECONDS);
        } finally {
            locks.unlock(documentId);
        }
    }
}
