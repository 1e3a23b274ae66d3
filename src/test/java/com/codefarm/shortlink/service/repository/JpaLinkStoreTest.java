package com.codefarm.shortlink.service.repository;

import com.codefarm.shortlink.service.exception.StorageUnavailableException;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@SpringBootTest
class JpaLinkStoreTest {

    @Autowired
    private LinkStore store;

    @Test
    void defaultStoreIsJpa() {
        assertThat(store).isInstanceOf(JpaLinkStore.class);
    }

    @Test
    void putIfAbsentThenGet() {
        String id = uniqueId();

        assertThat(store.putIfAbsent(id, "https://example.com/jpa")).isTrue();
        assertThat(store.get(id)).contains("https://example.com/jpa");
    }

    @Test
    void duplicateInsertIsRejectedAndFirstUrlKept() {
        String id = uniqueId();
        store.putIfAbsent(id, "https://example.com/first");

        assertThat(store.putIfAbsent(id, "https://example.com/second")).isFalse();
        assertThat(store.get(id)).contains("https://example.com/first");
    }

    @Test
    void valueTooLongForColumnIsNotTreatedAsCollision() {
        String id = uniqueId();
        String url = "https://example.com/" + "x".repeat(3000);

        assertThatThrownBy(() -> store.putIfAbsent(id, url))
                .isInstanceOf(StorageUnavailableException.class);
        assertThat(store.get(id)).isEmpty();
    }

    @Test
    void unknownIdIsEmpty() {
        assertThat(store.get(uniqueId())).isEmpty();
    }

    @Test
    void concurrentInsertsOfSameIdHaveSingleWinner() throws Exception {
        String id = uniqueId();
        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<Boolean>> results = new ArrayList<>();
            for (int i = 0; i < 20; i++) {
                String url = "https://example.com/race/" + i;
                results.add(pool.submit(() -> {
                    start.await();
                    return store.putIfAbsent(id, url);
                }));
            }
            start.countDown();

            long wins = 0;
            for (Future<Boolean> result : results) {
                if (result.get()) {
                    wins++;
                }
            }
            assertThat(wins).isEqualTo(1);
            assertThat(store.get(id)).isPresent();
        } finally {
            pool.shutdownNow();
        }
    }

    private static String uniqueId() {
        return UUID.randomUUID().toString().replace("-", "").substring(0, 12);
    }
}
