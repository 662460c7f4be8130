package com.lineguard.common;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;

class OrderedBatchTest {

    @Test
    @DisplayName("results keep input order even when later items finish first")
    void keepsInputOrder() throws Exception {
        ExecutorService executor = Executors.newFixedThreadPool(4);
        try {
            List<Integer> inputs = List.of(40, 10, 30, 0);
            List<String> results = OrderedBatch.mapInOrder(inputs, delay -> {
                try {
                    Thread.sleep(delay);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return "item-" + delay;
            }, (delay, ex) -> "failed-" + delay, executor);

            assertThat(results).containsExactly("item-40", "item-10", "item-30", "item-0");
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    @DisplayName("a failing item becomes a failure result without affecting the others")
    void isolatesFailures() {
        List<String> results = OrderedBatch.mapInOrder(List.of("a", "boom", "c"), s -> {
            if (s.equals("boom")) {
                throw new IllegalArgumentException("bad item");
            }
            return s.toUpperCase();
        }, (s, ex) -> "error:" + ex.getMessage(), Runnable::run);

        assertThat(results).containsExactly("A", "error:bad item", "C");
    }

    @Test
    @DisplayName("empty input gives empty output")
    void emptyInput() {
        assertThat(OrderedBatch.mapInOrder(List.<String>of(), s -> s, (s, ex) -> s, Runnable::run)).isEmpty();
    }
}
