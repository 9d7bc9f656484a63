package com.algoexec.unit.broker;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.algoexec.broker.OrderIdAllocator;
import com.algoexec.exception.BrokerException;
import com.algoexec.exception.ErrorCode;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import org.junit.jupiter.api.Test;

class OrderIdAllocatorTest {

    @Test
    void next_beforeSeed_isBrokerUnavailable() {
        OrderIdAllocator allocator = new OrderIdAllocator();

        assertThat(allocator.isInitialized()).isFalse();
        assertThatThrownBy(allocator::next)
                .isInstanceOf(BrokerException.class)
                .satisfies(e -> assertThat(((BrokerException) e).getErrorCode()).isEqualTo(ErrorCode.BROKER_UNAVAILABLE));
    }

    @Test
    void reset_neverMovesBackwards() {
        OrderIdAllocator allocator = new OrderIdAllocator();
        allocator.reset(5);

        assertThat(allocator.next()).isEqualTo(5);
        assertThat(allocator.next()).isEqualTo(6);

        allocator.reset(3);
        assertThat(allocator.next()).isEqualTo(7);

        allocator.reset(20);
        assertThat(allocator.next()).isEqualTo(20);
    }

    @Test
    void next_isUniqueAcrossThreads() throws Exception {
        OrderIdAllocator allocator = new OrderIdAllocator();
        allocator.reset(1);
        Set<Integer> ids = ConcurrentHashMap.newKeySet();
        ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int t = 0; t < 4; t++) {
                futures.add(pool.submit(() -> {
                    for (int i = 0; i < 500; i++) {
                        ids.add(allocator.next());
                    }
                }));
            }
            for (Future<?> future : futures) {
                future.get();
            }
        } finally {
            pool.shutdownNow();
        }

        assertThat(ids).hasSize(2000);
        assertThat(allocator.next()).isEqualTo(2001);
    }
}
