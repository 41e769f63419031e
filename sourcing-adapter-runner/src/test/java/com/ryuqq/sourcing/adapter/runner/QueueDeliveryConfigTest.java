package com.ryuqq.sourcing.adapter.runner;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class QueueDeliveryConfigTest {

    @Test
    void 기본값() {
        QueueDeliveryConfig config = new QueueDeliveryConfig();

        assertThat(config.batchSize()).isEqualTo(10);
        assertThat(config.concurrency()).isEqualTo(5);
        assertThat(config.maxProcessingTimeMs()).isEqualTo(30000);
    }

    @Test
    void with_메서드는_해당_값만_바꾼다() {
        QueueDeliveryConfig config = new QueueDeliveryConfig().withBatchSize(32).withConcurrency(2);

        assertThat(config).isEqualTo(new QueueDeliveryConfig(32, 2, 30000));
    }

    @Test
    void 양수가_아닌_값은_거부된다() {
        assertThatThrownBy(() -> new QueueDeliveryConfig(0, 5, 30000))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("batchSize");
        assertThatThrownBy(() -> new QueueDeliveryConfig(10, 0, 30000))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("concurrency");
        assertThatThrownBy(() -> new QueueDeliveryConfig(10, 5, 0))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("maxProcessingTimeMs");
    }
}
