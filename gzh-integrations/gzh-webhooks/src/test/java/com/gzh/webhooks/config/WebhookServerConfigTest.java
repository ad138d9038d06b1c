package com.gzh.webhooks.config;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WebhookServerConfigTest {

    @Test
    void defaults() {
        WebhookServerConfig config = WebhookServerConfig.builder().build();

        assertThat(config.getPort()).isEqualTo(8080);
        assertThat(config.getPath()).isEqualTo("/webhook");
        assertThat(config.getWorkers()).isEqualTo(10);
        assertThat(config.getQueueCapacity()).isEqualTo(100);
        assertThat(config.isSignatureVerificationEnabled()).isFalse();
        assertThat(config.getEventHeader()).isEqualTo("X-GitHub-Event");
        assertThat(config.getDeliveryHeader()).isEqualTo("X-GitHub-Delivery");
    }

    @Test
    void platformDeterminesHeaders() {
        WebhookServerConfig config = WebhookServerConfig.builder().platform("Gitea").sharedSecret("s").build();

        assertThat(config.getEventHeader()).isEqualTo("X-Gitea-Event");
        assertThat(config.getHeaderPrefix()).isEqualTo("X-Gitea-");
        assertThat(config.isSignatureVerificationEnabled()).isTrue();
    }

    @Test
    void rejectsInvalidSettings() {
        assertThatThrownBy(() -> WebhookServerConfig.builder().port(70000).build())
                .isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> WebhookServerConfig.builder().path("webhook").build())
                .isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> WebhookServerConfig.builder().path("/metrics").build())
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("reserved");
        assertThatThrownBy(() -> WebhookServerConfig.builder().workers(0).build())
                .isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> WebhookServerConfig.builder().queueCapacity(0).build())
                .isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> WebhookServerConfig.builder().shutdownGracePeriod(Duration.ofSeconds(-1)).build())
                .isInstanceOf(IllegalStateException.class);
    }
}
