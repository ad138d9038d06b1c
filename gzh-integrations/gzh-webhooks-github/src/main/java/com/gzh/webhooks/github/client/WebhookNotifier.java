package com.gzh.webhooks.github.client;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.gzh.webhooks.handler.ExecutionContext;
import org.apache.hc.client5.http.classic.methods.HttpPost;
import org.apache.hc.client5.http.config.ConnectionConfig;
import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManagerBuilder;
import org.apache.hc.core5.http.ContentType;
import org.apache.hc.core5.http.io.entity.EntityUtils;
import org.apache.hc.core5.http.io.entity.StringEntity;
import org.apache.hc.core5.util.Timeout;

import java.io.IOException;
import java.time.Duration;
import java.util.Map;

/**
 * Posts {@code {"text": "..."}} to incoming-webhook URLs (Slack, Discord,
 * Teams and most chat services accept this shape).
 *
 * <p>Uses its own HTTP client so no GitHub credentials are ever sent to a
 * notification endpoint.
 */
public class WebhookNotifier implements AutoCloseable {

    private static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(10);

    private final CloseableHttpClient http;
    private final ObjectMapper        mapper = new ObjectMapper();

    public WebhookNotifier() {
        Timeout timeout = Timeout.ofMilliseconds(DEFAULT_TIMEOUT.toMillis());
        this.http = HttpClients.custom()
                .setConnectionManager(PoolingHttpClientConnectionManagerBuilder.create()
                        .setDefaultConnectionConfig(ConnectionConfig.custom()
                                .setConnectTimeout(timeout)
                                .build())
                        .build())
                .setDefaultRequestConfig(RequestConfig.custom()
                        .setResponseTimeout(timeout)
                        .build())
                .build();
    }

    public void send(ExecutionContext context, String url, String text) throws IOException {
        if (context.isCancelled()) {
            throw new IOException("Notification cancelled before it was sent");
        }
        HttpPost req = new HttpPost(url);
        req.setEntity(new StringEntity(mapper.writeValueAsString(Map.of("text", text)), ContentType.APPLICATION_JSON));
        context.remaining().ifPresent(left -> req.setConfig(RequestConfig.custom()
                .setResponseTimeout(Timeout.ofMilliseconds(Math.max(1, left.toMillis())))
                .build()));

        http.execute(req, response -> {
            int status = response.getCode();
            EntityUtils.consume(response.getEntity());
            if (status < 200 || status >= 300) {
                throw new IOException("Notification endpoint answered HTTP " + status);
            }
            return null;
        });
    }

    @Override
    public void close() throws IOException {
        http.close();
    }
}
