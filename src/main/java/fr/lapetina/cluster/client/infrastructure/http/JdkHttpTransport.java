package fr.lapetina.cluster.client.infrastructure.http;

import fr.lapetina.cluster.client.domain.model.ClusterResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * {@link HttpTransport} backed by {@code java.net.http.HttpClient}.
 *
 * Uses the non-blocking {@code sendAsync}; cancelling a returned future
 * cancels the underlying exchange.
 */
public final class JdkHttpTransport implements HttpTransport {

    private static final Logger log = LoggerFactory.getLogger(JdkHttpTransport.class);

    private final HttpClient httpClient;
    private final AtomicInteger inFlightExchanges = new AtomicInteger(0);

    public JdkHttpTransport(HttpClient httpClient) {
        this.httpClient = Objects.requireNonNull(httpClient, "HttpClient is required");
    }

    public JdkHttpTransport(Duration connectTimeout) {
        this(HttpClient.newBuilder()
                .connectTimeout(connectTimeout)
                .version(HttpClient.Version.HTTP_1_1)
                .build());
    }

    public JdkHttpTransport() {
        this(Duration.ofSeconds(10));
    }

    @Override
    public CompletableFuture<ClusterResponse> send(HttpRequest request) {
        CompletableFuture<HttpResponse<String>> exchange =
                httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        inFlightExchanges.incrementAndGet();

        CompletableFuture<ClusterResponse> result = exchange
                .whenComplete((response, error) -> inFlightExchanges.decrementAndGet())
                .thenApply(response ->
                        new ClusterResponse(response.statusCode(), response.headers().map(), response.body()));
        result.whenComplete((response, error) -> {
            if (result.isCancelled() && !exchange.isDone()) {
                log.debug("Cancelling exchange: method={}, uri={}", request.method(), request.uri());
                exchange.cancel(true);
            }
        });
        return result;
    }

    /**
     * Number of exchanges sent and not yet completed, failed or cancelled.
     */
    public int getInFlightExchanges() {
        return inFlightExchanges.get();
    }

    public HttpClient getHttpClient() {
        return httpClient;
    }
}
