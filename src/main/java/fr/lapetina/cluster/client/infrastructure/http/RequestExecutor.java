package fr.lapetina.cluster.client.infrastructure.http;

import fr.lapetina.cluster.client.domain.model.ClusterRequest;
import fr.lapetina.cluster.client.domain.model.ClusterResponse;
import fr.lapetina.cluster.client.domain.model.ErrorType;
import fr.lapetina.cluster.client.domain.pool.Connection;
import fr.lapetina.cluster.client.domain.pool.ConnectionPool;
import fr.lapetina.cluster.client.exception.BodyEncodingException;
import fr.lapetina.cluster.client.exception.ClusterClientException;
import fr.lapetina.cluster.client.exception.InvalidRequestException;
import fr.lapetina.cluster.client.exception.PoolExhaustedException;
import fr.lapetina.cluster.client.exception.RequestTimeoutException;
import fr.lapetina.cluster.client.exception.ResponseStatusException;
import fr.lapetina.cluster.client.exception.TransportException;
import fr.lapetina.cluster.client.infrastructure.logging.RequestLogger;
import fr.lapetina.cluster.client.infrastructure.metrics.MetricsRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.URISyntaxException;
import java.net.URLEncoder;
import java.net.http.HttpRequest;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.StringJoiner;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Executes requests against the cluster with node selection and bounded retries.
 *
 * Each call makes at most {@code 1 + maxRetries} transport attempts. A
 * transport failure marks the node dead and moves on to the next node; a
 * response with an error status is returned to the caller as a
 * {@link ResponseStatusException} and never retried. Cancelling the future
 * returned by {@link #executeAsync} aborts the in-flight exchange and leaves
 * the pool untouched.
 */
public final class RequestExecutor {

    private static final Logger log = LoggerFactory.getLogger(RequestExecutor.class);

    private final ConnectionPool pool;
    private final HttpTransport transport;
    private final MetricsRegistry metrics;
    private final BodyEncoder bodyEncoder;
    private final ErrorResponseParser errorParser = new ErrorResponseParser();
    private final RetryBackoff backoff;
    private final int maxRetries;
    private final BasicAuth basicAuth;
    private final String sendGetBodyAs;
    private final RequestLogger infoLog;
    private final RequestLogger traceLog;
    private final RequestLogger errorLog;

    private RequestExecutor(Builder builder) {
        this.pool = Objects.requireNonNull(builder.pool, "Connection pool is required");
        this.transport = Objects.requireNonNull(builder.transport, "Transport is required");
        this.metrics = Objects.requireNonNull(builder.metrics, "Metrics registry is required");
        this.bodyEncoder = builder.bodyEncoder != null ? builder.bodyEncoder : new BodyEncoder();
        this.backoff = builder.backoff != null ? builder.backoff : RetryBackoff.defaults();
        this.maxRetries = builder.maxRetries;
        this.basicAuth = builder.basicAuth;
        this.sendGetBodyAs = builder.sendGetBodyAs;
        this.infoLog = builder.infoLog;
        this.traceLog = builder.traceLog;
        this.errorLog = builder.errorLog;
    }

    /**
     * Executes a request, blocking until it completes.
     *
     * @throws InterruptedException    if the calling thread is interrupted; nothing is
     *                                 sent when the thread was interrupted beforehand
     * @throws ClusterClientException  on any terminal failure
     */
    public ClusterResponse execute(ClusterRequest request) throws InterruptedException {
        if (Thread.interrupted()) {
            throw new InterruptedException("Interrupted before " + request.method() + " " + request.path());
        }

        CompletableFuture<ClusterResponse> call = executeAsync(request);
        try {
            return call.get();
        } catch (InterruptedException e) {
            call.cancel(true);
            throw e;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw new CompletionException(cause);
        }
    }

    /**
     * Executes a request asynchronously.
     *
     * The future fails with a {@link ClusterClientException}; cancelling it
     * aborts the in-flight attempt.
     */
    public CompletableFuture<ClusterResponse> executeAsync(ClusterRequest request) {
        CompletableFuture<ClusterResponse> result = new CompletableFuture<>();

        byte[] payload;
        try {
            payload = bodyEncoder.encode(request.body());
        } catch (BodyEncodingException e) {
            printf(errorLog, "cannot encode body for %s %s: %s", request.method(), request.path(), e.getMessage());
            metrics.recordRequest(request.method(), ErrorType.ENCODING_ERROR, Duration.ZERO);
            result.completeExceptionally(e);
            return result;
        }

        String target;
        try {
            target = requestTarget(request);
        } catch (InvalidRequestException e) {
            printf(errorLog, "%s", e.getMessage());
            metrics.recordRequest(request.method(), ErrorType.INVALID_REQUEST, Duration.ZERO);
            result.completeExceptionally(e);
            return result;
        }

        Call call = new Call(request, effectiveMethod(request), payload, target, result);
        result.whenComplete((response, error) -> call.finish(error));
        if (request.timeout() != null) {
            scheduleDeadline(call, result);
        }
        call.attempt();
        return result;
    }

    /**
     * Fails the call with a {@link RequestTimeoutException} once its timeout elapses.
     * The timer is cancelled as soon as the call completes.
     */
    private void scheduleDeadline(Call call, CompletableFuture<ClusterResponse> result) {
        Duration timeout = call.request.timeout();
        CompletableFuture<Void> deadline = new CompletableFuture<Void>()
                .orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS);
        deadline.whenComplete((ignored, error) -> {
            if (error instanceof TimeoutException) {
                result.completeExceptionally(new RequestTimeoutException(call.method, call.request.path(), timeout));
            }
        });
        result.whenComplete((response, error) -> deadline.complete(null));
    }

    private String effectiveMethod(ClusterRequest request) {
        if ("GET".equals(request.method()) && request.hasBody() && !"GET".equals(sendGetBodyAs)) {
            return sendGetBodyAs;
        }
        return request.method();
    }

    /**
     * Path and query string appended to a node URL.
     *
     * A path that is already a valid URI reference is kept as is, so escapes
     * written by the caller survive. Otherwise characters that are illegal in
     * a URI path (spaces, quotes, braces) are percent-encoded.
     *
     * @throws InvalidRequestException if no valid URI can be formed
     */
    static String requestTarget(ClusterRequest request) {
        String path = encodePath(request);
        if (request.params().isEmpty()) {
            return path;
        }
        StringJoiner query = new StringJoiner("&", path + "?", "");
        for (Map.Entry<String, String> param : request.params().entrySet()) {
            String value = param.getValue() != null ? param.getValue() : "";
            query.add(URLEncoder.encode(param.getKey(), StandardCharsets.UTF_8)
                    + "=" + URLEncoder.encode(value, StandardCharsets.UTF_8));
        }
        return query.toString();
    }

    private static String encodePath(ClusterRequest request) {
        String path = request.path();
        try {
            new URI(path);
            return path;
        } catch (URISyntaxException invalid) {
            try {
                return new URI(null, null, path, null).getRawPath();
            } catch (URISyntaxException e) {
                throw new InvalidRequestException(request.method(), path, e);
            }
        }
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private void printf(RequestLogger target, String format, Object... args) {
        if (target == null) {
            return;
        }
        try {
            target.printf(format, args);
        } catch (RuntimeException e) {
            log.warn("Request logger failed: logger={}, error={}", target.getClass().getName(), e.toString());
        }
    }

    /**
     * State of one request call across its attempts.
     * Attempts run one after another: each is started from the completion of the previous one.
     */
    private final class Call {

        private final ClusterRequest request;
        private final String method;
        private final byte[] payload;
        private final String pathWithParams;
        private final CompletableFuture<ClusterResponse> result;
        private final long startNanos = System.nanoTime();

        private volatile int attempts;
        private volatile CompletableFuture<ClusterResponse> inFlight;

        Call(
                ClusterRequest request,
                String method,
                byte[] payload,
                String pathWithParams,
                CompletableFuture<ClusterResponse> result
        ) {
            this.request = request;
            this.method = method;
            this.payload = payload;
            this.pathWithParams = pathWithParams;
            this.result = result;
        }

        void attempt() {
            if (result.isDone()) {
                return;
            }

            Connection connection;
            try {
                connection = selectConnection();
            } catch (PoolExhaustedException e) {
                printf(errorLog, "no live connection for %s %s: %s", method, pathWithParams, e.getMessage());
                result.completeExceptionally(e);
                return;
            }

            HttpRequest httpRequest;
            try {
                httpRequest = buildRequest(connection);
            } catch (IllegalArgumentException e) {
                printf(errorLog, "cannot create request for %s %s%s: %s",
                        method, connection.getUrl(), pathWithParams, e.getMessage());
                result.completeExceptionally(new InvalidRequestException(method, pathWithParams, e));
                return;
            }

            attempts++;
            metrics.recordAttempt();
            dumpRequest(httpRequest);

            long attemptStart = System.nanoTime();
            CompletableFuture<ClusterResponse> exchange;
            try {
                exchange = transport.send(httpRequest);
            } catch (RuntimeException e) {
                exchange = CompletableFuture.failedFuture(e);
            }
            inFlight = exchange;
            if (result.isDone()) {
                exchange.cancel(true);
                return;
            }
            exchange.whenComplete((response, error) ->
                    onExchangeComplete(connection, httpRequest, attemptStart, response, error));
        }

        /**
         * Exhaustion before the first attempt ends the call. After an attempt,
         * it means this call's own failures killed the last alive node and the
         * pool has just resurrected everyone, so selection is tried once more.
         */
        private Connection selectConnection() {
            try {
                return pool.next();
            } catch (PoolExhaustedException e) {
                if (attempts == 0) {
                    throw e;
                }
                log.debug("Pool exhausted mid-call, selecting from resurrected pool: method={}, path={}, attempts={}",
                        method, pathWithParams, attempts);
                return pool.next();
            }
        }

        private HttpRequest buildRequest(Connection connection) {
            HttpRequest.Builder builder = HttpRequest.newBuilder()
                    .uri(URI.create(connection.getUrl() + pathWithParams));
            if (basicAuth != null) {
                builder.header("Authorization", basicAuth.headerValue());
            }
            if (payload != null) {
                builder.header("Content-Type", "application/json");
                builder.method(method, HttpRequest.BodyPublishers.ofByteArray(payload));
            } else {
                builder.method(method, HttpRequest.BodyPublishers.noBody());
            }
            return builder.build();
        }

        private void onExchangeComplete(
                Connection connection,
                HttpRequest httpRequest,
                long attemptStart,
                ClusterResponse response,
                Throwable error
        ) {
            // Cancelled or timed out by the caller: leave the pool alone
            if (result.isDone()) {
                return;
            }

            if (error != null) {
                onTransportFailure(connection, httpRequest, unwrap(error));
                return;
            }

            double seconds = (System.nanoTime() - attemptStart) / 1_000_000 / 1000.0;
            dumpResponse(httpRequest, response);
            printf(infoLog, "%s %s [status:%d, request:%.3fs]",
                    method, httpRequest.uri(), response.statusCode(), seconds);

            if (!response.isSuccess() && !request.ignoreErrors().contains(response.statusCode())) {
                log.debug("Request answered with error status: method={}, uri={}, status={}",
                        method, httpRequest.uri(), response.statusCode());
                result.completeExceptionally(new ResponseStatusException(response, errorParser.reason(response)));
                return;
            }

            pool.markHealthy(connection);
            result.complete(response);
        }

        private void onTransportFailure(Connection connection, HttpRequest httpRequest, Throwable cause) {
            if (cause instanceof CancellationException) {
                // Exchange aborted outside this call, nothing to retry against
                result.completeExceptionally(cause);
                return;
            }

            pool.markDead(connection);
            printf(errorLog, "%s %s failed: %s", method, httpRequest.uri(), cause.toString());

            if (attempts > maxRetries) {
                log.warn("Request failed, retries exhausted: method={}, uri={}, attempts={}, error={}",
                        method, httpRequest.uri(), attempts, cause.toString());
                result.completeExceptionally(new TransportException(httpRequest.uri().toString(), attempts, cause));
                return;
            }

            Duration delay = backoff.delayFor(attempts);
            metrics.recordRetry();
            log.debug("Retrying request: method={}, path={}, attempt={}, delayMs={}, error={}",
                    method, pathWithParams, attempts + 1, delay.toMillis(), cause.toString());
            // Each retry starts on a fresh stack
            CompletableFuture<Void> next = delay.isZero()
                    ? CompletableFuture.runAsync(this::attempt)
                    : CompletableFuture.runAsync(this::attempt,
                            CompletableFuture.delayedExecutor(delay.toMillis(), TimeUnit.MILLISECONDS));
            next.exceptionally(error -> {
                result.completeExceptionally(error);
                return null;
            });
        }

        void finish(Throwable error) {
            CompletableFuture<ClusterResponse> pending = inFlight;
            if (error != null && pending != null && !pending.isDone()) {
                log.debug("Aborting in-flight attempt: method={}, path={}", method, pathWithParams);
                pending.cancel(true);
            }

            ErrorType errorType = null;
            if (error != null) {
                Throwable cause = unwrap(error);
                errorType = cause instanceof ClusterClientException
                        ? ((ClusterClientException) cause).getErrorType()
                        : null;
                if (errorType == null && !(cause instanceof CancellationException)) {
                    errorType = ErrorType.TRANSPORT_ERROR;
                }
            }
            if (error == null || errorType != null) {
                metrics.recordRequest(method, errorType, Duration.ofNanos(System.nanoTime() - startNanos));
            }
        }

        private void dumpRequest(HttpRequest httpRequest) {
            if (traceLog == null) {
                return;
            }
            StringBuilder sb = new StringBuilder();
            sb.append(httpRequest.method()).append(' ').append(httpRequest.uri()).append('\n');
            httpRequest.headers().map().forEach((name, values) -> {
                String shown = "Authorization".equalsIgnoreCase(name) ? "<redacted>" : String.join(", ", values);
                sb.append(name).append(": ").append(shown).append('\n');
            });
            if (payload != null) {
                sb.append('\n').append(new String(payload, StandardCharsets.UTF_8));
            }
            printf(traceLog, "%s", sb.toString());
        }

        private void dumpResponse(HttpRequest httpRequest, ClusterResponse response) {
            if (traceLog == null) {
                return;
            }
            StringBuilder sb = new StringBuilder();
            sb.append("HTTP ").append(response.statusCode()).append(" (")
                    .append(httpRequest.method()).append(' ').append(httpRequest.uri()).append(")\n");
            response.headers().forEach((name, values) ->
                    sb.append(name).append(": ").append(String.join(", ", values)).append('\n'));
            if (!response.body().isEmpty()) {
                sb.append('\n').append(response.body());
            }
            printf(traceLog, "%s", sb.toString());
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private ConnectionPool pool;
        private HttpTransport transport;
        private MetricsRegistry metrics;
        private BodyEncoder bodyEncoder;
        private RetryBackoff backoff;
        private int maxRetries;
        private BasicAuth basicAuth;
        private String sendGetBodyAs = "GET";
        private RequestLogger infoLog;
        private RequestLogger traceLog;
        private RequestLogger errorLog;

        public Builder pool(ConnectionPool pool) {
            this.pool = pool;
            return this;
        }

        public Builder transport(HttpTransport transport) {
            this.transport = transport;
            return this;
        }

        public Builder metrics(MetricsRegistry metrics) {
            this.metrics = metrics;
            return this;
        }

        public Builder bodyEncoder(BodyEncoder bodyEncoder) {
            this.bodyEncoder = bodyEncoder;
            return this;
        }

        public Builder backoff(RetryBackoff backoff) {
            this.backoff = backoff;
            return this;
        }

        public Builder maxRetries(int maxRetries) {
            if (maxRetries < 0) {
                throw new IllegalArgumentException("Max retries must not be negative: " + maxRetries);
            }
            this.maxRetries = maxRetries;
            return this;
        }

        public Builder basicAuth(BasicAuth basicAuth) {
            this.basicAuth = basicAuth;
            return this;
        }

        public Builder sendGetBodyAs(String method) {
            this.sendGetBodyAs = method;
            return this;
        }

        public Builder infoLog(RequestLogger infoLog) {
            this.infoLog = infoLog;
            return this;
        }

        public Builder traceLog(RequestLogger traceLog) {
            this.traceLog = traceLog;
            return this;
        }

        public Builder errorLog(RequestLogger errorLog) {
            this.errorLog = errorLog;
            return this;
        }

        public RequestExecutor build() {
            return new RequestExecutor(this);
        }
    }
}
