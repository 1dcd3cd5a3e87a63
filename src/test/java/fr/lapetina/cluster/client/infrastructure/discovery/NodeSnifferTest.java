package fr.lapetina.cluster.client.infrastructure.discovery;

import fr.lapetina.cluster.client.domain.pool.Connection;
import fr.lapetina.cluster.client.domain.pool.ConnectionPool;
import fr.lapetina.cluster.client.exception.NoNodeAvailableException;
import fr.lapetina.cluster.client.infrastructure.http.BasicAuth;
import fr.lapetina.cluster.client.infrastructure.http.JdkHttpTransport;
import fr.lapetina.cluster.client.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.cluster.client.support.FakeNode;
import fr.lapetina.cluster.client.support.SilentNode;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

class NodeSnifferTest {

    private FakeNode first;
    private FakeNode second;
    private JdkHttpTransport transport;
    private SimpleMeterRegistry meterRegistry;
    private MetricsRegistry metrics;

    @BeforeEach
    void setUp() {
        first = FakeNode.start();
        second = FakeNode.start();
        transport = new JdkHttpTransport(Duration.ofSeconds(1));
        meterRegistry = new SimpleMeterRegistry();
        metrics = new MetricsRegistry(meterRegistry, "test");
    }

    @AfterEach
    void tearDown() {
        first.close();
        second.close();
    }

    private NodeSniffer sniffer(ConnectionPool pool, List<String> seeds, Duration interval) {
        return new NodeSniffer(pool, transport, new NodesInfoParser("http"), seeds, null, metrics,
                Duration.ofSeconds(1), interval);
    }

    private NodeSniffer sniffer(ConnectionPool pool, List<String> seeds) {
        return sniffer(pool, seeds, Duration.ofMinutes(15));
    }

    private static ConnectionPool poolOf(String... urls) {
        return new ConnectionPool(Arrays.stream(urls).map(Connection::of).toList());
    }

    private void clusterOfTwo(FakeNode answering) {
        Map<String, String> nodes = new LinkedHashMap<>();
        nodes.put("n1", "127.0.0.1:" + first.port());
        nodes.put("n2", "127.0.0.1:" + second.port());
        answering.nodesInfo(nodes);
    }

    @Nested
    @DisplayName("sniffNode")
    class SniffNodeTests {

        @Test
        @DisplayName("should return the members reported by a node")
        void shouldReturnMembers() throws Exception {
            clusterOfTwo(first);
            NodeSniffer sniffer = sniffer(poolOf(first.url()), List.of(first.url()));

            List<Connection> connections = sniffer.sniffNode(first.url(), Duration.ofSeconds(1)).get();

            assertThat(connections).extracting(Connection::getUrl).containsExactly(first.url(), second.url());
            assertThat(connections).extracting(Connection::getNodeId).containsExactly("n1", "n2");
            assertThat(first.requests().get(0).method()).isEqualTo("GET");
            assertThat(first.requests().get(0).path()).isEqualTo("/_nodes/http");
        }

        @Test
        @DisplayName("should return an empty list on error status or malformed document")
        void shouldReturnEmptyOnErrors() throws Exception {
            first.reply("/_nodes/http", 500, "{\"error\":\"boom\"}");
            second.reply("/_nodes/http", 200, "not json");
            NodeSniffer sniffer = sniffer(poolOf(first.url()), List.of(first.url()));

            assertThat(sniffer.sniffNode(first.url(), Duration.ofSeconds(1)).get()).isEmpty();
            assertThat(sniffer.sniffNode(second.url(), Duration.ofSeconds(1)).get()).isEmpty();
        }

        @Test
        @DisplayName("should return an empty list when the node is unreachable")
        void shouldReturnEmptyWhenUnreachable() throws Exception {
            String closed = second.url();
            second.close();
            NodeSniffer sniffer = sniffer(poolOf(first.url()), List.of(first.url()));

            assertThat(sniffer.sniffNode(closed, Duration.ofSeconds(1)).get()).isEmpty();
        }

        @Test
        @DisplayName("should release the exchange when the node does not answer in time")
        void shouldReleaseExchangeOnTimeout() throws Exception {
            first.delay(Duration.ofSeconds(10));
            NodeSniffer sniffer = sniffer(poolOf(first.url()), List.of(first.url()));

            assertThat(sniffer.sniffNode(first.url(), Duration.ofMillis(200)).get()).isEmpty();

            await().atMost(Duration.ofSeconds(2)).until(() -> transport.getInFlightExchanges() == 0);
        }

        @Test
        @DisplayName("should close the connection when the node does not answer in time")
        void shouldCloseConnectionOnTimeout() throws Exception {
            try (SilentNode silent = SilentNode.start()) {
                NodeSniffer sniffer = sniffer(poolOf(first.url()), List.of(first.url()));

                assertThat(sniffer.sniffNode(silent.url(), Duration.ofMillis(200)).get()).isEmpty();

                await().atMost(Duration.ofSeconds(2)).untilAsserted(() ->
                        assertThat(silent.closedConnections()).isEqualTo(silent.acceptedConnections()).isEqualTo(1));
            }
        }

        @Test
        @DisplayName("should send basic auth credentials")
        void shouldSendBasicAuth() throws Exception {
            first.nodesInfoSelf();
            NodeSniffer sniffer = new NodeSniffer(poolOf(first.url()), transport, new NodesInfoParser("http"),
                    List.of(first.url()), new BasicAuth("user", "secret"), metrics,
                    Duration.ofSeconds(1), Duration.ofMinutes(15));

            sniffer.sniffNode(first.url(), Duration.ofSeconds(1)).get();

            assertThat(first.requests().get(0).authorization()).isEqualTo("Basic dXNlcjpzZWNyZXQ=");
        }
    }

    @Nested
    @DisplayName("sniff")
    class SniffTests {

        @Test
        @DisplayName("should replace the pool with the discovered members")
        void shouldReplacePool() {
            clusterOfTwo(first);
            ConnectionPool pool = poolOf(first.url());
            NodeSniffer sniffer = sniffer(pool, List.of(first.url()));

            sniffer.sniff(Duration.ofSeconds(2));

            assertThat(pool.snapshot()).extracting(Connection::getUrl).containsExactly(first.url(), second.url());
            assertThat(meterRegistry.get("test_sniff_total").tag("outcome", "success").counter().count())
                    .isEqualTo(1.0);
        }

        @Test
        @DisplayName("should fail after the timeout and keep the pool when no node answers")
        void shouldFailWhenNoNodeAnswers() {
            first.reply("/_nodes/http", 500, "{}");
            ConnectionPool pool = poolOf(first.url());
            NodeSniffer sniffer = sniffer(pool, List.of(first.url()));

            long start = System.nanoTime();
            assertThatThrownBy(() -> sniffer.sniff(Duration.ofMillis(300)))
                    .isInstanceOf(NoNodeAvailableException.class);

            assertThat(Duration.ofNanos(System.nanoTime() - start)).isGreaterThanOrEqualTo(Duration.ofMillis(300));
            assertThat(pool.snapshot()).extracting(Connection::getUrl).containsExactly(first.url());
            assertThat(meterRegistry.get("test_sniff_total").tag("outcome", "failure").counter().count())
                    .isEqualTo(1.0);
        }

        @Test
        @DisplayName("should ignore empty member lists")
        void shouldIgnoreEmptyMemberLists() {
            first.reply("/_nodes/http", 200, "{\"nodes\":{}}");
            ConnectionPool pool = poolOf(first.url());
            NodeSniffer sniffer = sniffer(pool, List.of(first.url()));

            assertThatThrownBy(() -> sniffer.sniff(Duration.ofMillis(300)))
                    .isInstanceOf(NoNodeAvailableException.class);
        }

        @Test
        @DisplayName("should also ask alive pool members")
        void shouldAskAlivePoolMembers() {
            first.reply("/_nodes/http", 500, "{}");
            second.nodesInfoSelf();
            ConnectionPool pool = poolOf(second.url());
            NodeSniffer sniffer = sniffer(pool, List.of(first.url()));

            sniffer.sniff(Duration.ofSeconds(2));

            assertThat(pool.snapshot()).extracting(Connection::getUrl).containsExactly(second.url());
            assertThat(first.requestCount("/_nodes/http")).isEqualTo(1);
        }

        @Test
        @DisplayName("should not ask dead pool members")
        void shouldSkipDeadPoolMembers() {
            first.reply("/_nodes/http", 500, "{}");
            second.nodesInfoSelf();
            ConnectionPool pool = poolOf(second.url());
            pool.markDead(pool.snapshot().get(0));
            NodeSniffer sniffer = sniffer(pool, List.of(first.url()));

            assertThatThrownBy(() -> sniffer.sniff(Duration.ofMillis(300)))
                    .isInstanceOf(NoNodeAvailableException.class);
            assertThat(second.requestCount("/_nodes/http")).isZero();
        }

        @Test
        @DisplayName("should release every exchange after a timeout")
        void shouldReleaseExchangesAfterTimeout() {
            first.delay(Duration.ofSeconds(10)).nodesInfoSelf();
            second.delay(Duration.ofSeconds(10)).nodesInfoSelf();
            ConnectionPool pool = poolOf(second.url());
            NodeSniffer sniffer = sniffer(pool, List.of(first.url()));

            assertThatThrownBy(() -> sniffer.sniff(Duration.ofMillis(300)))
                    .isInstanceOf(NoNodeAvailableException.class);

            await().atMost(Duration.ofSeconds(2)).until(() -> transport.getInFlightExchanges() == 0);
        }

        @Test
        @DisplayName("should close every connection after a timeout")
        void shouldCloseConnectionsAfterTimeout() {
            try (SilentNode seed = SilentNode.start(); SilentNode member = SilentNode.start()) {
                NodeSniffer sniffer = sniffer(poolOf(member.url()), List.of(seed.url()));

                assertThatThrownBy(() -> sniffer.sniff(Duration.ofMillis(300)))
                        .isInstanceOf(NoNodeAvailableException.class);

                await().atMost(Duration.ofSeconds(2)).untilAsserted(() -> {
                    assertThat(seed.closedConnections()).isEqualTo(seed.acceptedConnections()).isEqualTo(1);
                    assertThat(member.closedConnections()).isEqualTo(member.acceptedConnections()).isEqualTo(1);
                });
            }
        }
    }

    @Nested
    @DisplayName("periodic sniffing")
    class PeriodicTests {

        @Test
        @DisplayName("should sniff periodically until stopped")
        void shouldSniffPeriodically() {
            first.nodesInfoSelf();
            NodeSniffer sniffer = sniffer(poolOf(first.url()), List.of(first.url()), Duration.ofMillis(100));

            sniffer.start();
            await().atMost(Duration.ofSeconds(5)).until(() -> first.requestCount("/_nodes/http") >= 2);
            sniffer.stop();

            assertThat(sniffer.isRunning()).isFalse();
            long afterStop = first.requestCount("/_nodes/http");
            await().pollDelay(Duration.ofMillis(300)).atMost(Duration.ofSeconds(1))
                    .until(() -> first.requestCount("/_nodes/http") == afterStop);
        }

        @Test
        @DisplayName("should treat start and stop as idempotent and restartable")
        void shouldBeRestartable() {
            first.nodesInfoSelf();
            NodeSniffer sniffer = sniffer(poolOf(first.url()), List.of(first.url()), Duration.ofMillis(100));

            sniffer.start();
            sniffer.start();
            sniffer.stop();
            sniffer.stop();
            assertThat(sniffer.isRunning()).isFalse();

            sniffer.start();
            assertThat(sniffer.isRunning()).isTrue();
            await().atMost(Duration.ofSeconds(5)).until(() -> first.requestCount("/_nodes/http") >= 1);
            sniffer.close();
            assertThat(sniffer.isRunning()).isFalse();
        }
    }
}
