package io.feedhive.feed.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FeedSpecParserTest {

    private final FeedSpecParser parser = new FeedSpecParser();

    @Test
    void appliesDefaultsForOmittedFields() {
        FeedSpec spec = parser.parse("feedA.yaml", """
            url: https://example.org/ldes
            sparql_endpoint: http://graphdb:7200/repositories/kgap/statements
            """);

        assertThat(spec.name()).isEqualTo("feeda");
        assertThat(spec.sourceUrl()).isEqualTo("https://example.org/ldes");
        assertThat(spec.targetEndpoint()).isEqualTo("http://graphdb:7200/repositories/kgap/statements");
        assertThat(spec.pollingInterval()).isEqualTo(FeedDefaults.POLLING_INTERVAL);
        assertThat(spec.follow()).isTrue();
        assertThat(spec.materialize()).isFalse();
        assertThat(spec.order()).isEqualTo(OrderMode.NONE);
        assertThat(spec.concurrentFetches()).isEqualTo(10);
        assertThat(spec.queryTimeout()).isEqualTo(Duration.ofSeconds(1800));
        assertThat(spec.targetGraph()).isEmpty();
        assertThat(spec.environment()).isEmpty();
        assertThat(spec.sourceFile()).isEqualTo("feedA.yaml");
    }

    @Test
    void readsEveryOptionalField() {
        FeedSpec spec = parser.parse("ignored.yml", """
            name: Marine_Regions
            source: https://example.org/ldes
            target: http://graphdb:7200/repositories/kgap/statements
            target_graph: urn:kgap:marine
            shape: https://example.org/shape.ttl
            polling_interval: 120
            follow: false
            materialize: true
            order: DESC
            last_version_only: true
            failure_is_fatal: true
            concurrent_fetches: 4
            query_timeout: 90
            for_virtuoso: true
            before: 2024-06-01T00:00:00Z
            after: 2024-01-01
            access_token: s3cret
            perf_name: bench
            environment:
              OPERATION_MODE: Replication
              MEMBER_BATCH_SIZE: 250
            """);

        assertThat(spec.name()).isEqualTo("marine-regions");
        assertThat(spec.pollingInterval()).isEqualTo(Duration.ofSeconds(120));
        assertThat(spec.follow()).isFalse();
        assertThat(spec.materialize()).isTrue();
        assertThat(spec.order()).isEqualTo(OrderMode.DESC);
        assertThat(spec.lastVersionOnly()).isTrue();
        assertThat(spec.failureIsFatal()).isTrue();
        assertThat(spec.concurrentFetches()).isEqualTo(4);
        assertThat(spec.queryTimeout()).isEqualTo(Duration.ofSeconds(90));
        assertThat(spec.forVirtuoso()).isTrue();
        assertThat(spec.before()).isEqualTo("2024-06-01T00:00:00Z");
        assertThat(spec.after()).isEqualTo("2024-01-01");
        assertThat(spec.accessToken()).isEqualTo("s3cret");
        assertThat(spec.perfName()).isEqualTo("bench");
        assertThat(spec.environment())
            .containsEntry("OPERATION_MODE", "Replication")
            .containsEntry("MEMBER_BATCH_SIZE", "250");
    }

    @Test
    void rejectsEntryWithoutTargetEndpoint() {
        assertThatThrownBy(() -> parser.parse("feedB.yaml", "url: https://example.org/ldes\n"))
            .isInstanceOf(FeedConfigException.class)
            .hasMessageContaining("feedB.yaml")
            .hasMessageContaining("sparql_endpoint");
    }

    @Test
    void rejectsEmptyFile() {
        assertThatThrownBy(() -> parser.parse("empty.yaml", "  \n"))
            .isInstanceOf(FeedConfigException.class)
            .hasMessageContaining("empty");
    }

    @Test
    void rejectsUnknownOrderMode() {
        assertThatThrownBy(() -> parser.parse("feed.yaml", """
            url: https://example.org/ldes
            sparql_endpoint: http://graphdb:7200/statements
            order: sideways
            """))
            .isInstanceOf(FeedConfigException.class)
            .hasMessageContaining("order");
    }

    @Test
    void rejectsNonNumericPollingInterval() {
        assertThatThrownBy(() -> parser.parse("feed.yaml", """
            url: https://example.org/ldes
            sparql_endpoint: http://graphdb:7200/statements
            polling_interval: often
            """))
            .isInstanceOf(FeedConfigException.class);
    }

    @Test
    void rejectsMalformedTimestamp() {
        assertThatThrownBy(() -> parser.parse("feed.yaml", """
            url: https://example.org/ldes
            sparql_endpoint: http://graphdb:7200/statements
            before: last tuesday
            """))
            .isInstanceOf(FeedConfigException.class)
            .hasMessageContaining("before");
    }

    @Test
    void rejectsRelativeSourceUrl() {
        assertThatThrownBy(() -> parser.parse("feed.yaml", """
            url: /relative/ldes
            sparql_endpoint: http://graphdb:7200/statements
            """))
            .isInstanceOf(FeedConfigException.class)
            .hasMessageContaining("absolute");
    }

    @Test
    void skipsEnvironmentEntriesWithoutValue() {
        FeedSpec spec = parser.parse("feed.yaml", """
            url: https://example.org/ldes
            sparql_endpoint: http://graphdb:7200/statements
            environment:
              EMPTY:
              KEPT: yes-please
            """);

        assertThat(spec.environment()).containsOnlyKeys("KEPT");
    }

    @Test
    void ignoresUnrecognisedKeys() {
        FeedSpec spec = parser.parse("feed.yaml", """
            url: https://example.org/ldes
            sparql_endpoint: http://graphdb:7200/statements
            colour: blue
            """);

        assertThat(spec.name()).isEqualTo("feed");
    }

    @Test
    void parsesFilesFromDisk(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("Feed_One.yaml");
        Files.writeString(file, """
            url: https://example.org/ldes
            sparql_endpoint: http://graphdb:7200/statements
            polling_interval: 2.5
            """);

        FeedSpec spec = parser.parse(file);

        assertThat(spec.name()).isEqualTo("feed-one");
        assertThat(spec.pollingInterval()).isEqualTo(Duration.ofMillis(2500));
    }
}
