package com.webfront.core.routing;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.webfront.core.exceptions.ConfigException;
import com.webfront.entity.Rule;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class RuleRefresherTest {

    private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");

    @TempDir
    Path tempDir;

    private Path rulesFile;
    private RuleLoader loader;
    private SimpleMeterRegistry registry;
    private RuleRefresher refresher;
    private ListAppender<ILoggingEvent> logEvents;

    @BeforeEach
    void setUp() {
        logEvents = new ListAppender<>();
        logEvents.start();
        ((Logger) LoggerFactory.getLogger(RuleRefresher.class)).addAppender(logEvents);
        rulesFile = tempDir.resolve("rules.json");
        loader = new RuleLoader(rulesFile, new RuleFileParser(),
                HandlerResolver.withDefaultClient(Duration.ofSeconds(5)));
        registry = new SimpleMeterRegistry();
    }

    @AfterEach
    void tearDown() {
        ((Logger) LoggerFactory.getLogger(RuleRefresher.class)).detachAppender(logEvents);
        if (refresher != null) {
            refresher.close();
        }
    }

    private void writeRules(String json, Instant mtime) throws Exception {
        Files.writeString(rulesFile, json);
        Files.setLastModifiedTime(rulesFile, FileTime.from(mtime));
    }

    @Test
    void constructor_performsFirstLoad() throws Exception {
        writeRules("[{\"Host\": \"example.com\", \"Serve\": \"/var/www\"}]", T0);

        refresher = new RuleRefresher(loader, Duration.ofHours(1), registry);

        assertThat(refresher.current().getRules()).extracting(ResolvedRule::getHost).containsExactly("example.com");
        assertThat(registry.get("webfront.rules.size").gauge().value()).isEqualTo(1.0);
    }

    @Test
    void constructor_failsWhenFirstLoadFails() {
        assertThatThrownBy(() -> new RuleRefresher(loader, Duration.ofHours(1), registry))
                .isInstanceOf(ConfigException.class);
    }

    @Test
    void newRule_isInvisibleUntilNextRefresh() throws Exception {
        writeRules("[{\"Host\": \"example.com\", \"Serve\": \"/var/www\"}]", T0);
        refresher = new RuleRefresher(loader, Duration.ofHours(1), registry);
        HostRouter router = new HostRouter(refresher);

        writeRules("""
                [
                  {"Host": "example.com", "Serve": "/var/www"},
                  {"Host": "example.net", "Forward": "localhost:9000"}
                ]
                """, T0.plusSeconds(10));

        assertThat(router.route("example.net")).isEmpty();

        assertThat(refresher.refresh()).isTrue();

        assertThat(router.route("example.net")).isPresent();
        assertThat(registry.get("webfront.rules.reloads").counter().count()).isEqualTo(1.0);
    }

    @Test
    void invalidContent_keepsLastValidTable() throws Exception {
        writeRules("[{\"Host\": \"example.com\", \"Serve\": \"/var/www\"}]", T0);
        refresher = new RuleRefresher(loader, Duration.ofHours(1), registry);
        RuleTable before = refresher.current();

        writeRules("[{\"Host\": \"example.com\", ", T0.plusSeconds(10));

        assertThat(refresher.refresh()).isFalse();
        assertThat(refresher.current()).isSameAs(before);
        assertThat(new HostRouter(refresher).route("example.com")).isPresent();
        assertThat(registry.get("webfront.rules.reload.failures").counter().count()).isEqualTo(1.0);
        assertThat(logEvents.list)
                .filteredOn(event -> event.getLevel() == Level.ERROR)
                .singleElement()
                .satisfies(event -> assertThat(event.getFormattedMessage())
                        .contains("keeping previous table")
                        .contains(rulesFile.toString()));
    }

    @Test
    void deletedFile_keepsLastValidTable() throws Exception {
        writeRules("[{\"Host\": \"example.com\", \"Serve\": \"/var/www\"}]", T0);
        refresher = new RuleRefresher(loader, Duration.ofHours(1), registry);
        RuleTable before = refresher.current();

        Files.delete(rulesFile);

        assertThat(refresher.refresh()).isFalse();
        assertThat(refresher.current()).isSameAs(before);
    }

    @Test
    void unchangedFile_keepsSameTableReference() throws Exception {
        writeRules("[{\"Host\": \"example.com\", \"Serve\": \"/var/www\"}]", T0);
        refresher = new RuleRefresher(loader, Duration.ofHours(1), registry);
        RuleTable before = refresher.current();

        assertThat(refresher.refresh()).isFalse();
        assertThat(refresher.refresh()).isFalse();

        assertThat(refresher.current()).isSameAs(before);
        assertThat(registry.get("webfront.rules.reloads").counter().count()).isZero();
        assertThat(registry.get("webfront.rules.reload.failures").counter().count()).isZero();
    }

    @Test
    void unexpectedLoaderFailure_isContained() {
        RuleTable initial = new RuleTable(
                List.of(new ResolvedRule(Rule.serve("a.com", "/srv"), null)), T0);
        RuleLoader failing = mock(RuleLoader.class);
        when(failing.getRulesFile()).thenReturn(rulesFile);
        when(failing.load(null)).thenReturn(Optional.of(initial));
        when(failing.load(any(RuleTable.class))).thenThrow(new IllegalStateException("boom"));

        refresher = new RuleRefresher(failing, Duration.ofHours(1), registry);

        assertThat(refresher.refresh()).isFalse();
        assertThat(refresher.current()).isSameAs(initial);
        assertThat(registry.get("webfront.rules.reload.failures").counter().count()).isEqualTo(1.0);
    }

    @Test
    void start_pollsFileInBackground() throws Exception {
        writeRules("[{\"Host\": \"example.com\", \"Serve\": \"/var/www\"}]", T0);
        refresher = new RuleRefresher(loader, Duration.ofMillis(50), registry);
        refresher.start();

        writeRules("[{\"Host\": \"example.org\", \"Forward\": \"localhost:9000\"}]", T0.plusSeconds(10));

        await().atMost(Duration.ofSeconds(5)).untilAsserted(() -> assertThat(refresher.current().getRules())
                .extracting(ResolvedRule::getHost).containsExactly("example.org"));
    }

    @Test
    void close_stopsPolling_andKeepsLastTable() throws Exception {
        writeRules("[{\"Host\": \"example.com\", \"Serve\": \"/var/www\"}]", T0);
        refresher = new RuleRefresher(loader, Duration.ofMillis(50), registry);
        refresher.start();
        refresher.close();
        RuleTable last = refresher.current();

        writeRules("[{\"Host\": \"example.org\", \"Serve\": \"/var/www\"}]", T0.plusSeconds(10));
        Thread.sleep(300);

        assertThat(refresher.current()).isSameAs(last);
    }
}
