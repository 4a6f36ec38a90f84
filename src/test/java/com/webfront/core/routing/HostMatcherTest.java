package com.webfront.core.routing;

import java.util.List;

import com.webfront.core.handler.StaticFileHandler;
import com.webfront.entity.Rule;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;

class HostMatcherTest {

    @ParameterizedTest
    @CsvSource({
            "example.com, example.com",
            "example.com:8080, example.com",
            "localhost:80, localhost",
            "'[::1]:8080', '[::1]'",
            "'[::1]', '[::1]'",
            "'', ''"
    })
    void normalize_stripsPort(String input, String expected) {
        assertThat(HostMatcher.normalize(input)).isEqualTo(expected);
    }

    @Test
    void normalize_null_isEmpty() {
        assertThat(HostMatcher.normalize(null)).isEmpty();
    }

    @ParameterizedTest
    @CsvSource({
            "example.com, example.com, true",
            "www.example.com, example.com, true",
            "a.b.example.com, example.com, true",
            "evilexample.com, example.com, false",
            "example.com, www.example.com, false",
            "example.org, example.com, false",
            ".example.com, example.com, false",
            "Example.com, example.com, false"
    })
    void matches_exactOrDotBoundarySuffix(String host, String ruleHost, boolean expected) {
        assertThat(HostMatcher.matches(host, ruleHost)).isEqualTo(expected);
    }

    @Test
    void emptyRuleHost_neverMatches() {
        assertThat(HostMatcher.matches("", "")).isFalse();
        assertThat(HostMatcher.matches("example.com", "")).isFalse();
    }

    @Test
    void firstMatch_returnsEarliestRuleInOrder() {
        ResolvedRule broad = new ResolvedRule(Rule.serve("example.com", "/a"), new StaticFileHandler("/a"));
        ResolvedRule narrow = new ResolvedRule(Rule.serve("www.example.com", "/b"), new StaticFileHandler("/b"));

        assertThat(HostMatcher.firstMatch(List.of(broad, narrow), "www.example.com")).containsSame(broad);
        assertThat(HostMatcher.firstMatch(List.of(narrow, broad), "www.example.com")).containsSame(narrow);
        assertThat(HostMatcher.firstMatch(List.of(narrow, broad), "other.com")).isEmpty();
    }
}
