package com.webfront.core.server;

import java.time.Instant;
import java.util.List;
import javax.net.ssl.SNIHostName;
import javax.net.ssl.SNIServerName;
import javax.net.ssl.StandardConstants;

import com.webfront.core.routing.HostAuthorizer;
import com.webfront.core.routing.ResolvedRule;
import com.webfront.core.routing.RuleTable;
import com.webfront.entity.Rule;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class AuthorizedHostSniMatcherTest {

    private final RuleTable table = new RuleTable(
            List.of(new ResolvedRule(Rule.of("example.com", "", ""), null)), Instant.EPOCH);
    private final AuthorizedHostSniMatcher matcher = new AuthorizedHostSniMatcher(new HostAuthorizer(() -> table));

    @Test
    void matchesHostNameType() {
        assertThat(matcher.getType()).isEqualTo(StandardConstants.SNI_HOST_NAME);
    }

    @Test
    void authorizedNames_match() {
        assertThat(matcher.matches(new SNIHostName("example.com"))).isTrue();
        assertThat(matcher.matches(new SNIHostName("www.example.com"))).isTrue();
    }

    @Test
    void unknownNames_doNotMatch() {
        assertThat(matcher.matches(new SNIHostName("api.example.com"))).isFalse();
        assertThat(matcher.matches(new SNIHostName("example.org"))).isFalse();
    }

    @Test
    void otherNameTypes_doNotMatch() {
        SNIServerName custom = new SNIServerName(42, new byte[] { 1, 2, 3 }) {
        };

        assertThat(matcher.matches(custom)).isFalse();
    }
}
