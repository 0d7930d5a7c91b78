package tether.core.service.session;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.time.Duration;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import tether.core.model.session.AuthProvider;
import tether.testing.TestSessionStoreConfig;

@DisplayName("ProviderTtlPolicy")
class ProviderTtlPolicyTest {

    private final ProviderTtlPolicy policy = new ProviderTtlPolicy(new TestSessionStoreConfig());

    @ParameterizedTest(name = "{0} -> {1}")
    @CsvSource({"JWT, PT1H", "API_KEY, PT24H", "OAUTH, PT2H", "SOCIAL, PT1H", "SAML, PT8H", "LDAP, PT8H"})
    @DisplayName("each provider should get its configured TTL")
    void providerDefaults(AuthProvider provider, Duration expected) {
        assertEquals(expected, policy.ttlFor(provider));
        assertEquals(expected, policy.resolve(provider, null));
    }

    @Test
    @DisplayName("a positive override should win")
    void override() {
        assertEquals(Duration.ofMinutes(5), policy.resolve(AuthProvider.SAML, Duration.ofMinutes(5)));
    }

    @Test
    @DisplayName("a zero or negative override should fall back to the provider TTL")
    void unusableOverride() {
        assertEquals(Duration.ofHours(8), policy.resolve(AuthProvider.LDAP, Duration.ZERO));
        assertEquals(Duration.ofHours(8), policy.resolve(AuthProvider.LDAP, Duration.ofSeconds(-10)));
    }

    @Test
    @DisplayName("a sub-second override should round up to one second")
    void subSecond() {
        assertEquals(Duration.ofSeconds(1), policy.resolve(AuthProvider.JWT, Duration.ofMillis(300)));
    }
}
