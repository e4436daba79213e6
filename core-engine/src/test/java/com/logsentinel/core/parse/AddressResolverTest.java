package com.logsentinel.core.parse;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link AddressResolver}.
 */
class AddressResolverTest {

    private AddressResolver resolver;

    @BeforeEach
    void setUp() {
        resolver = new AddressResolver();
    }

    @Test
    @DisplayName("Should return the first IPv4 literal verbatim")
    void shouldReturnFirstIpv4Literal() {
        assertThat(resolver.resolve("connection from 10.1.2.3 to 10.4.5.6 refused", "combo"))
                .isEqualTo("10.1.2.3");
    }

    @Test
    @DisplayName("Should ignore dotted groups with octets above 255")
    void shouldIgnoreOutOfRangeOctets() {
        assertThat(resolver.resolve("version 999.1.1.1 installed", null))
                .isEqualTo(AddressResolver.DEFAULT_ADDRESS);
    }

    @Test
    @DisplayName("Should derive the address from the MD5 digest of the hostname")
    void shouldDeriveFromHostname() {
        assertThat(resolver.resolve("syslogd 1.4.1: restart.", "combo")).isEqualTo("192.168.198.156");
        assertThat(resolver.resolve("anything", "web01")).isEqualTo("192.168.47.82");
    }

    @Test
    @DisplayName("Should return the identical address for repeated hostnames")
    void shouldBeIdempotentPerHostname() {
        String first = resolver.resolve("first line", "combo");
        String second = resolver.resolve("a different line", "combo");

        assertThat(second).isEqualTo(first);
        assertThat(new AddressResolver().fromHostname("combo")).isEqualTo(first);
        assertThat(resolver.cachedHostnames()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should map security wording into 10.0.100.0/24")
    void shouldMapSecurityKeywords() {
        assertThat(resolver.resolve("authentication failure for user root", null)).startsWith("10.0.100.");
    }

    @Test
    @DisplayName("Should map network wording into 172.16.0.0/24")
    void shouldMapNetworkKeywords() {
        assertThat(resolver.resolve("network unreachable", null)).startsWith("172.16.0.");
    }

    @Test
    @DisplayName("Should fall back to the default address")
    void shouldFallBackToDefault() {
        assertThat(resolver.resolve("disk usage at 91%", null)).isEqualTo(AddressResolver.DEFAULT_ADDRESS);
        assertThat(resolver.resolve(null, "  ")).isEqualTo(AddressResolver.DEFAULT_ADDRESS);
    }
}
