package uk.gegc.unfurl.features.urlsafety.application;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.mockito.Mock;
import uk.gegc.unfurl.BaseUnitTest;
import uk.gegc.unfurl.features.urlsafety.config.UrlSafetyProperties;
import uk.gegc.unfurl.features.urlsafety.domain.SsrfProtectionException;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@DisplayName("UrlSafetyValidator Tests")
class UrlSafetyValidatorTest extends BaseUnitTest {

    @Mock
    private HostResolver hostResolver;

    private UrlSafetyValidator validator;

    @BeforeEach
    void setUp() {
        UrlSafetyProperties properties = new UrlSafetyProperties();
        properties.setMaxUrlLength(2000);
        validator = new UrlSafetyValidator(properties, hostResolver, new IpRangeGuard());
    }

    private static InetAddress address(String host, int a, int b, int c, int d) throws UnknownHostException {
        return InetAddress.getByAddress(host, new byte[]{(byte) a, (byte) b, (byte) c, (byte) d});
    }

    @Nested
    @DisplayName("Format checks")
    class FormatChecks {

        @ParameterizedTest
        @ValueSource(strings = {"", "   ", "\t"})
        @DisplayName("validate: blank URL is rejected")
        void validate_blank_throws(String url) {
            assertThatThrownBy(() -> validator.validate(url))
                    .isInstanceOf(SsrfProtectionException.class)
                    .hasMessageContaining("URL is empty");
        }

        @Test
        @DisplayName("validate: null URL is rejected")
        void validate_null_throws() {
            assertThatThrownBy(() -> validator.validate(null))
                    .isInstanceOf(SsrfProtectionException.class)
                    .hasMessageContaining("URL is empty");
        }

        @Test
        @DisplayName("validate: URL over the length limit is rejected before any lookup")
        void validate_tooLong_throws() throws Exception {
            // Given
            String url = "https://example.com/" + "a".repeat(2000);

            // When / Then
            assertThatThrownBy(() -> validator.validate(url))
                    .isInstanceOf(SsrfProtectionException.class)
                    .hasMessageContaining("URL too long (max 2000 characters)");
            verify(hostResolver, never()).resolve(anyString());
        }

        @ParameterizedTest
        @ValueSource(strings = {
                "file:///etc/passwd",
                "ftp://example.com/file",
                "javascript:alert(1)",
                "gopher://example.com:70/",
                "data:text/html,hello"
        })
        @DisplayName("validate: non-HTTP schemes are rejected")
        void validate_disallowedScheme_throws(String url) {
            assertThatThrownBy(() -> validator.validate(url))
                    .isInstanceOf(SsrfProtectionException.class)
                    .hasMessageContaining("Invalid URL scheme");
        }

        @Test
        @DisplayName("validate: text without a scheme is an invalid format")
        void validate_notAUrl_throws() {
            assertThatThrownBy(() -> validator.validate("not a url at all"))
                    .isInstanceOf(SsrfProtectionException.class)
                    .hasMessageContaining("Invalid URL format");
        }

        @Test
        @DisplayName("validate: URL without host is rejected")
        void validate_missingHost_throws() {
            assertThatThrownBy(() -> validator.validate("http:///path-only"))
                    .isInstanceOf(SsrfProtectionException.class)
                    .hasMessageContaining("Invalid URL format");
        }

        @Test
        @DisplayName("validate: IPv4 literal with an octet over 255 is rejected without DNS")
        void validate_invalidIpv4Literal_throws() throws Exception {
            assertThatThrownBy(() -> validator.validate("http://999.1.1.1/"))
                    .isInstanceOf(SsrfProtectionException.class)
                    .hasMessageContaining("Invalid IP address");
            verify(hostResolver, never()).resolve(anyString());
        }
    }

    @Nested
    @DisplayName("Address checks")
    class AddressChecks {

        @ParameterizedTest
        @ValueSource(strings = {
                "http://10.0.0.5/",
                "http://127.0.0.1:8080/admin",
                "http://169.254.169.254/latest/meta-data/",
                "http://192.168.0.10/",
                "http://172.20.1.1/",
                "http://0.0.0.0/",
                "http://[::1]/",
                "http://[fc00::1]/",
                "http://[fe80::1]/"
        })
        @DisplayName("validate: IP literals in blocked ranges are rejected")
        void validate_blockedLiteral_throws(String url) {
            assertThatThrownBy(() -> validator.validate(url))
                    .isInstanceOf(SsrfProtectionException.class)
                    .hasMessageContaining("SSRF protection: private IP address blocked");
        }

        @Test
        @DisplayName("validate: hostname resolving to a public address passes")
        void validate_publicHostname_passes() throws Exception {
            // Given
            when(hostResolver.resolve("example.com"))
                    .thenReturn(List.of(address("example.com", 93, 184, 216, 34)));

            // When / Then
            assertThatCode(() -> validator.validate("https://example.com/a"))
                    .doesNotThrowAnyException();
        }

        @Test
        @DisplayName("validate: hostname with any private address is rejected")
        void validate_hostnameWithOnePrivateAddress_throws() throws Exception {
            // Given
            when(hostResolver.resolve("rebind.example"))
                    .thenReturn(List.of(
                            address("rebind.example", 93, 184, 216, 34),
                            address("rebind.example", 10, 1, 2, 3)));

            // When / Then
            assertThatThrownBy(() -> validator.validate("https://rebind.example/"))
                    .isInstanceOf(SsrfProtectionException.class)
                    .hasMessage("SSRF protection: private IP address blocked: 10.1.2.3");
        }

        @Test
        @DisplayName("validate: unresolvable hostname is rejected")
        void validate_unresolvableHost_throws() throws Exception {
            // Given
            when(hostResolver.resolve("nowhere.invalid"))
                    .thenThrow(new UnknownHostException("nowhere.invalid"));

            // When / Then
            assertThatThrownBy(() -> validator.validate("https://nowhere.invalid/"))
                    .isInstanceOf(SsrfProtectionException.class)
                    .hasMessage("Could not resolve hostname: nowhere.invalid");
        }

        @Test
        @DisplayName("validate: resolver returning no addresses is treated as unresolvable")
        void validate_emptyResolution_throws() throws Exception {
            when(hostResolver.resolve("empty.example")).thenReturn(List.of());

            assertThatThrownBy(() -> validator.validate("http://empty.example/"))
                    .isInstanceOf(SsrfProtectionException.class)
                    .hasMessageContaining("Could not resolve hostname");
        }

        @Test
        @DisplayName("validate: DNS is queried on every call")
        void validate_resolvesEveryTime() throws Exception {
            // Given
            when(hostResolver.resolve("example.com"))
                    .thenReturn(List.of(address("example.com", 93, 184, 216, 34)))
                    .thenReturn(List.of(address("example.com", 127, 0, 0, 1)));

            // When
            validator.validate("https://example.com/");

            // Then
            assertThatThrownBy(() -> validator.validate("https://example.com/"))
                    .isInstanceOf(SsrfProtectionException.class)
                    .hasMessageContaining("127.0.0.1");
        }
    }

    @Test
    @DisplayName("isSafe: reports the validation result as a boolean")
    void isSafe_reportsResult() throws Exception {
        when(hostResolver.resolve("example.com"))
                .thenReturn(List.of(address("example.com", 93, 184, 216, 34)));

        assertThat(validator.isSafe("https://example.com/")).isTrue();
        assertThat(validator.isSafe("http://169.254.169.254/")).isFalse();
        assertThat(validator.isSafe("file:///etc/passwd")).isFalse();
    }
}
