package io.estatekeeper.backend.security;

import static org.assertj.core.api.Assertions.assertThat;

import jakarta.servlet.ServletRequest;
import jakarta.servlet.ServletResponse;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.security.oauth2.server.resource.authentication.JwtAuthenticationToken;

class RequestLoggingFilterTest {

  private final RequestLoggingFilter filter = new RequestLoggingFilter();
  private final Map<String, String> mdcSeenByChain = new HashMap<>();

  private final MockFilterChain chain =
      new MockFilterChain() {
        @Override
        public void doFilter(ServletRequest request, ServletResponse response) {
          mdcSeenByChain.put("requestId", MDC.get("requestId"));
          mdcSeenByChain.put("userId", MDC.get("userId"));
        }
      };

  @AfterEach
  void clearContext() {
    SecurityContextHolder.clearContext();
  }

  @Test
  void putsUserAndRequestIdInMdcAndClearsThemAfterwards() throws Exception {
    var jwt =
        Jwt.withTokenValue("token")
            .header("alg", "none")
            .subject("user_mdc")
            .issuedAt(Instant.now())
            .build();
    SecurityContextHolder.getContext().setAuthentication(new JwtAuthenticationToken(jwt));
    var response = new MockHttpServletResponse();

    filter.doFilter(new MockHttpServletRequest("GET", "/api/activity"), response, chain);

    assertThat(mdcSeenByChain.get("userId")).isEqualTo("user_mdc");
    assertThat(mdcSeenByChain.get("requestId")).isNotBlank();
    assertThat(response.getHeader("X-Request-Id")).isEqualTo(mdcSeenByChain.get("requestId"));
    assertThat(MDC.get("userId")).isNull();
    assertThat(MDC.get("requestId")).isNull();
  }

  @Test
  void reusesWellFormedIncomingRequestId() throws Exception {
    var request = new MockHttpServletRequest("GET", "/api/activity");
    request.addHeader("X-Request-Id", "req-123.abc");
    var response = new MockHttpServletResponse();

    filter.doFilter(request, response, chain);

    assertThat(mdcSeenByChain.get("requestId")).isEqualTo("req-123.abc");
    assertThat(mdcSeenByChain.get("userId")).isNull();
    assertThat(response.getHeader("X-Request-Id")).isEqualTo("req-123.abc");
  }

  @Test
  void replacesIncomingRequestIdThatCouldForgeLogLines() throws Exception {
    var request = new MockHttpServletRequest("GET", "/api/activity");
    request.addHeader("X-Request-Id", "abc\nFAKE LOG LINE");

    filter.doFilter(request, new MockHttpServletResponse(), chain);

    assertThat(mdcSeenByChain.get("requestId")).doesNotContain("\n").hasSize(36);
  }
}
