package io.estatekeeper.backend.security;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.UUID;
import java.util.regex.Pattern;
import org.slf4j.MDC;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.oauth2.server.resource.authentication.JwtAuthenticationToken;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Puts a request id and the authenticated user id into the MDC for the duration of a request. An
 * incoming {@code X-Request-Id} is reused when it looks sane, otherwise a new id is generated; the
 * id is echoed on the response either way.
 */
@Component
public class RequestLoggingFilter extends OncePerRequestFilter {

  private static final String MDC_USER_ID = "userId";
  private static final String MDC_REQUEST_ID = "requestId";
  static final String REQUEST_ID_HEADER = "X-Request-Id";
  private static final Pattern SAFE_REQUEST_ID = Pattern.compile("^[A-Za-z0-9._-]{1,64}$");

  @Override
  protected void doFilterInternal(
      HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
      throws ServletException, IOException {
    try {
      String requestId = requestId(request);
      MDC.put(MDC_REQUEST_ID, requestId);
      response.setHeader(REQUEST_ID_HEADER, requestId);

      Authentication auth = SecurityContextHolder.getContext().getAuthentication();
      if (auth instanceof JwtAuthenticationToken jwtAuth) {
        MDC.put(MDC_USER_ID, jwtAuth.getToken().getSubject());
      }

      filterChain.doFilter(request, response);
    } finally {
      MDC.remove(MDC_USER_ID);
      MDC.remove(MDC_REQUEST_ID);
    }
  }

  private static String requestId(HttpServletRequest request) {
    String incoming = request.getHeader(REQUEST_ID_HEADER);
    if (incoming != null && SAFE_REQUEST_ID.matcher(incoming).matches()) {
      return incoming;
    }
    return UUID.randomUUID().toString();
  }
}
