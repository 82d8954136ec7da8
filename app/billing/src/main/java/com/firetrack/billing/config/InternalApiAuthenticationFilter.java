package com.firetrack.billing.config;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.web.filter.OncePerRequestFilter;

// /v1/billing/** への転送ヘッダを検証し、呼び出しユーザーを SecurityContext へ載せる。
public class InternalApiAuthenticationFilter extends OncePerRequestFilter {

  private static final Logger logger =
      LoggerFactory.getLogger(InternalApiAuthenticationFilter.class);
  private static final String USER_ROLE = "ROLE_USER";
  private static final String PROTECTED_PREFIX = "/v1/billing/";

  private final BillingInternalApiProperties properties;

  public InternalApiAuthenticationFilter(BillingInternalApiProperties properties) {
    this.properties = properties;
  }

  @Override
  protected boolean shouldNotFilter(HttpServletRequest request) {
    final String uri = request.getRequestURI();
    return uri == null || !uri.startsWith(PROTECTED_PREFIX);
  }

  @Override
  protected void doFilterInternal(
      HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
      throws ServletException, IOException {
    final UsernamePasswordAuthenticationToken authentication = resolveAuthentication(request);
    if (authentication != null) {
      logger.debug("internal authentication established for path={}", request.getRequestURI());
      SecurityContextHolder.getContext().setAuthentication(authentication);
    } else {
      logger.debug(
          "internal authentication not established for path={}", request.getRequestURI());
    }
    filterChain.doFilter(request, response);
  }

  private UsernamePasswordAuthenticationToken resolveAuthentication(HttpServletRequest request) {
    if (!isValidInternalToken(request.getHeader(properties.headerName()))) {
      return null;
    }
    final String forwardedUserId = request.getHeader(properties.userIdHeaderName());
    if (forwardedUserId == null || forwardedUserId.isBlank()) {
      logger.warn(
          "internal billing request without {} on path={}",
          properties.userIdHeaderName(),
          request.getRequestURI());
      return null;
    }
    final String forwardedEmail = request.getHeader(properties.userEmailHeaderName());
    final BillingPrincipal principal =
        new BillingPrincipal(
            forwardedUserId.trim(),
            forwardedEmail == null || forwardedEmail.isBlank() ? null : forwardedEmail.trim());
    return new UsernamePasswordAuthenticationToken(
        principal, "N/A", List.of(new SimpleGrantedAuthority(USER_ROLE)));
  }

  private boolean isValidInternalToken(String actualToken) {
    return actualToken != null
        && !properties.token().isBlank()
        && actualToken.equals(properties.token());
  }
}
