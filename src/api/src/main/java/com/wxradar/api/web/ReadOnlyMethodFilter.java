package com.wxradar.api.web;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.wxradar.api.api.ApiExceptionHandler;
import com.wxradar.api.config.ApiProperties;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Servlet filter keeping the API read-only and answering CORS.
 *
 * <p>Only GET and HEAD reach the controllers. OPTIONS is answered here with 204; any other
 * method gets 405 with an {@code Allow} header. With CORS enabled, wildcard CORS headers go on
 * preflight answers and on every GET or HEAD response, but not on 405s or plain OPTIONS.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 10)
public class ReadOnlyMethodFilter extends OncePerRequestFilter {
  static final String ALLOWED_METHODS = "GET, HEAD, OPTIONS";

  private final ApiProperties properties;
  private final ObjectMapper objectMapper;

  public ReadOnlyMethodFilter(ApiProperties properties, ObjectMapper objectMapper) {
    this.properties = properties;
    this.objectMapper = objectMapper;
  }

  @Override
  protected void doFilterInternal(
      HttpServletRequest request,
      HttpServletResponse response,
      FilterChain filterChain)
      throws ServletException, IOException {
    boolean cors = properties.getCors().isEnabled();
    String method = request.getMethod();
    if (HttpMethod.OPTIONS.matches(method)) {
      if (cors && isCorsRequest(request)) {
        addCorsHeaders(response);
      } else {
        response.setHeader(HttpHeaders.ALLOW, ALLOWED_METHODS);
        response.setHeader(HttpHeaders.CACHE_CONTROL, "no-cache");
      }
      response.setStatus(HttpServletResponse.SC_NO_CONTENT);
      return;
    }

    if (!HttpMethod.GET.matches(method) && !HttpMethod.HEAD.matches(method)) {
      response.setStatus(HttpServletResponse.SC_METHOD_NOT_ALLOWED);
      response.setHeader(HttpHeaders.ALLOW, ALLOWED_METHODS);
      response.setContentType(MediaType.APPLICATION_JSON_VALUE);
      objectMapper.writeValue(
          response.getWriter(),
          ApiExceptionHandler.errorBody("method_not_allowed", "method " + method + " not allowed"));
      return;
    }

    if (cors) {
      addCorsHeaders(response);
    }
    filterChain.doFilter(request, response);
  }

  private static void addCorsHeaders(HttpServletResponse response) {
    response.setHeader(HttpHeaders.ACCESS_CONTROL_ALLOW_ORIGIN, "*");
    response.setHeader(HttpHeaders.ACCESS_CONTROL_ALLOW_METHODS, ALLOWED_METHODS);
    response.setHeader(HttpHeaders.ACCESS_CONTROL_ALLOW_HEADERS, "*");
  }

  private static boolean isCorsRequest(HttpServletRequest request) {
    return request.getHeader(HttpHeaders.ORIGIN) != null
        || request.getHeader(HttpHeaders.ACCESS_CONTROL_REQUEST_METHOD) != null
        || request.getHeader(HttpHeaders.ACCESS_CONTROL_REQUEST_HEADERS) != null;
  }
}
