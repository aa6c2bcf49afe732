package com.scholary.mp3.fetcher.api;

import com.scholary.mp3.fetcher.config.ConverterProperties;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;

/**
 * Requires the shared secret in the {@code X-API-Key} header when one is configured.
 *
 * <p>With no key configured every request passes.
 */
@Component
public class ApiKeyInterceptor implements HandlerInterceptor {

  public static final String HEADER = "X-API-Key";

  static final String MISSING_KEY = "missing X-API-Key header";
  static final String INVALID_KEY = "invalid api key";

  private final ConverterProperties properties;

  public ApiKeyInterceptor(ConverterProperties properties) {
    this.properties = properties;
  }

  @Override
  public boolean preHandle(
      HttpServletRequest request, HttpServletResponse response, Object handler) {
    if (!properties.apiKeyRequired()) {
      return true;
    }
    String key = request.getHeader(HEADER);
    if (key == null || key.isEmpty()) {
      throw new ApiKeyRejectedException(MISSING_KEY);
    }
    if (!MessageDigest.isEqual(
        key.getBytes(StandardCharsets.UTF_8),
        properties.apiKey().getBytes(StandardCharsets.UTF_8))) {
      throw new ApiKeyRejectedException(INVALID_KEY);
    }
    return true;
  }
}
