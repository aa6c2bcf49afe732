package com.scholary.mp3.fetcher.config;

import com.scholary.mp3.fetcher.api.ApiKeyInterceptor;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.web.servlet.config.annotation.AsyncSupportConfigurer;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * Web MVC wiring.
 *
 * <p>The API key check guards the data endpoints only; the static page stays public. Async
 * responses (file downloads) run on the stream pool with no timeout, since a large archive may
 * take a while to transfer.
 */
@Configuration
public class WebConfig implements WebMvcConfigurer {

  private final ApiKeyInterceptor apiKeyInterceptor;
  private final AsyncTaskExecutor streamExecutor;

  public WebConfig(
      ApiKeyInterceptor apiKeyInterceptor,
      @Qualifier("streamExecutor") AsyncTaskExecutor streamExecutor) {
    this.apiKeyInterceptor = apiKeyInterceptor;
    this.streamExecutor = streamExecutor;
  }

  @Override
  public void addInterceptors(InterceptorRegistry registry) {
    registry.addInterceptor(apiKeyInterceptor).addPathPatterns("/progress", "/download/**", "/fetch");
  }

  @Override
  public void configureAsyncSupport(AsyncSupportConfigurer configurer) {
    configurer.setTaskExecutor(streamExecutor);
    configurer.setDefaultTimeout(-1);
  }
}
