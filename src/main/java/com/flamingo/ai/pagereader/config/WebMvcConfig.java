package com.flamingo.ai.pagereader.config;

import com.flamingo.ai.pagereader.api.interceptor.AccountStatusInterceptor;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/** Web MVC configuration: account checks on every API route. */
@Configuration
@RequiredArgsConstructor
public class WebMvcConfig implements WebMvcConfigurer {

  private final AccountStatusInterceptor accountStatusInterceptor;

  @Override
  public void addInterceptors(InterceptorRegistry registry) {
    registry.addInterceptor(accountStatusInterceptor).addPathPatterns("/api/**");
  }
}
