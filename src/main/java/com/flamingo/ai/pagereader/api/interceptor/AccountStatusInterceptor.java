package com.flamingo.ai.pagereader.api.interceptor;

import com.flamingo.ai.pagereader.exception.AccountDisabledException;
import com.flamingo.ai.pagereader.service.account.AccountStatusService;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;

/** Rejects API calls made on behalf of a disabled account. */
@Component
@RequiredArgsConstructor
public class AccountStatusInterceptor implements HandlerInterceptor {

  public static final String OWNER_HEADER = "X-User-Id";

  private final AccountStatusService accountStatusService;

  @Override
  public boolean preHandle(
      HttpServletRequest request, HttpServletResponse response, Object handler) {
    String ownerId = request.getHeader(OWNER_HEADER);
    if (ownerId != null && !ownerId.isBlank() && accountStatusService.isDisabled(ownerId)) {
      throw new AccountDisabledException(ownerId);
    }
    return true;
  }
}
