package com.ospicorp.regimesync.security;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.stereotype.Component;

/** Decides access to {@code /admin/**}; referenced from {@code @PreAuthorize} expressions. */
@Component("adminAuthorization")
public class AdminAuthorization {
  private final boolean authEnabled;
  private final String scope;

  public AdminAuthorization(@Value("${security.auth.enabled:false}") boolean authEnabled,
      @Value("${security.admin.scope:admin:run}") String scope) {
    this.authEnabled = authEnabled;
    this.scope = scope;
  }

  public String scope() {
    return scope;
  }

  public boolean isAllowed(Authentication authentication) {
    if (!authEnabled) {
      return true;
    }
    if (authentication == null || !authentication.isAuthenticated()) {
      return false;
    }
    String required = "SCOPE_" + scope;
    for (GrantedAuthority authority : authentication.getAuthorities()) {
      if (required.equals(authority.getAuthority())) {
        return true;
      }
    }
    return false;
  }
}
