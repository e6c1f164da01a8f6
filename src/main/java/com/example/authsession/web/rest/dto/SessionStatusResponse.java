package com.example.authsession.web.rest.dto;

import com.example.authsession.domain.TokenStatus;
import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record SessionStatusResponse(boolean authenticated, TokenStatus upstreamToken) {

  public static SessionStatusResponse anonymous() {
    return new SessionStatusResponse(false, null);
  }
}
