package com.example.authsession.service;

import com.example.authsession.domain.entity.SessionRecord;
import com.example.authsession.exception.SessionException;
import com.example.authsession.properties.ApplicationProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Key naming and JSON encoding of session records.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SessionRecordCodec {

  private final ObjectMapper objectMapper;
  private final ApplicationProperties properties;

  public String key(String sessionId) {
    return properties.session().keyPrefix() + sessionId;
  }

  /**
   * Decodes a stored record. Malformed JSON or a missing {@code app_user_id} is empty.
   */
  public Optional<SessionRecord> decode(String sessionId, String json) {
    try {
      SessionRecord record = objectMapper.readValue(json, SessionRecord.class);
      if (record == null || record.appUserId() == null) {
        log.warn("Session {} has no app_user_id", mask(sessionId));
        return Optional.empty();
      }
      return Optional.of(record);
    } catch (JsonProcessingException e) {
      log.warn("Invalid session data for session {}: {}", mask(sessionId), e.getOriginalMessage());
      return Optional.empty();
    }
  }

  public String encode(SessionRecord record) {
    try {
      return objectMapper.writeValueAsString(record);
    } catch (JsonProcessingException e) {
      throw new SessionException("Failed to serialize session record", e);
    }
  }

  public static String mask(String sessionId) {
    if (sessionId == null || sessionId.length() < 8) return "INVALID";
    return sessionId.substring(0, 8) + "...";
  }
}
