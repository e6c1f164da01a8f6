package com.example.authsession.repository;

import com.example.authsession.domain.entity.UserRefreshToken;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Optional;

public interface UserRefreshTokenRepository extends JpaRepository<UserRefreshToken, Long> {

  Optional<UserRefreshToken> findByUserIdAndProviderName(Long userId, String providerName);

  // Logout: every provider's token for the user
  @Modifying(clearAutomatically = true, flushAutomatically = true)
  @Query("delete from UserRefreshToken t where t.userId = :userId")
  int deleteAllByUserId(@Param("userId") Long userId);
}
