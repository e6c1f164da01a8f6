package com.example.authsession.repository;

import com.example.authsession.domain.entity.AppUser;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

public interface AppUserRepository extends JpaRepository<AppUser, Long> {

  Optional<AppUser> findByIamSubjectId(String iamSubjectId);
}
