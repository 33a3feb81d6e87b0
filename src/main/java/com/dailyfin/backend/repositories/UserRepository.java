package com.dailyfin.backend.repositories;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import com.dailyfin.backend.entities.User;

public interface UserRepository extends JpaRepository<User, UUID> {

    Optional<User> findByEmail(String email);

    boolean existsByEmail(String email);

    @Query("""
            select u from User u
            where u.id <> :excludeId
            and (lower(u.email) like lower(concat('%', cast(:q as string), '%'))
                or lower(u.name) like lower(concat('%', cast(:q as string), '%')))
            order by u.name asc
            """)
    List<User> searchByNameOrEmail(
            @Param("q") String q,
            @Param("excludeId") UUID excludeId,
            Pageable pageable
    );

    @Query("select t from User u join u.deviceTokens t where u.id = :userId")
    List<String> findDeviceTokens(@Param("userId") UUID userId);
}
