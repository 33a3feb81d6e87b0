package com.dailyfin.backend.repositories;

import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import com.dailyfin.backend.entities.Message;

public interface MessageRepository extends JpaRepository<Message, UUID> {

    interface UnreadBySenderProjection {
        UUID getSenderId();
        Long getUnread();
    }

    @Query(value = """
            select m from Message m
            where (m.sender.id = :userId and m.receiver.id = :otherId)
               or (m.sender.id = :otherId and m.receiver.id = :userId)
            """,
            countQuery = """
            select count(m) from Message m
            where (m.sender.id = :userId and m.receiver.id = :otherId)
               or (m.sender.id = :otherId and m.receiver.id = :userId)
            """)
    Page<Message> findConversation(
            @Param("userId") UUID userId,
            @Param("otherId") UUID otherId,
            Pageable pageable
    );

    @Query("""
            select m from Message m
            join fetch m.sender
            join fetch m.receiver
            where m.sender.id = :userId or m.receiver.id = :userId
            order by m.createdAt desc
            """)
    List<Message> findAllInvolving(@Param("userId") UUID userId);

    @Query("""
            select m.sender.id as senderId, count(m) as unread
            from Message m
            where m.receiver.id = :userId and m.isRead = false
            group by m.sender.id
            """)
    List<UnreadBySenderProjection> countUnreadBySender(@Param("userId") UUID userId);

    @Query("select count(m) from Message m where m.receiver.id = :userId and m.isRead = false")
    long countUnread(@Param("userId") UUID userId);

    @Modifying
    @Query("""
            update Message m set m.isRead = true, m.readAt = :readAt
            where m.sender.id = :senderId and m.receiver.id = :receiverId and m.isRead = false
            """)
    int markAsRead(
            @Param("senderId") UUID senderId,
            @Param("receiverId") UUID receiverId,
            @Param("readAt") LocalDateTime readAt
    );

    @Query("""
            select m from Message m
            where ((m.sender.id = :userId and m.receiver.id = :otherId)
               or (m.sender.id = :otherId and m.receiver.id = :userId))
            and lower(m.message) like lower(concat('%', cast(:q as string), '%'))
            order by m.createdAt desc
            """)
    List<Message> search(
            @Param("userId") UUID userId,
            @Param("otherId") UUID otherId,
            @Param("q") String q,
            Pageable pageable
    );
}
