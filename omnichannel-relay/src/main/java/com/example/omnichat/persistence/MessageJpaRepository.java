package com.example.omnichat.persistence;

import java.time.Instant;
import java.util.List;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface MessageJpaRepository extends JpaRepository<MessageEntity, Long> {

    @Query(
            "select m from MessageEntity m where m.conversationId = :conversationId "
                    + "order by m.createdAt desc, m.id desc")
    List<MessageEntity> findLatest(@Param("conversationId") String conversationId, Pageable pageable);

    @Query(
            "select m from MessageEntity m where m.conversationId = :conversationId "
                    + "and (m.createdAt < :at or (m.createdAt = :at and m.id < :id)) "
                    + "order by m.createdAt desc, m.id desc")
    List<MessageEntity> findBefore(
            @Param("conversationId") String conversationId,
            @Param("at") Instant at,
            @Param("id") Long id,
            Pageable pageable);

    boolean existsByDedupKey(String dedupKey);
}
