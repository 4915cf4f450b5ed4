package com.example.omnichat.persistence;

import com.example.omnichat.domain.Channel;
import java.util.List;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;

public interface ConnectionConfigJpaRepository extends JpaRepository<ConnectionConfigEntity, String> {

    List<ConnectionConfigEntity> findByCompanyIdOrderByCreatedAtAsc(String companyId);

    Optional<ConnectionConfigEntity> findByChannelAndExternalIdAndActiveTrue(Channel channel, String externalId);

    boolean existsByChannelAndExternalId(Channel channel, String externalId);
}
