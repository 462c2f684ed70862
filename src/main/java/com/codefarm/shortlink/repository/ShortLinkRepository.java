package com.codefarm.shortlink.repository;

import com.codefarm.shortlink.model.ShortLink;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface ShortLinkRepository extends JpaRepository<ShortLink, Long> {

    Optional<ShortLink> findByCode(String code);

    @Modifying
    @Transactional
    @Query("delete from ShortLink s where s.code = :code")
    int deleteByCode(@Param("code") String code);

    @Modifying
    @Transactional
    @Query("delete from ShortLink s where s.expiresAt is not null and s.expiresAt < :cutoff")
    int deleteExpiredBefore(@Param("cutoff") Instant cutoff);

    interface OwnerLinkCount {
        String getOwner();
        long getCount();
    }

    @Query("select s.owner as owner, count(s) as count from ShortLink s where s.owner is not null group by s.owner")
    List<OwnerLinkCount> countLinksPerOwner();
}
