package com.codefarm.shortlink.repository;

import com.codefarm.shortlink.model.ShortLink;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;

/**
 * Authoritative storage of short links. Code uniqueness is enforced by the store itself at insert
 * time; callers never check for a code before writing it.
 */
public interface LinkStore {

    /**
     * @throws com.codefarm.shortlink.exception.CodeAlreadyInUseException if the code is taken
     */
    ShortLink insert(ShortLink link);

    Optional<ShortLink> findByCode(String code);

    /**
     * Idempotent: removing an absent code is not an error.
     */
    void deleteByCode(String code);

    /**
     * Removes every link whose expiry is strictly before {@code cutoff}.
     *
     * @return number of links removed
     */
    int deleteExpiredBefore(Instant cutoff);

    /**
     * Link counts per owner, anonymous links excluded. Served from the read replica.
     */
    Map<String, Long> countLinksPerOwner();
}
