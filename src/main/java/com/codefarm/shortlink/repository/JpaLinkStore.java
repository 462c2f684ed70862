package com.codefarm.shortlink.repository;

import com.codefarm.shortlink.config.DataSourceRoute;
import com.codefarm.shortlink.exception.CodeAlreadyInUseException;
import com.codefarm.shortlink.model.ShortLink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

@Component
public class JpaLinkStore implements LinkStore {

    private static final Logger log = LoggerFactory.getLogger(JpaLinkStore.class);

    private final ShortLinkRepository repository;

    public JpaLinkStore(ShortLinkRepository repository) {
        this.repository = repository;
    }

    @Override
    public ShortLink insert(ShortLink link) {
        try {
            // runs in its own transaction so the unique-constraint violation surfaces here, not at an outer commit
            return repository.saveAndFlush(link);
        } catch (DataIntegrityViolationException e) {
            log.debug("Insert of code {} rejected by unique constraint", link.getCode());
            throw new CodeAlreadyInUseException(link.getCode(), e);
        }
    }

    @Override
    public Optional<ShortLink> findByCode(String code) {
        return repository.findByCode(code);
    }

    @Override
    public void deleteByCode(String code) {
        int removed = repository.deleteByCode(code);
        log.debug("Deleted code {} ({} row(s))", code, removed);
    }

    @Override
    public int deleteExpiredBefore(Instant cutoff) {
        return repository.deleteExpiredBefore(cutoff);
    }

    @Override
    public Map<String, Long> countLinksPerOwner() {
        Map<String, Long> counts = new LinkedHashMap<>();
        DataSourceRoute.onReplica(repository::countLinksPerOwner)
                .forEach(row -> counts.put(row.getOwner(), row.getCount()));
        return counts;
    }
}
