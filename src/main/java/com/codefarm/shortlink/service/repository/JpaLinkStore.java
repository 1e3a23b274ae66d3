package com.codefarm.shortlink.service.repository;

import com.codefarm.shortlink.service.exception.StorageUnavailableException;
import com.codefarm.shortlink.service.model.LinkRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Component;

import java.sql.SQLException;
import java.time.LocalDateTime;
import java.util.Optional;

/**
 * Relational store. Each insert commits in its own transaction, so a stored link is
 * visible to every later lookup.
 */
@Component
@ConditionalOnProperty(name = "shortlink.store", havingValue = "jpa", matchIfMissing = true)
public class JpaLinkStore implements LinkStore {

    private static final Logger log = LoggerFactory.getLogger(JpaLinkStore.class);

    // SQLSTATE for unique/primary key violation, shared by H2 and PostgreSQL.
    private static final String UNIQUE_VIOLATION = "23505";

    private final LinkRecordRepository repository;

    public JpaLinkStore(LinkRecordRepository repository) {
        this.repository = repository;
    }

    @Override
    public boolean putIfAbsent(String shortId, String longUrl) {
        try {
            return repository.insert(shortId, longUrl, LocalDateTime.now()) == 1;
        } catch (DataIntegrityViolationException ex) {
            if (isDuplicateKey(ex)) {
                log.debug("Insert of short_id {} rejected by primary key: {}", shortId, ex.getMessage());
                return false;
            }
            log.error("Constraint violation while storing short_id {}", shortId, ex);
            throw new StorageUnavailableException("Database error: " + ex.getMostSpecificCause().getMessage(), ex);
        } catch (DataAccessException ex) {
            log.error("Database error while storing short_id {}", shortId, ex);
            throw new StorageUnavailableException("Database error: " + ex.getMostSpecificCause().getMessage(), ex);
        }
    }

    @Override
    public Optional<String> get(String shortId) {
        try {
            return repository.findById(shortId).map(LinkRecord::getLongUrl);
        } catch (DataAccessException ex) {
            log.error("Database error while reading short_id {}", shortId, ex);
            throw new StorageUnavailableException("Database error: " + ex.getMostSpecificCause().getMessage(), ex);
        }
    }

    private static boolean isDuplicateKey(DataIntegrityViolationException ex) {
        if (ex instanceof DuplicateKeyException) {
            return true;
        }
        for (Throwable cause = ex.getCause(); cause != null; cause = cause.getCause()) {
            if (cause instanceof SQLException sql && UNIQUE_VIOLATION.equals(sql.getSQLState())) {
                return true;
            }
        }
        return false;
    }
}
