package com.codefarm.shortlink.service.repository;

import com.codefarm.shortlink.service.model.LinkRecord;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.Repository;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.Optional;

/**
 * Lookup and insert only. There is no save, update or delete.
 */
public interface LinkRecordRepository extends Repository<LinkRecord, String> {

    Optional<LinkRecord> findById(String shortId);

    /**
     * Plain INSERT; the primary key rejects a taken id in the same statement.
     */
    @Modifying
    @Transactional
    @Query(value = "insert into short_links (short_id, long_url, created_at) values (:shortId, :longUrl, :createdAt)",
            nativeQuery = true)
    int insert(@Param("shortId") String shortId,
               @Param("longUrl") String longUrl,
               @Param("createdAt") LocalDateTime createdAt);
}
