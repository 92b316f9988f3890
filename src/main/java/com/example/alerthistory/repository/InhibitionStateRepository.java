package com.example.alerthistory.repository;

import com.example.alerthistory.domain.InhibitionState;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;

@Repository
public interface InhibitionStateRepository extends JpaRepository<InhibitionState, String> {

    @Modifying
    @Query("DELETE FROM InhibitionState s WHERE s.expiresAt IS NOT NULL AND s.expiresAt <= :now")
    int deleteExpired(@Param("now") Instant now);
}
