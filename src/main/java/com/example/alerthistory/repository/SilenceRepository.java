package com.example.alerthistory.repository;

import com.example.alerthistory.domain.Silence;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

@Repository
public interface SilenceRepository extends JpaRepository<Silence, String>, JpaSpecificationExecutor<Silence> {

    /** Pending and active silences; the candidates for matching */
    @Query("SELECT s FROM Silence s WHERE s.endsAt > :now")
    List<Silence> findUnexpired(@Param("now") Instant now);

    long countByStartsAtAfter(Instant now);

    @Query("SELECT COUNT(s) FROM Silence s WHERE s.startsAt <= :now AND s.endsAt > :now")
    long countActive(@Param("now") Instant now);

    long countByEndsAtLessThanEqual(Instant now);
}
