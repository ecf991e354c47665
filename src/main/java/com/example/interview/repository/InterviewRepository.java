package com.example.interview.repository;

import com.example.interview.model.Interview;
import com.example.interview.model.InterviewStatus;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface InterviewRepository extends JpaRepository<Interview, Long> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select i from Interview i where i.id = :id")
    Optional<Interview> findByIdForUpdate(@Param("id") Long id);

    /** Interviews of any of the given interviewers whose [start, end) overlaps the window. */
    @Query("select distinct i from Interview i join i.interviewerIds p " +
            "where p in :interviewerIds and i.status in :statuses " +
            "and i.scheduledStart < :windowEnd and i.scheduledEnd > :windowStart")
    List<Interview> findOverlapping(@Param("interviewerIds") Collection<String> interviewerIds,
                                    @Param("statuses") Collection<InterviewStatus> statuses,
                                    @Param("windowStart") LocalDateTime windowStart,
                                    @Param("windowEnd") LocalDateTime windowEnd);
}
