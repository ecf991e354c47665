package com.example.interview.repository;

import com.example.interview.model.AvailabilitySlot;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;

public interface AvailabilitySlotRepository extends JpaRepository<AvailabilitySlot, Long> {

    @Query("select s from AvailabilitySlot s where s.participantId in :participantIds " +
            "and s.startTime < :windowEnd and s.endTime > :windowStart order by s.startTime")
    List<AvailabilitySlot> findOverlapping(@Param("participantIds") Collection<String> participantIds,
                                           @Param("windowStart") LocalDateTime windowStart,
                                           @Param("windowEnd") LocalDateTime windowEnd);
}
