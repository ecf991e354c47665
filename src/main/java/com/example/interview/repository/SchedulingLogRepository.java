package com.example.interview.repository;

import com.example.interview.model.SchedulingLog;
import org.springframework.data.jpa.repository.JpaRepository;

import java.time.LocalDateTime;
import java.util.List;

public interface SchedulingLogRepository extends JpaRepository<SchedulingLog, Long> {

    List<SchedulingLog> findAllByCreatedAtGreaterThanEqualOrderByCreatedAtAsc(LocalDateTime since);

    List<SchedulingLog> findAllByInterviewIdOrderByCreatedAtAsc(Long interviewId);
}
