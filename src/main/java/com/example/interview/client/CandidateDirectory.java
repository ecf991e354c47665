package com.example.interview.client;

import com.example.interview.dto.CandidateDTO;
import com.example.interview.dto.JobPositionDTO;

import java.util.Optional;

public interface CandidateDirectory {

    /** Candidate by id, empty when the directory does not know it */
    Optional<CandidateDTO> findCandidate(String candidateId);

    /** Job position by id, empty when the directory does not know it */
    Optional<JobPositionDTO> findJobPosition(String jobPositionId);
}
