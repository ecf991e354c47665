package com.example.interview.client.impl;

import com.example.interview.client.CandidateDirectory;
import com.example.interview.dto.CandidateDTO;
import com.example.interview.dto.JobPositionDTO;
import com.example.interview.service.exception.AvailabilityGatherTimeoutException;
import com.example.interview.service.exception.ExternalLookupException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.net.SocketTimeoutException;
import java.util.Optional;

@Slf4j
@Service
@RequiredArgsConstructor
public class CandidateDirectoryClient implements CandidateDirectory {

    private final RestTemplate restTemplate;

    @Value("${scheduler.candidates.base-url}")
    private String baseUrl;

    @Override
    public Optional<CandidateDTO> findCandidate(String candidateId) {
        return fetch(baseUrl + "/candidates/" + candidateId, CandidateDTO.class, "candidate " + candidateId);
    }

    @Override
    public Optional<JobPositionDTO> findJobPosition(String jobPositionId) {
        return fetch(baseUrl + "/jobs/" + jobPositionId, JobPositionDTO.class, "job position " + jobPositionId);
    }

    private <T> Optional<T> fetch(String url, Class<T> type, String what) {
        try {
            return Optional.ofNullable(restTemplate.getForObject(url, type));
        } catch (HttpClientErrorException.NotFound e) {
            log.info("Directory has no {}", what);
            return Optional.empty();
        } catch (ResourceAccessException e) {
            if (e.getCause() instanceof SocketTimeoutException) {
                throw new AvailabilityGatherTimeoutException("Timed out loading " + what, e);
            }
            throw new ExternalLookupException("Failed to load " + what, e);
        } catch (RestClientException e) {
            log.error("Failed to load {}: {}", what, e.getMessage());
            throw new ExternalLookupException("Failed to load " + what, e);
        }
    }
}
