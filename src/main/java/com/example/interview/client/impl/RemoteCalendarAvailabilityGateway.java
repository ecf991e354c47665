package com.example.interview.client.impl;

import com.example.interview.dto.BookedInterval;
import com.example.interview.dto.BusyMarker;
import com.example.interview.dto.SearchWindow;
import com.example.interview.service.AvailabilityGateway;
import com.example.interview.service.exception.AvailabilityGatherTimeoutException;
import com.example.interview.service.exception.ExternalLookupException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.SocketTimeoutException;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

/**
 * Reads bookings and markers from an external calendar bridge that already aggregates the
 * participants' providers.
 */
@Slf4j
@Service
@RequiredArgsConstructor
@ConditionalOnProperty(name = "scheduler.availability.provider", havingValue = "remote")
public class RemoteCalendarAvailabilityGateway implements AvailabilityGateway {

    private final RestTemplate restTemplate;

    @Value("${scheduler.calendar.base-url}")
    private String baseUrl;

    @Override
    public List<BookedInterval> getBookings(Collection<String> participantIds, SearchWindow window) {
        BookedInterval[] body = fetch("/bookings", participantIds, window, BookedInterval[].class);
        return body != null ? Arrays.asList(body) : Collections.emptyList();
    }

    @Override
    public List<BusyMarker> getBusySlots(Collection<String> participantIds, SearchWindow window) {
        BusyMarker[] body = fetch("/availability", participantIds, window, BusyMarker[].class);
        return body != null ? Arrays.asList(body) : Collections.emptyList();
    }

    private <T> T fetch(String path, Collection<String> participantIds, SearchWindow window, Class<T> type) {
        String url = UriComponentsBuilder.fromHttpUrl(baseUrl)
                .path(path)
                .queryParam("participants", String.join(",", participantIds))
                .queryParam("from", window.start())
                .queryParam("to", window.end())
                .toUriString();
        try {
            return restTemplate.getForObject(url, type);
        } catch (HttpClientErrorException.NotFound e) {
            // no integration for these participants
            log.debug("Calendar bridge has no data for {}", participantIds);
            return null;
        } catch (ResourceAccessException e) {
            if (e.getCause() instanceof SocketTimeoutException) {
                throw new AvailabilityGatherTimeoutException("Calendar bridge timed out for " + participantIds, e);
            }
            throw new ExternalLookupException("Calendar bridge unreachable", e);
        } catch (RestClientException e) {
            log.error("Failed to load {} for {}: {}", path, participantIds, e.getMessage());
            throw new ExternalLookupException("Calendar bridge request failed", e);
        }
    }
}
