package com.example.interview.service;

import com.example.interview.dto.BookedInterval;
import com.example.interview.dto.BusyMarker;
import com.example.interview.dto.SearchWindow;

import java.util.Collection;
import java.util.List;

/**
 * Source of existing bookings and explicit availability markers. One implementation per provider,
 * selected with {@code scheduler.availability.provider}.
 * Participants without a provider integration yield empty lists, never an error.
 */
public interface AvailabilityGateway {

    /** Scheduled or confirmed interviews of the participants overlapping the window */
    List<BookedInterval> getBookings(Collection<String> participantIds, SearchWindow window);

    /** Busy and available markers of the participants overlapping the window */
    List<BusyMarker> getBusySlots(Collection<String> participantIds, SearchWindow window);
}
