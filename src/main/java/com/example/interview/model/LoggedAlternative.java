package com.example.interview.model;

import jakarta.persistence.Embeddable;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Embeddable
@Data
@NoArgsConstructor
@AllArgsConstructor
public class LoggedAlternative {

    private LocalDateTime startTime;

    private LocalDateTime endTime;

    private double score;
}
