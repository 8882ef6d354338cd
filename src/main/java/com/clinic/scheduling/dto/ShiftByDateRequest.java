package com.clinic.scheduling.dto;

import lombok.*;

/**
 * Moves a whole day. Without {@code newStartTime} each slot keeps its time of day.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ShiftByDateRequest {
    private Long doctorId;
    private String date;
    private String newDate;
    private String newStartTime;
}
