package com.clinic.scheduling.dto;

import lombok.*;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class CancelByDateRequest {
    private String date;
    /** Admin callers only; omitted means every doctor. */
    private Long doctorId;
}
