package com.clinic.scheduling.dto;

import lombok.*;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class ShiftSlotRequest {
    private String date;
    private String time;
}
