package com.clinic.scheduling.dto;

import lombok.*;

import java.util.Set;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class CancelSlotsRequest {
    private Set<Long> ids;
}
