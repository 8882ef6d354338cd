package com.clinic.scheduling.dto;

import com.clinic.scheduling.entity.DeliveryMode;
import lombok.*;

/**
 * Body of a slot generation call. Times accept {@code HH:mm} or {@code hh:mm AM/PM}.
 * {@code doctorId} may be omitted when a doctor generates their own schedule.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class GenerateSlotsRequest {
    private Long doctorId;
    private DeliveryMode deliveryMode;
    private String startDate;
    private String endDate;
    private String startTime;
    private String endTime;
    private Integer durationMinutes;
}
