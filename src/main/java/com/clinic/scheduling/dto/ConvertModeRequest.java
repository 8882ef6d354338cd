package com.clinic.scheduling.dto;

import com.clinic.scheduling.entity.DeliveryMode;
import lombok.*;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class ConvertModeRequest {
    private DeliveryMode deliveryMode;
}
