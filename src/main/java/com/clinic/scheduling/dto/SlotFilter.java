package com.clinic.scheduling.dto;

import com.clinic.scheduling.entity.AppointmentSlot;
import com.clinic.scheduling.entity.DeliveryMode;

import java.time.LocalDate;

/** Optional criteria for a doctor's slot listing; null fields do not filter. */
public record SlotFilter(LocalDate date, DeliveryMode deliveryMode, AppointmentSlot.Status status) {

    public static SlotFilter none() {
        return new SlotFilter(null, null, null);
    }
}
