package com.clinic.scheduling.controller;

import com.clinic.scheduling.auth.CallerIdentity;
import com.clinic.scheduling.dto.DoctorView;
import com.clinic.scheduling.dto.SlotFilter;
import com.clinic.scheduling.dto.SlotView;
import com.clinic.scheduling.entity.AppointmentSlot;
import com.clinic.scheduling.entity.DeliveryMode;
import com.clinic.scheduling.service.AvailabilityService;
import com.clinic.scheduling.utils.TimeParser;
import org.apache.commons.lang3.StringUtils;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/doctors")
public class DoctorController {

    private final AvailabilityService availabilityService;

    public DoctorController(AvailabilityService availabilityService) {
        this.availabilityService = availabilityService;
    }

    @GetMapping
    public List<DoctorView> list(CallerIdentity caller, @RequestParam(required = false) Long specialtyId) {
        return availabilityService.listDoctors(specialtyId);
    }

    @GetMapping("/{doctorId}/slots")
    public List<SlotView> slots(CallerIdentity caller,
                                @PathVariable Long doctorId,
                                @RequestParam(required = false) String date,
                                @RequestParam(required = false) DeliveryMode mode,
                                @RequestParam(required = false) AppointmentSlot.Status status) {
        SlotFilter filter = new SlotFilter(
                StringUtils.isBlank(date) ? null : TimeParser.parseDate(date, "date"),
                mode,
                status);
        return availabilityService.checkSlots(doctorId, filter);
    }
}
