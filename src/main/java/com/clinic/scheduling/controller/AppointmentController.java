package com.clinic.scheduling.controller;

import com.clinic.scheduling.auth.CallerIdentity;
import com.clinic.scheduling.dto.AppointmentChanges;
import com.clinic.scheduling.dto.AppointmentMetadata;
import com.clinic.scheduling.dto.AppointmentView;
import com.clinic.scheduling.dto.BookAppointmentRequest;
import com.clinic.scheduling.dto.SlotTarget;
import com.clinic.scheduling.dto.UpdateAppointmentRequest;
import com.clinic.scheduling.exception.ValidationException;
import com.clinic.scheduling.service.BookingService;
import com.clinic.scheduling.utils.TimeParser;
import org.apache.commons.lang3.StringUtils;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/appointments")
public class AppointmentController {

    private final BookingService bookingService;

    public AppointmentController(BookingService bookingService) {
        this.bookingService = bookingService;
    }

    @PostMapping
    public ResponseEntity<AppointmentView> book(CallerIdentity caller, @RequestBody BookAppointmentRequest request) {
        SlotTarget target;
        if (request.getSlotId() != null) {
            target = SlotTarget.slot(request.getSlotId());
        } else if (request.getDoctorId() != null && StringUtils.isNotBlank(request.getAppointmentDate())) {
            target = SlotTarget.doctorAt(request.getDoctorId(),
                    TimeParser.parseDateTime(request.getAppointmentDate(), "appointmentDate"));
        } else {
            throw new ValidationException("Either slotId or doctorId with appointmentDate is required.");
        }
        AppointmentMetadata metadata = new AppointmentMetadata(
                request.getInstitutionId(),
                request.getSpecialtyId(),
                request.getUrgency(),
                request.getVisitType(),
                request.getDeliveryMode(),
                request.getStatus());
        return ResponseEntity.status(HttpStatus.CREATED).body(bookingService.book(target, caller, metadata));
    }

    @GetMapping("/{id}")
    public AppointmentView get(CallerIdentity caller, @PathVariable Long id) {
        return bookingService.getAppointment(id, caller);
    }

    @GetMapping
    public List<AppointmentView> list(CallerIdentity caller, @RequestParam(required = false) String date) {
        return bookingService.listAppointments(caller,
                StringUtils.isBlank(date) ? null : TimeParser.parseDate(date, "date"));
    }

    @PatchMapping("/{id}")
    public AppointmentView update(CallerIdentity caller, @PathVariable Long id, @RequestBody UpdateAppointmentRequest request) {
        AppointmentChanges changes = new AppointmentChanges(
                StringUtils.isBlank(request.getAppointmentDate())
                        ? null
                        : TimeParser.parseDateTime(request.getAppointmentDate(), "appointmentDate"),
                request.getStatus());
        return bookingService.update(id, caller, changes);
    }

    @DeleteMapping("/{id}")
    public AppointmentView delete(CallerIdentity caller, @PathVariable Long id) {
        return bookingService.delete(id, caller);
    }
}
