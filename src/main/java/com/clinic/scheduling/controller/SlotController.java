package com.clinic.scheduling.controller;

import com.clinic.scheduling.auth.CallerIdentity;
import com.clinic.scheduling.auth.ScheduleAuthority;
import com.clinic.scheduling.dto.AuditEntryView;
import com.clinic.scheduling.dto.CancelByDateRequest;
import com.clinic.scheduling.dto.CancelScope;
import com.clinic.scheduling.dto.CancelSlotsRequest;
import com.clinic.scheduling.dto.CancellationResult;
import com.clinic.scheduling.dto.ConvertModeRequest;
import com.clinic.scheduling.dto.GenerateSlotsRequest;
import com.clinic.scheduling.dto.GenerationResult;
import com.clinic.scheduling.dto.ShiftByDateRequest;
import com.clinic.scheduling.dto.ShiftSlotRequest;
import com.clinic.scheduling.dto.SlotGenerationSpec;
import com.clinic.scheduling.dto.SlotView;
import com.clinic.scheduling.exception.ValidationException;
import com.clinic.scheduling.service.AvailabilityService;
import com.clinic.scheduling.service.SlotAuditService;
import com.clinic.scheduling.service.SlotGenerationService;
import com.clinic.scheduling.service.SlotModificationService;
import com.clinic.scheduling.utils.TimeParser;
import org.apache.commons.lang3.StringUtils;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;

@RestController
@RequestMapping("/api/slots")
public class SlotController {

    private final SlotGenerationService generationService;
    private final SlotModificationService modificationService;
    private final AvailabilityService availabilityService;
    private final SlotAuditService auditService;
    private final ScheduleAuthority authority;

    public SlotController(SlotGenerationService generationService,
                          SlotModificationService modificationService,
                          AvailabilityService availabilityService,
                          SlotAuditService auditService,
                          ScheduleAuthority authority) {
        this.generationService = generationService;
        this.modificationService = modificationService;
        this.availabilityService = availabilityService;
        this.auditService = auditService;
        this.authority = authority;
    }

    @PostMapping("/generate")
    public ResponseEntity<GenerationResult> generate(CallerIdentity caller, @RequestBody GenerateSlotsRequest request) {
        Long doctorId = authority.doctorFor(caller, request.getDoctorId());
        if (request.getDurationMinutes() == null) {
            throw new ValidationException("durationMinutes is required.");
        }
        SlotGenerationSpec spec = new SlotGenerationSpec(
                doctorId,
                request.getDeliveryMode(),
                TimeParser.parseDate(request.getStartDate(), "startDate"),
                TimeParser.parseDate(request.getEndDate(), "endDate"),
                TimeParser.parseTime(request.getStartTime(), "startTime"),
                TimeParser.parseTime(request.getEndTime(), "endTime"),
                request.getDurationMinutes());
        return ResponseEntity.status(HttpStatus.CREATED).body(generationService.generate(spec, caller.userId()));
    }

    @GetMapping
    public List<SlotView> search(CallerIdentity caller,
                                 @RequestParam Long doctorId,
                                 @RequestParam String date) {
        return availabilityService.searchSlots(doctorId, TimeParser.parseDate(date, "date"));
    }

    @GetMapping("/by-specialty/{specialtyId}")
    public List<SlotView> bySpecialty(CallerIdentity caller,
                                      @PathVariable Long specialtyId,
                                      @RequestParam(required = false) String from,
                                      @RequestParam(required = false) String to) {
        return availabilityService.searchBySpecialty(specialtyId, optionalDate(from, "from"), optionalDate(to, "to"));
    }

    @GetMapping("/{id}/history")
    public List<AuditEntryView> history(CallerIdentity caller, @PathVariable Long id) {
        authority.requireSlotAccess(caller, List.of(id));
        return auditService.history(id);
    }

    @PutMapping("/{id}/schedule")
    public SlotView shift(CallerIdentity caller, @PathVariable Long id, @RequestBody ShiftSlotRequest request) {
        authority.requireSlotAccess(caller, List.of(id));
        return modificationService.shift(id,
                TimeParser.parseDate(request.getDate(), "date"),
                TimeParser.parseTime(request.getTime(), "time"),
                caller.userId());
    }

    @PostMapping("/shift-by-date")
    public List<SlotView> shiftByDate(CallerIdentity caller, @RequestBody ShiftByDateRequest request) {
        Long doctorId = authority.doctorFor(caller, request.getDoctorId());
        LocalTime newStart = StringUtils.isBlank(request.getNewStartTime())
                ? null
                : TimeParser.parseTime(request.getNewStartTime(), "newStartTime");
        return modificationService.shiftByDate(doctorId,
                TimeParser.parseDate(request.getDate(), "date"),
                TimeParser.parseDate(request.getNewDate(), "newDate"),
                newStart,
                caller.userId());
    }

    @PostMapping("/cancel")
    public CancellationResult cancel(CallerIdentity caller, @RequestBody CancelSlotsRequest request) {
        authority.requireSlotAccess(caller, request.getIds());
        return modificationService.cancel(request.getIds(), caller.userId());
    }

    @PostMapping("/cancel-by-date")
    public CancellationResult cancelByDate(CallerIdentity caller, @RequestBody CancelByDateRequest request) {
        CancelScope scope = authority.cancelScope(caller, request.getDoctorId());
        return modificationService.cancelByDate(TimeParser.parseDate(request.getDate(), "date"), scope, caller.userId());
    }

    @PutMapping("/{id}/delivery-mode")
    public SlotView convert(CallerIdentity caller, @PathVariable Long id, @RequestBody ConvertModeRequest request) {
        authority.requireSlotAccess(caller, List.of(id));
        return modificationService.convert(id, request.getDeliveryMode(), caller.userId());
    }

    private static LocalDate optionalDate(String raw, String field) {
        return StringUtils.isBlank(raw) ? null : TimeParser.parseDate(raw, field);
    }
}
