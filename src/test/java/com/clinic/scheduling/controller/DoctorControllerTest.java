package com.clinic.scheduling.controller;

import com.clinic.scheduling.auth.CallerIdentityArgumentResolver;
import com.clinic.scheduling.dto.DoctorView;
import com.clinic.scheduling.dto.SlotFilter;
import com.clinic.scheduling.entity.AppointmentSlot;
import com.clinic.scheduling.entity.DeliveryMode;
import com.clinic.scheduling.service.AvailabilityService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.LocalDate;
import java.util.List;
import java.util.Set;

import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(DoctorController.class)
class DoctorControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private AvailabilityService availabilityService;

    @Test
    void shouldListDoctorsBySpecialty() throws Exception {
        when(availabilityService.listDoctors(2L)).thenReturn(List.of(new DoctorView(12L, "Dr. Adams", Set.of(2L))));

        mockMvc.perform(get("/api/doctors").param("specialtyId", "2")
                        .header(CallerIdentityArgumentResolver.USER_ID_HEADER, "100")
                        .header(CallerIdentityArgumentResolver.ROLE_HEADER, "PATIENT"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].name").value("Dr. Adams"));
    }

    @Test
    void shouldPassSlotFilter() throws Exception {
        when(availabilityService.checkSlots(12L,
                new SlotFilter(LocalDate.of(2025, 4, 11), DeliveryMode.TELEMEDICINE, AppointmentSlot.Status.FREE)))
                .thenReturn(List.of());

        mockMvc.perform(get("/api/doctors/12/slots")
                        .param("date", "2025-04-11")
                        .param("mode", "TELEMEDICINE")
                        .param("status", "FREE")
                        .header(CallerIdentityArgumentResolver.USER_ID_HEADER, "100")
                        .header(CallerIdentityArgumentResolver.ROLE_HEADER, "PATIENT"))
                .andExpect(status().isOk());

        verify(availabilityService).checkSlots(12L,
                new SlotFilter(LocalDate.of(2025, 4, 11), DeliveryMode.TELEMEDICINE, AppointmentSlot.Status.FREE));
    }

    @Test
    void shouldRejectUnknownMode() throws Exception {
        mockMvc.perform(get("/api/doctors/12/slots")
                        .param("mode", "HOLOGRAM")
                        .header(CallerIdentityArgumentResolver.USER_ID_HEADER, "100")
                        .header(CallerIdentityArgumentResolver.ROLE_HEADER, "PATIENT"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.kind").value("VALIDATION"));
    }
}
