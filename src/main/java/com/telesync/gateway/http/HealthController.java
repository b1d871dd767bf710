package com.telesync.gateway.http;

import com.telesync.observability.DoctorCommand;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class HealthController {

    private final DoctorCommand doctor;

    public HealthController(DoctorCommand doctor) {
        this.doctor = doctor;
    }

    @GetMapping("/api/health")
    public ApiResponse health() {
        return ApiResponse.ok(doctor.report());
    }
}
