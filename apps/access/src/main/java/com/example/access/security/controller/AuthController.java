package com.example.access.security.controller;

import com.example.access.common.util.StringSanitizer;
import com.example.access.security.dto.LoginRequest;
import com.example.access.security.dto.LoginResponse;
import com.example.access.security.service.LoginService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

@Slf4j
@RestController
@RequestMapping("/auth")
@RequiredArgsConstructor
public class AuthController {

    private final LoginService loginService;

    @PostMapping("/login")
    public Mono<LoginResponse> login(@Valid @RequestBody LoginRequest request) {
        log.debug("POST /auth/login - user: {}", StringSanitizer.forLog(request.userId()));
        return Mono.fromCallable(() -> loginService.login(request.userId(), request.password()));
    }
}
