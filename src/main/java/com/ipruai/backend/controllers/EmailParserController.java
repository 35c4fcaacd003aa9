package com.ipruai.backend.controllers;

import com.ipruai.backend.dto.ApiResponse;
import com.ipruai.backend.dto.EmailParseRequestDTO;
import com.ipruai.backend.dto.EmailParseResponseDTO;
import com.ipruai.backend.mappers.ParseResultMapper;
import com.ipruai.backend.services.ai.StatementModelInvoker;
import com.ipruai.backend.services.emails.EmailParsingService;
import io.swagger.v3.oas.annotations.Operation;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class EmailParserController {

    static final String SAMPLE_SUBJECT = "PMS Statement Request";
    static final String SAMPLE_BODY = "Send me portfolio statement as on 15-Mar-2024 for PAN ABCDE1234F and DI D0131848";

    private final EmailParsingService emailParsingService;
    private final StatementModelInvoker modelInvoker;
    private final Clock clock;

    /**
     * Extrai identificadores, período e tipos de extrato de um e-mail.
     */
    @PostMapping("/parse-email")
    @Operation(summary = "Parse a statement-request email")
    public ResponseEntity<ApiResponse<EmailParseResponseDTO>> parseEmail(@Valid @RequestBody EmailParseRequestDTO dto) {
        EmailParseResponseDTO parsed = ParseResultMapper.toResponseDTO(
                emailParsingService.parse(dto.getSubject(), dto.getBody()));
        return ResponseEntity.ok(ApiResponse.success(parsed, "Email parsed"));
    }

    @GetMapping("/health")
    @Operation(summary = "Service status")
    public ResponseEntity<ApiResponse<Map<String, Object>>> health() {
        Map<String, Object> status = new LinkedHashMap<>();
        status.put("status", "healthy");
        status.put("model_available", modelInvoker.isAvailable());
        status.put("model_version", modelInvoker.modelVersion());
        status.put("timestamp", LocalDateTime.now(clock));
        return ResponseEntity.ok(ApiResponse.success(status, "Service is running"));
    }

    /**
     * Faz o parse de um e-mail de exemplo fixo (smoke test).
     */
    @GetMapping("/test")
    @Operation(summary = "Parse the built-in sample email")
    public ResponseEntity<ApiResponse<EmailParseResponseDTO>> test() {
        EmailParseResponseDTO parsed = ParseResultMapper.toResponseDTO(
                emailParsingService.parse(SAMPLE_SUBJECT, SAMPLE_BODY));
        return ResponseEntity.ok(ApiResponse.success(parsed, "Sample email parsed"));
    }
}
