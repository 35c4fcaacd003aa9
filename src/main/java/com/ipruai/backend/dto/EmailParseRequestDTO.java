package com.ipruai.backend.dto;

import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Subject and body may each be empty, but not both.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class EmailParseRequestDTO {

    @Size(max = 1000, message = "subject must be at most 1000 characters")
    private String subject;

    @Size(max = 50000, message = "body must be at most 50000 characters")
    private String body;
}
