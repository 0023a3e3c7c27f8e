package com.company.trainingruns.dto.request;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Single artifact reference: a blog post URL or a conversation S3 key.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class AttachmentRequest {
    @NotBlank(message = "Value is required")
    private String value;
}
