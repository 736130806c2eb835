package org.lite.snapshot.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ErrorResponse {

    private ErrorCode code;
    private String message;
    private int status;
    private Instant timestamp;
    private Map<String, Object> details;

    public static ErrorResponse fromErrorCode(ErrorCode code, String message, int status) {
        return ErrorResponse.builder()
                .code(code)
                .message(message != null ? message : code.getDefaultMessage())
                .status(status)
                .timestamp(Instant.now())
                .build();
    }
}
