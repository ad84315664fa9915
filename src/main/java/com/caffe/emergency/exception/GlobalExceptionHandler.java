package com.caffe.emergency.exception;

import com.caffe.emergency.dto.ErrorResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(BaseException.class)
    protected ResponseEntity<ErrorResponse> handleBaseException(BaseException e) {
        if (e.getErrorCode().getStatus().is5xxServerError()) {
            log.error("❌ {} | {}", e.getErrorCode().getCode(), e.getMessage(), e);
        } else {
            log.warn("Business exception: {} | {}", e.getErrorCode().getCode(), e.getMessage());
        }
        return ErrorResponse.toResponseEntity(e);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    protected ResponseEntity<ErrorResponse> handleUnreadableBody(HttpMessageNotReadableException e) {
        log.warn("Unreadable request body: {}", e.getMostSpecificCause().getMessage());
        return ErrorResponse.toResponseEntity(new ValidationException(e.getMostSpecificCause().getMessage()));
    }

    @ExceptionHandler(Exception.class)
    protected ResponseEntity<ErrorResponse> handleException(Exception e) {
        log.error("Unexpected system failure: ", e);
        return ErrorResponse.toResponseEntity(EmergencyErrorCode.INTERNAL_SERVER_ERROR);
    }
}
