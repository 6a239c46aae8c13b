package com.example.tieredcache.api;

import com.example.tieredcache.core.InvalidKeyFormatException;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;
import java.util.regex.PatternSyntaxException;

@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(InvalidKeyFormatException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> invalidKey(InvalidKeyFormatException e) {
        return Map.of("error", "invalid_key", "message", e.getMessage());
    }

    @ExceptionHandler(PatternSyntaxException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> invalidPattern(PatternSyntaxException e) {
        return Map.of("error", "invalid_pattern", "message", e.getDescription());
    }
}
