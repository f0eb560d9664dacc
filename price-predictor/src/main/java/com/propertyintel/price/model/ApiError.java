package com.propertyintel.price.model;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApiError {
    int status;
    String error;
    String errorCode;
    String message;
    String path;
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant timestamp;
    String column;
    List<Object> rejectedValues;
}
