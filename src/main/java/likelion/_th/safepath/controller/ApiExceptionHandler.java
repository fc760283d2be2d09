package likelion._th.safepath.controller;

import jakarta.validation.ConstraintViolationException;
import likelion._th.safepath.dto.response.ErrorResponse;
import likelion._th.safepath.exception.NoGeocodingResultException;
import likelion._th.safepath.exception.NoRoutesAvailableException;
import likelion._th.safepath.exception.RouteRequestSupersededException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.HandlerMethodValidationException;

import java.util.stream.Collectors;

@RestControllerAdvice
@Slf4j
public class ApiExceptionHandler {

    @ExceptionHandler(NoGeocodingResultException.class)
    @ResponseStatus(HttpStatus.UNPROCESSABLE_ENTITY)
    public ErrorResponse handleNoGeocoding(NoGeocodingResultException ex) {
        log.info("지오코딩 실패: {}", ex.getAddress());
        return new ErrorResponse("NO_GEOCODING_RESULT", ex.getMessage());
    }

    @ExceptionHandler(NoRoutesAvailableException.class)
    @ResponseStatus(HttpStatus.NOT_FOUND)
    public ErrorResponse handleNoRoutes(NoRoutesAvailableException ex) {
        log.info("경로 없음: {}", ex.getMessage());
        return new ErrorResponse("NO_ROUTES_AVAILABLE", ex.getMessage());
    }

    @ExceptionHandler(RouteRequestSupersededException.class)
    @ResponseStatus(HttpStatus.CONFLICT)
    public ErrorResponse handleSuperseded(RouteRequestSupersededException ex) {
        return new ErrorResponse("REQUEST_SUPERSEDED", ex.getMessage());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public ErrorResponse handleInvalidBody(MethodArgumentNotValidException ex) {
        String message = ex.getBindingResult().getAllErrors().stream()
                .map(error -> error instanceof FieldError
                        ? ((FieldError) error).getField() + ": " + error.getDefaultMessage()
                        : error.getDefaultMessage())
                .collect(Collectors.joining(", "));
        return new ErrorResponse("INVALID_REQUEST", message);
    }

    @ExceptionHandler({ConstraintViolationException.class, HandlerMethodValidationException.class,
            HttpMessageNotReadableException.class})
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public ErrorResponse handleBadInput(Exception ex) {
        return new ErrorResponse("INVALID_REQUEST", ex.getMessage());
    }
}
