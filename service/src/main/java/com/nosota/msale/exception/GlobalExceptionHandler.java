package com.nosota.msale.exception;

import com.nosota.msale.dto.ErrorResponse;
import com.nosota.msale.error.AllocationIndexOutOfRangeException;
import com.nosota.msale.error.AlreadyFinalizedException;
import com.nosota.msale.error.AuthorizationListNotFoundException;
import com.nosota.msale.error.ContributionRejectedException;
import com.nosota.msale.error.IssuanceFrozenException;
import com.nosota.msale.error.RewardBookNotFoundException;
import com.nosota.msale.error.RewardBookUnavailableException;
import com.nosota.msale.error.RewardTransferFailedException;
import com.nosota.msale.error.SaleAlreadyStartedException;
import com.nosota.msale.error.SaleFinalizedException;
import com.nosota.msale.error.SaleNotEndedException;
import com.nosota.msale.error.SaleNotFoundException;
import com.nosota.msale.error.ScheduleClosedException;
import com.nosota.msale.error.UnauthorizedException;
import com.nosota.msale.error.VestingScheduleNotFoundException;
import jakarta.persistence.EntityNotFoundException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.HandlerMethodValidationException;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/**
 * Maps service exceptions to HTTP responses.
 *
 * <ul>
 *   <li>403: caller lacks the required capability</li>
 *   <li>404: unknown sale, schedule, reward book or authorization list</li>
 *   <li>400: invalid arguments, unknown allocation index, request validation</li>
 *   <li>409: operation not allowed in the current state</li>
 *   <li>422: rejected contribution, overflowing amounts</li>
 * </ul>
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(UnauthorizedException.class)
    public ResponseEntity<ErrorResponse> handleUnauthorized(
            UnauthorizedException ex, HttpServletRequest request) {
        String correlationId = MDC.get("correlationId");
        log.error("Unauthorized caller [correlationId={}]: {}", correlationId, ex.getMessage());

        ErrorResponse error = ErrorResponse.of(
                HttpStatus.FORBIDDEN.value(),
                "Unauthorized",
                ex.getMessage(),
                request.getRequestURI()
        );
        return ResponseEntity.status(HttpStatus.FORBIDDEN).body(error);
    }

    @ExceptionHandler(ContributionRejectedException.class)
    public ResponseEntity<ErrorResponse> handleContributionRejected(
            ContributionRejectedException ex, HttpServletRequest request) {
        String correlationId = MDC.get("correlationId");
        log.error("Contribution rejected [correlationId={}, reason={}]: {}", correlationId, ex.getReason(), ex.getMessage());

        ErrorResponse error = ErrorResponse.of(
                HttpStatus.UNPROCESSABLE_ENTITY.value(),
                "Contribution Rejected: " + ex.getReason(),
                ex.getMessage(),
                request.getRequestURI()
        );
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY).body(error);
    }

    @ExceptionHandler(SaleNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleSaleNotFound(
            SaleNotFoundException ex, HttpServletRequest request) {
        String correlationId = MDC.get("correlationId");
        log.error("Sale not found [correlationId={}]: {}", correlationId, ex.getMessage());

        ErrorResponse error = ErrorResponse.of(
                HttpStatus.NOT_FOUND.value(),
                "Sale Not Found",
                ex.getMessage(),
                request.getRequestURI()
        );
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(error);
    }

    @ExceptionHandler(VestingScheduleNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleVestingScheduleNotFound(
            VestingScheduleNotFoundException ex, HttpServletRequest request) {
        String correlationId = MDC.get("correlationId");
        log.error("Vesting schedule not found [correlationId={}]: {}", correlationId, ex.getMessage());

        ErrorResponse error = ErrorResponse.of(
                HttpStatus.NOT_FOUND.value(),
                "Vesting Schedule Not Found",
                ex.getMessage(),
                request.getRequestURI()
        );
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(error);
    }

    @ExceptionHandler(RewardBookNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleRewardBookNotFound(
            RewardBookNotFoundException ex, HttpServletRequest request) {
        String correlationId = MDC.get("correlationId");
        log.error("Reward book not found [correlationId={}]: {}", correlationId, ex.getMessage());

        ErrorResponse error = ErrorResponse.of(
                HttpStatus.NOT_FOUND.value(),
                "Reward Book Not Found",
                ex.getMessage(),
                request.getRequestURI()
        );
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(error);
    }

    @ExceptionHandler(AuthorizationListNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleAuthorizationListNotFound(
            AuthorizationListNotFoundException ex, HttpServletRequest request) {
        String correlationId = MDC.get("correlationId");
        log.error("Authorization list not found [correlationId={}]: {}", correlationId, ex.getMessage());

        ErrorResponse error = ErrorResponse.of(
                HttpStatus.NOT_FOUND.value(),
                "Authorization List Not Found",
                ex.getMessage(),
                request.getRequestURI()
        );
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(error);
    }

    @ExceptionHandler(AllocationIndexOutOfRangeException.class)
    public ResponseEntity<ErrorResponse> handleAllocationIndexOutOfRange(
            AllocationIndexOutOfRangeException ex, HttpServletRequest request) {
        String correlationId = MDC.get("correlationId");
        log.error("Allocation index out of range [correlationId={}]: {}", correlationId, ex.getMessage());

        ErrorResponse error = ErrorResponse.of(
                HttpStatus.BAD_REQUEST.value(),
                "Index Out Of Range",
                ex.getMessage(),
                request.getRequestURI()
        );
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    @ExceptionHandler(ScheduleClosedException.class)
    public ResponseEntity<ErrorResponse> handleScheduleClosed(
            ScheduleClosedException ex, HttpServletRequest request) {
        String correlationId = MDC.get("correlationId");
        log.error("Vesting schedule closed [correlationId={}]: {}", correlationId, ex.getMessage());

        ErrorResponse error = ErrorResponse.of(
                HttpStatus.CONFLICT.value(),
                "Schedule Closed",
                ex.getMessage(),
                request.getRequestURI()
        );
        return ResponseEntity.status(HttpStatus.CONFLICT).body(error);
    }

    @ExceptionHandler(AlreadyFinalizedException.class)
    public ResponseEntity<ErrorResponse> handleAlreadyFinalized(
            AlreadyFinalizedException ex, HttpServletRequest request) {
        String correlationId = MDC.get("correlationId");
        log.error("Sale already finalized [correlationId={}]: {}", correlationId, ex.getMessage());

        ErrorResponse error = ErrorResponse.of(
                HttpStatus.CONFLICT.value(),
                "Already Finalized",
                ex.getMessage(),
                request.getRequestURI()
        );
        return ResponseEntity.status(HttpStatus.CONFLICT).body(error);
    }

    @ExceptionHandler(SaleFinalizedException.class)
    public ResponseEntity<ErrorResponse> handleSaleFinalized(
            SaleFinalizedException ex, HttpServletRequest request) {
        String correlationId = MDC.get("correlationId");
        log.error("Sale finalized [correlationId={}]: {}", correlationId, ex.getMessage());

        ErrorResponse error = ErrorResponse.of(
                HttpStatus.CONFLICT.value(),
                "Sale Finalized",
                ex.getMessage(),
                request.getRequestURI()
        );
        return ResponseEntity.status(HttpStatus.CONFLICT).body(error);
    }

    @ExceptionHandler(SaleAlreadyStartedException.class)
    public ResponseEntity<ErrorResponse> handleSaleAlreadyStarted(
            SaleAlreadyStartedException ex, HttpServletRequest request) {
        String correlationId = MDC.get("correlationId");
        log.error("Sale already started [correlationId={}]: {}", correlationId, ex.getMessage());

        ErrorResponse error = ErrorResponse.of(
                HttpStatus.CONFLICT.value(),
                "Sale Already Started",
                ex.getMessage(),
                request.getRequestURI()
        );
        return ResponseEntity.status(HttpStatus.CONFLICT).body(error);
    }

    @ExceptionHandler(SaleNotEndedException.class)
    public ResponseEntity<ErrorResponse> handleSaleNotEnded(
            SaleNotEndedException ex, HttpServletRequest request) {
        String correlationId = MDC.get("correlationId");
        log.error("Sale not ended [correlationId={}]: {}", correlationId, ex.getMessage());

        ErrorResponse error = ErrorResponse.of(
                HttpStatus.CONFLICT.value(),
                "Sale Not Ended",
                ex.getMessage(),
                request.getRequestURI()
        );
        return ResponseEntity.status(HttpStatus.CONFLICT).body(error);
    }

    @ExceptionHandler(IssuanceFrozenException.class)
    public ResponseEntity<ErrorResponse> handleIssuanceFrozen(
            IssuanceFrozenException ex, HttpServletRequest request) {
        String correlationId = MDC.get("correlationId");
        log.error("Reward issuance frozen [correlationId={}]: {}", correlationId, ex.getMessage());

        ErrorResponse error = ErrorResponse.of(
                HttpStatus.CONFLICT.value(),
                "Issuance Frozen",
                ex.getMessage(),
                request.getRequestURI()
        );
        return ResponseEntity.status(HttpStatus.CONFLICT).body(error);
    }

    @ExceptionHandler(RewardBookUnavailableException.class)
    public ResponseEntity<ErrorResponse> handleRewardBookUnavailable(
            RewardBookUnavailableException ex, HttpServletRequest request) {
        String correlationId = MDC.get("correlationId");
        log.error("Reward book unavailable [correlationId={}]: {}", correlationId, ex.getMessage());

        ErrorResponse error = ErrorResponse.of(
                HttpStatus.CONFLICT.value(),
                "Reward Book Unavailable",
                ex.getMessage(),
                request.getRequestURI()
        );
        return ResponseEntity.status(HttpStatus.CONFLICT).body(error);
    }

    @ExceptionHandler(RewardTransferFailedException.class)
    public ResponseEntity<ErrorResponse> handleRewardTransferFailed(
            RewardTransferFailedException ex, HttpServletRequest request) {
        String correlationId = MDC.get("correlationId");
        log.error("Reward transfer failed [correlationId={}]: {}", correlationId, ex.getMessage());

        ErrorResponse error = ErrorResponse.of(
                HttpStatus.CONFLICT.value(),
                "Reward Transfer Failed",
                ex.getMessage(),
                request.getRequestURI()
        );
        return ResponseEntity.status(HttpStatus.CONFLICT).body(error);
    }

    @ExceptionHandler(ArithmeticException.class)
    public ResponseEntity<ErrorResponse> handleArithmetic(
            ArithmeticException ex, HttpServletRequest request) {
        String correlationId = MDC.get("correlationId");
        log.error("Arithmetic error [correlationId={}]: {}", correlationId, ex.getMessage());

        ErrorResponse error = ErrorResponse.of(
                HttpStatus.UNPROCESSABLE_ENTITY.value(),
                "Arithmetic Error",
                ex.getMessage(),
                request.getRequestURI()
        );
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY).body(error);
    }

    @ExceptionHandler(EntityNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleEntityNotFound(
            EntityNotFoundException ex, HttpServletRequest request) {
        String correlationId = MDC.get("correlationId");
        log.error("Entity not found [correlationId={}]: {}", correlationId, ex.getMessage());

        ErrorResponse error = ErrorResponse.of(
                HttpStatus.NOT_FOUND.value(),
                "Entity Not Found",
                ex.getMessage(),
                request.getRequestURI()
        );
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(error);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgument(
            IllegalArgumentException ex, HttpServletRequest request) {
        String correlationId = MDC.get("correlationId");
        log.error("Illegal argument [correlationId={}]: {}", correlationId, ex.getMessage());

        ErrorResponse error = ErrorResponse.of(
                HttpStatus.BAD_REQUEST.value(),
                "Invalid Argument",
                ex.getMessage(),
                request.getRequestURI()
        );
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<ErrorResponse> handleIllegalState(
            IllegalStateException ex, HttpServletRequest request) {
        String correlationId = MDC.get("correlationId");
        log.error("Illegal state [correlationId={}]: {}", correlationId, ex.getMessage());

        ErrorResponse error = ErrorResponse.of(
                HttpStatus.CONFLICT.value(),
                "Invalid State",
                ex.getMessage(),
                request.getRequestURI()
        );
        return ResponseEntity.status(HttpStatus.CONFLICT).body(error);
    }

    @ExceptionHandler({MethodArgumentNotValidException.class, HandlerMethodValidationException.class,
            ConstraintViolationException.class, MissingRequestHeaderException.class,
            MissingServletRequestParameterException.class, MethodArgumentTypeMismatchException.class,
            HttpMessageNotReadableException.class})
    public ResponseEntity<ErrorResponse> handleValidation(
            Exception ex, HttpServletRequest request) {
        String correlationId = MDC.get("correlationId");
        log.error("Validation error [correlationId={}]: {}", correlationId, ex.getMessage());

        ErrorResponse error = ErrorResponse.of(
                HttpStatus.BAD_REQUEST.value(),
                "Validation Error",
                ex.getMessage(),
                request.getRequestURI()
        );
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(
            Exception ex, HttpServletRequest request) {
        String correlationId = MDC.get("correlationId");
        log.error("Unexpected error [correlationId={}]", correlationId, ex);

        ErrorResponse error = ErrorResponse.of(
                HttpStatus.INTERNAL_SERVER_ERROR.value(),
                "Internal Server Error",
                "An unexpected error occurred. Please contact support with correlation ID: " + correlationId,
                request.getRequestURI()
        );
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(error);
    }
}
