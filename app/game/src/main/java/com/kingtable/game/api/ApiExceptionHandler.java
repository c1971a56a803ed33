package com.kingtable.game.api;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class ApiExceptionHandler {

  private static final Logger logger = LoggerFactory.getLogger(ApiExceptionHandler.class);

  @ExceptionHandler(InvalidGameRequestException.class)
  public ResponseEntity<ApiErrorResponse> handleInvalidRequest(InvalidGameRequestException ex) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(new ApiErrorResponse(ex.code(), ex.getMessage()));
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ApiErrorResponse> handleValidation(MethodArgumentNotValidException ex) {
    final String message =
        ex.getBindingResult().getFieldErrors().stream()
            .findFirst()
            .map(error -> error.getField() + " " + error.getDefaultMessage())
            .orElse("request validation failed");
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(new ApiErrorResponse(ApiErrorCode.BAD_REQUEST, message));
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<ApiErrorResponse> handleUnreadable(HttpMessageNotReadableException ex) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(new ApiErrorResponse(ApiErrorCode.BAD_REQUEST, "invalid JSON body"));
  }

  @ExceptionHandler(DuplicatePlayerException.class)
  public ResponseEntity<ApiErrorResponse> handleDuplicate(DuplicatePlayerException ex) {
    return ResponseEntity.status(HttpStatus.CONFLICT)
        .body(new ApiErrorResponse(ApiErrorCode.DUPLICATE_PLAYER_ID, ex.getMessage()));
  }

  @ExceptionHandler(GameNotFoundException.class)
  public ResponseEntity<ApiErrorResponse> handleGameNotFound(GameNotFoundException ex) {
    return ResponseEntity.status(HttpStatus.NOT_FOUND)
        .body(new ApiErrorResponse(ApiErrorCode.GAME_NOT_FOUND, ex.getMessage()));
  }

  @ExceptionHandler(PlayerNotFoundException.class)
  public ResponseEntity<ApiErrorResponse> handlePlayerNotFound(PlayerNotFoundException ex) {
    return ResponseEntity.status(HttpStatus.NOT_FOUND)
        .body(new ApiErrorResponse(ApiErrorCode.PLAYER_NOT_FOUND, ex.getMessage()));
  }

  @ExceptionHandler(GameStateConflictException.class)
  public ResponseEntity<ApiErrorResponse> handleConflict(GameStateConflictException ex) {
    return ResponseEntity.status(HttpStatus.CONFLICT)
        .body(new ApiErrorResponse(ex.code(), ex.getMessage()));
  }

  @ExceptionHandler(PersistenceDisabledException.class)
  public ResponseEntity<ApiErrorResponse> handlePersistenceDisabled(
      PersistenceDisabledException ex) {
    return ResponseEntity.status(HttpStatus.NOT_IMPLEMENTED)
        .body(new ApiErrorResponse(ApiErrorCode.PERSISTENCE_DISABLED, ex.getMessage()));
  }

  @ExceptionHandler(RuntimeException.class)
  public ResponseEntity<ApiErrorResponse> handleRuntime(RuntimeException ex) {
    logger.error("unhandled error", ex);
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .body(new ApiErrorResponse(ApiErrorCode.INTERNAL_ERROR, ex.getMessage()));
  }
}
