/*
 * Copyright 2022 Rackspace US, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */


package com.rackspace.promsketch.app.web;

import com.rackspace.promsketch.app.model.ApiErrorResponse;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ServerWebInputException;

/**
 * Maps validation failures raised by the control plane and query controllers to 400.
 */
@ControllerAdvice
@Slf4j
public class AbstractRestExceptionHandler {

  @ExceptionHandler(IllegalArgumentException.class)
  public ResponseEntity<?> handleIllegalArgumentException(IllegalArgumentException e) {
    log.debug("Rejected request: {}", e.getMessage());
    return badRequest(e.getMessage());
  }

  @ExceptionHandler(WebExchangeBindException.class)
  public ResponseEntity<?> handleBindException(WebExchangeBindException e) {
    final String message = e.getFieldErrors().stream()
        .map(error -> error.getField() + " " + error.getDefaultMessage())
        .collect(Collectors.joining(", "));
    return badRequest(message.isEmpty() ? e.getReason() : message);
  }

  @ExceptionHandler(ServerWebInputException.class)
  public ResponseEntity<?> handleServerWebInputException(ServerWebInputException e) {
    log.trace("Malformed request", e);
    return badRequest(e.getReason());
  }

  private ResponseEntity<?> badRequest(String message) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(mapToApiErrorResponse(HttpStatus.BAD_REQUEST.value(), message));
  }

  private ApiErrorResponse mapToApiErrorResponse(int status, String message) {
    return new ApiErrorResponse().setStatus(status).setMessage(message);
  }
}
