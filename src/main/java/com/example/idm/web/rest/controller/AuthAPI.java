package com.example.idm.web.rest.controller;

import static com.example.idm.web.rest.ApiConstants.ApiPath.*;
import static com.example.idm.web.rest.ApiConstants.Params.*;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestParam;

@Tag(
    name = "Authentication",
    description = "Login round trip through the identity broker and local session logout"
)
public interface AuthAPI {

  @Operation(
      summary = "Start a login",
      description = "Persists the request state and redirects to the identity provider's authorization endpoint"
  )
  @ApiResponses(value = {
      @ApiResponse(responseCode = "302", description = "Redirect to identity provider"),
      @ApiResponse(responseCode = "502", description = "Identity provider unavailable"),
      @ApiResponse(responseCode = "503", description = "Session store unavailable")
  })
  @GetMapping(value = OUTBOUND)
  ResponseEntity<Void> outbound(
      @Parameter(description = "Local path to return to after login", example = "/account")
      @RequestParam(value = BACK_TO_PATH, required = false) String backToPath,
      @Parameter(description = "Identity provider policy")
      @RequestParam(value = POLICY_NAME, required = false) String policyName,
      @Parameter(description = "Identity broker journey")
      @RequestParam(value = JOURNEY, required = false) String journey,
      @Parameter(description = "Bypass an existing provider session", example = "yes")
      @RequestParam(value = FORCE_LOGIN, required = false) String forceLogin
                               );

  @Operation(
      summary = "Login callback",
      description = "Receives the provider's form_post response, stores the session and returns to the original path"
  )
  @ApiResponses(value = {
      @ApiResponse(responseCode = "302", description = "Redirect to the original path or the disallowed path"),
      @ApiResponse(responseCode = "502", description = "Token exchange failed")
  })
  @PostMapping(value = RETURN, consumes = MediaType.APPLICATION_FORM_URLENCODED_VALUE)
  ResponseEntity<Void> callback(
      @RequestParam(value = CODE, required = false) String code,
      @RequestParam(value = STATE, required = false) String state,
      @RequestParam(value = ERROR, required = false) String error,
      @RequestParam(value = ERROR_DESCRIPTION, required = false) String errorDescription,
      HttpServletRequest request,
      HttpServletResponse response
                               );

  @Operation(
      summary = "Logout",
      description = "Drops the cached session credentials and clears the session cookie"
  )
  @ApiResponses(value = {
      @ApiResponse(responseCode = "302", description = "Redirect to the default path")
  })
  @GetMapping(value = LOGOUT)
  ResponseEntity<Void> logout(HttpServletRequest request, HttpServletResponse response);
}
