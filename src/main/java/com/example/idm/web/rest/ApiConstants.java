package com.example.idm.web.rest;

import lombok.AccessLevel;
import lombok.NoArgsConstructor;

/**
 * Route placeholders resolved from the {@code idm.*} path settings.
 */
@NoArgsConstructor(access = AccessLevel.PRIVATE)
public final class ApiConstants {

  @NoArgsConstructor(access = AccessLevel.PRIVATE)
  public static final class ApiPath {
    public static final String OUTBOUND = "${idm.outbound-path:/login/out}";
    public static final String RETURN = "${idm.return-uri:/login/return}";
    public static final String LOGOUT = "${idm.logout-path:/logout}";
  }

  @NoArgsConstructor(access = AccessLevel.PRIVATE)
  public static final class Params {
    public static final String BACK_TO_PATH = "backToPath";
    public static final String POLICY_NAME = "policyName";
    public static final String JOURNEY = "journey";
    public static final String FORCE_LOGIN = "forceLogin";
    public static final String CODE = "code";
    public static final String STATE = "state";
    public static final String ERROR = "error";
    public static final String ERROR_DESCRIPTION = "error_description";
  }
}
