package com.authgate.backend.modules.auth.domain;

/**
 * How credentials are minted and checked: signed self-contained JWTs or random strings
 * looked up server-side.
 */
public enum TokenMode {
    JWT,
    OPAQUE
}
