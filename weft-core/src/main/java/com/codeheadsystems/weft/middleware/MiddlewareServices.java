package com.codeheadsystems.weft.middleware;

import com.codeheadsystems.weft.config.WeftConfig;
import com.codeheadsystems.weft.crypto.TokenCipher;
import com.codeheadsystems.weft.session.SessionStore;
import java.time.Clock;

/**
 * Application services handed to middleware factories.
 *
 * @param config       the application configuration
 * @param sessionStore the session store
 * @param tokenCipher  the process-wide token cipher
 * @param clock        the clock used for expiry decisions
 */
public record MiddlewareServices(
    WeftConfig config,
    SessionStore sessionStore,
    TokenCipher tokenCipher,
    Clock clock) {
}
