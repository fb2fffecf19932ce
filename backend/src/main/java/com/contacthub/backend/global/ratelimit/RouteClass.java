package com.contacthub.backend.global.ratelimit;

/**
 * Groups of routes that share one admission budget.
 */
public enum RouteClass {
    LOGIN,
    REGISTER,
    PASSWORD_RESET,
    EMAIL,
    PROFILE,
    DEFAULT
}
