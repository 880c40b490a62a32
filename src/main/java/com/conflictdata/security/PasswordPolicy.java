package com.conflictdata.security;

/**
 * Password rules for registration: at least 8 characters and at least one '#'.
 */
public final class PasswordPolicy {

    public static final int MIN_LENGTH = 8;

    private PasswordPolicy() {
    }

    public record Result(boolean valid, String message) {
    }

    public static Result validate(String password) {
        if (password == null || password.length() < MIN_LENGTH) {
            return new Result(false, "Password must be at least 8 characters long.");
        }
        if (password.indexOf('#') < 0) {
            return new Result(false, "Password must contain at least one hashtag (#).");
        }
        return new Result(true, "Password is valid.");
    }
}
