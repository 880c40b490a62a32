package com.conflictdata.exception;

public class UsernameTakenException extends RuntimeException {

    private final String username;

    public UsernameTakenException(String username) {
        super("Username already exists");
        this.username = username;
    }

    public String getUsername() {
        return username;
    }
}
