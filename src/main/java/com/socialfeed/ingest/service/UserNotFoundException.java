package com.socialfeed.ingest.service;

public class UserNotFoundException extends RuntimeException {
    public UserNotFoundException(Long userId) {
        super("User " + userId + " not found");
    }
}
