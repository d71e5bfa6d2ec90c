package com.missioncontrol.core.model;

/**
 * Thrown when caller input is malformed or missing a required value.
 * Nothing is written and nothing is broadcast when this is raised.
 */
public class ValidationException extends RuntimeException {
    public ValidationException(String message) {
        super(message);
    }
}
