package dev.resumescreener.service;

public class ResumeNotFoundException extends RuntimeException {

    public ResumeNotFoundException(String resumeId) {
        super("Resume not found: " + resumeId);
    }
}
