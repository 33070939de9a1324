package com.unconference.backend.modules.schedule.application;

public class GenerationCancelledException extends RuntimeException {

    public GenerationCancelledException() {
        super("Schedule generation was cancelled");
    }
}
