package com.example.shifthybrid.exception;

import java.util.List;

public class GenerationCancelledException extends ScheduleGenerationException {

    public GenerationCancelledException(String stage) {
        super("GENERATION_CANCELLED", "Generation cancelled before stage " + stage, null, List.of());
    }
}
