package com.example.shifthybrid.generator;

/**
 * One step of the rule-based pipeline. Must leave locked cells alone and be idempotent
 * once the pipeline has reached its fixed point.
 */
public interface GenerationStage {

    String name();

    /**
     * @return number of cells whose value changed
     */
    int apply(GenerationContext context);
}
