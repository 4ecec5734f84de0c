package fr.lapetina.chatgateway.domain.event;

/**
 * Lifecycle state of a chat request event in the Disruptor pipeline.
 */
public enum EventState {
    /** Event just created, awaiting validation */
    CREATED,

    /** Request validated successfully */
    VALIDATED,

    /** Validation failed */
    VALIDATION_FAILED,

    /** Prompt flattened and model resolved */
    TRANSLATED,

    /** Model alias unknown or message not translatable */
    TRANSLATION_FAILED,

    /** Handed to a dispatch worker */
    DISPATCHED,

    /** Completed without reaching the dispatcher */
    FAILED
}
