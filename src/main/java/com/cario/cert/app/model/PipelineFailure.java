package com.cario.cert.app.model;

/**
 * Tagged failure produced by a pipeline stage.
 *
 * @param stage name of the stage that failed (e.g. {@code fetch-template})
 * @param kind failure category
 * @param message human readable message, surfaced to the caller as {@code detail}
 */
public record PipelineFailure(String stage, ErrorKind kind, String message) {}
